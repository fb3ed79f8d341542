package com.phillippitts.adaptiveencoder.service.progress;

import java.time.Duration;
import java.time.Instant;

/**
 * Tracks how long the progress fraction has stayed unchanged (to four decimals).
 * A stall never stops the pass; it only marks the ETA as stale.
 */
final class StallDetector {

    private final Duration window;
    private long lastKey = Long.MIN_VALUE;
    private Instant unchangedSince;

    StallDetector(Duration window) {
        this.window = window;
    }

    /**
     * @return true when the fraction has not moved for at least the window
     */
    boolean update(double fraction, Instant now) {
        long key = Math.round(fraction * 10_000);
        if (key != lastKey || unchangedSince == null) {
            lastKey = key;
            unchangedSince = now;
            return false;
        }
        return Duration.between(unchangedSince, now).compareTo(window) >= 0;
    }
}
