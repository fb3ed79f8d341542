package com.phillippitts.adaptiveencoder.domain;

import java.time.Instant;

/**
 * One block of the encoder's structured progress feed.
 *
 * @param wallClock when the block was received
 * @param outputTimeMicros encoded media time in microseconds
 * @param frameIndex frames encoded so far
 * @param fps instantaneous encoding frame rate
 * @param speed encoding speed relative to real time (0 when unknown)
 * @param totalSizeBytes bytes written so far (0 when unknown)
 * @param finished true for the final block of the feed
 */
public record ProgressSample(
        Instant wallClock,
        long outputTimeMicros,
        long frameIndex,
        double fps,
        double speed,
        long totalSizeBytes,
        boolean finished
) {}
