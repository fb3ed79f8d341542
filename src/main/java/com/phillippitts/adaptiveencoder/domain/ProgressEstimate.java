package com.phillippitts.adaptiveencoder.domain;

import java.util.OptionalLong;

/**
 * Progress derived from a {@link ProgressSample}; recomputed each tick.
 *
 * @param fractionComplete progress in [0,1]
 * @param etaSeconds remaining time, empty when unknown or unreliable
 * @param estimatedFinalSizeBytes projected output size, empty below the projection threshold
 * @param stalled true when progress has not moved for the stall window
 */
public record ProgressEstimate(
        double fractionComplete,
        OptionalLong etaSeconds,
        OptionalLong estimatedFinalSizeBytes,
        boolean stalled
) {
    public ProgressEstimate {
        if (fractionComplete < 0 || fractionComplete > 1) {
            throw new IllegalArgumentException("fractionComplete must be within [0,1]: " + fractionComplete);
        }
    }

    public int percent() {
        return (int) Math.floor(fractionComplete * 100);
    }

    /**
     * Copy with the ETA suppressed, used while progress is stalled.
     */
    public ProgressEstimate asStalled() {
        return new ProgressEstimate(fractionComplete, OptionalLong.empty(), estimatedFinalSizeBytes, true);
    }
}
