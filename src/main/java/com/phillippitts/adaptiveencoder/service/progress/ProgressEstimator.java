package com.phillippitts.adaptiveencoder.service.progress;

import com.phillippitts.adaptiveencoder.domain.ProgressEstimate;
import com.phillippitts.adaptiveencoder.domain.ProgressSample;

import java.util.OptionalLong;

/**
 * Pure progress, ETA and output-size estimation.
 *
 * <p>Fraction: frame-based ({@code frame / totalFrames}) when it lies in (0, 1], otherwise
 * time-based ({@code outTime / duration}) clamped to 1.
 *
 * <p>ETA: {@code elapsed / p - elapsed} once {@code p > 0.01}; replaced by
 * {@code remainingFrames / fps} when that is positive and under twice the first estimate (or no
 * first estimate exists); then divided by the speed multiplier when known. ETAs over the cap are
 * discarded.
 */
public final class ProgressEstimator {

    static final double MIN_EXTRAPOLATION_FRACTION = 0.01;

    private final long maxEtaSeconds;
    private final double minSizeProjectionFraction;

    public ProgressEstimator(int maxEtaHours, double minSizeProjectionFraction) {
        this.maxEtaSeconds = maxEtaHours * 3600L;
        this.minSizeProjectionFraction = minSizeProjectionFraction;
    }

    public ProgressEstimate estimate(ProgressSample sample, ProgressTarget target, double elapsedSeconds) {
        double p = sample.finished() ? 1.0 : fraction(sample, target);
        OptionalLong eta = sample.finished() ? OptionalLong.of(0) : eta(p, elapsedSeconds, sample, target);
        OptionalLong size = p > minSizeProjectionFraction && sample.totalSizeBytes() > 0
                ? OptionalLong.of(Math.round(sample.totalSizeBytes() / p))
                : OptionalLong.empty();
        return new ProgressEstimate(p, eta, size, false);
    }

    static double fraction(ProgressSample sample, ProgressTarget target) {
        if (target.totalFrames() > 0) {
            double byFrames = (double) sample.frameIndex() / target.totalFrames();
            if (byFrames > 0 && byFrames <= 1) {
                return byFrames;
            }
        }
        if (target.durationSeconds() > 0) {
            double byTime = sample.outputTimeMicros() / 1_000_000.0 / target.durationSeconds();
            return Math.max(0, Math.min(1, byTime));
        }
        return 0;
    }

    OptionalLong eta(double p, double elapsedSeconds, ProgressSample sample, ProgressTarget target) {
        double estimate = 0;
        if (p > MIN_EXTRAPOLATION_FRACTION) {
            double byProgress = elapsedSeconds / p - elapsedSeconds;
            if (byProgress > 0) {
                estimate = byProgress;
            }
        }
        if (sample.fps() > 0 && target.totalFrames() > 0 && p > 0) {
            double remainingFrames = target.totalFrames() * (1 - p);
            double byFrames = remainingFrames / sample.fps();
            if (byFrames > 0 && (estimate == 0 || byFrames < estimate * 2)) {
                estimate = byFrames;
            }
        }
        if (sample.speed() > 0 && estimate > 0) {
            estimate = estimate / sample.speed();
        }
        long seconds = (long) estimate;
        if (seconds <= 0 || seconds > maxEtaSeconds) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(seconds);
    }
}
