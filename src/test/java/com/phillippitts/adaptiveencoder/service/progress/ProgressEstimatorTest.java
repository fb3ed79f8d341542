package com.phillippitts.adaptiveencoder.service.progress;

import com.phillippitts.adaptiveencoder.domain.ProgressEstimate;
import com.phillippitts.adaptiveencoder.domain.ProgressSample;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ProgressEstimatorTest {

    private static final ProgressTarget TARGET = new ProgressTarget("CRF", 100, 2400, 1);
    private final ProgressEstimator estimator = new ProgressEstimator(24, 0.01);

    private static ProgressSample sample(long frame, double outSeconds, double fps, double speed, long size) {
        return new ProgressSample(Instant.EPOCH, (long) (outSeconds * 1_000_000), frame, fps, speed, size, false);
    }

    @Test
    void framesDriveFractionWhenAvailable() {
        assertThat(ProgressEstimator.fraction(sample(240, 50, 0, 0, 0), TARGET)).isCloseTo(0.1, within(1e-9));
    }

    @Test
    void outputTimeIsTheFallback() {
        assertThat(ProgressEstimator.fraction(sample(0, 25, 0, 0, 0), TARGET)).isCloseTo(0.25, within(1e-9));
        assertThat(ProgressEstimator.fraction(sample(3000, 40, 0, 0, 0), TARGET)).isCloseTo(0.4, within(1e-9));
        assertThat(ProgressEstimator.fraction(sample(0, 140, 0, 0, 0), TARGET)).isEqualTo(1.0);
        assertThat(ProgressEstimator.fraction(sample(0, 10, 0, 0, 0), new ProgressTarget("x", 0, 0, 1))).isZero();
    }

    @Test
    void etaExtrapolatesElapsedTime() {
        ProgressEstimate e = estimator.estimate(sample(240, 10, 0, 0, 0), TARGET, 10);

        assertThat(e.etaSeconds()).hasValue(90);
    }

    @Test
    void frameRateEstimateReplacesExtrapolation() {
        // 2160 remaining frames at 48 fps
        ProgressEstimate e = estimator.estimate(sample(240, 10, 48, 0, 0), TARGET, 10);

        assertThat(e.etaSeconds()).hasValue(45);
    }

    @Test
    void speedScalesEstimate() {
        ProgressEstimate e = estimator.estimate(sample(240, 10, 48, 1.5, 0), TARGET, 10);

        assertThat(e.etaSeconds()).hasValue(30);
    }

    @Test
    void noEtaBeforeEnoughProgress() {
        ProgressEstimate e = estimator.estimate(sample(10, 0, 0, 0, 0), TARGET, 10);

        assertThat(e.etaSeconds()).isEmpty();
    }

    @Test
    void implausibleEtaIsDiscarded() {
        ProgressEstimator capped = new ProgressEstimator(1, 0.01);

        ProgressEstimate e = capped.estimate(sample(1200, 50, 0, 0, 0), TARGET, 4000);

        assertThat(e.etaSeconds()).isEmpty();
    }

    @Test
    void finalSizeProjectedAboveThreshold() {
        ProgressEstimate early = estimator.estimate(sample(12, 0, 0, 0, 1_000), TARGET, 1);
        ProgressEstimate later = estimator.estimate(sample(240, 10, 0, 0, 1_048_576), TARGET, 10);

        assertThat(early.estimatedFinalSizeBytes()).isEmpty();
        assertThat(later.estimatedFinalSizeBytes()).hasValue(10_485_760);
    }

    @Test
    void finishedSampleIsComplete() {
        ProgressSample end = new ProgressSample(Instant.EPOCH, 0, 0, 0, 0, 0, true);

        ProgressEstimate e = estimator.estimate(end, TARGET, 100);

        assertThat(e.fractionComplete()).isEqualTo(1.0);
        assertThat(e.etaSeconds()).hasValue(0);
        assertThat(e.percent()).isEqualTo(100);
    }

    @Test
    void stalledCopyDropsEta() {
        ProgressEstimate e = estimator.estimate(sample(240, 10, 0, 0, 0), TARGET, 10).asStalled();

        assertThat(e.stalled()).isTrue();
        assertThat(e.etaSeconds()).isEmpty();
        assertThat(e.fractionComplete()).isCloseTo(0.1, within(1e-9));
    }
}
