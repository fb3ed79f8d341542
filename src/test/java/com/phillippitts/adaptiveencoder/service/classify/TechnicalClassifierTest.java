package com.phillippitts.adaptiveencoder.service.classify;

import com.phillippitts.adaptiveencoder.domain.Classification;
import com.phillippitts.adaptiveencoder.domain.ClassificationSource;
import com.phillippitts.adaptiveencoder.domain.ComplexityScore;
import com.phillippitts.adaptiveencoder.domain.ComplexitySignals;
import com.phillippitts.adaptiveencoder.domain.ContentType;
import com.phillippitts.adaptiveencoder.domain.MediaProbe;
import com.phillippitts.adaptiveencoder.testutil.Probes;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TechnicalClassifierTest {

    private static final MediaProbe HD = Probes.of(1920, 1080, 600, 10_000_000L);
    private static final MediaProbe SCOPE = Probes.of(1920, 800, 600, 10_000_000L);
    private static final MediaProbe UHD = Probes.of(3840, 2160, 600, 40_000_000L);

    @Test
    void cleanWidescreenIsThreeDAnimation() {
        Classification c = TechnicalClassifier.classify(HD, 0, 5);

        assertThat(c).isEqualTo(Classification.of(ContentType.ANIMATION_3D, 80, ClassificationSource.TECHNICAL));
    }

    @Test
    void cinemaScopeIsNotThreeD() {
        assertThat(TechnicalClassifier.classify(SCOPE, 0, 5).type()).isEqualTo(ContentType.ANIME);
    }

    @Test
    void lowGrainCalmHdIsAnime() {
        Classification c = TechnicalClassifier.classify(HD, 2, 5);

        assertThat(c.type()).isEqualTo(ContentType.ANIME);
        assertThat(c.confidence()).isEqualTo(70);
    }

    @Test
    void grainBands() {
        assertThat(TechnicalClassifier.classify(UHD, 20, 10).type()).isEqualTo(ContentType.HEAVY_GRAIN);
        assertThat(TechnicalClassifier.classify(UHD, 15, 10).type()).isEqualTo(ContentType.HEAVY_GRAIN);
        assertThat(TechnicalClassifier.classify(UHD, 8, 10).type()).isEqualTo(ContentType.LIGHT_GRAIN);
        assertThat(TechnicalClassifier.classify(UHD, 5, 10).type()).isEqualTo(ContentType.FILM);
    }

    @Test
    void highMotionIsAction() {
        Classification c = TechnicalClassifier.classify(UHD, 4, 25);

        assertThat(c.type()).isEqualTo(ContentType.ACTION);
        assertThat(c.confidence()).isEqualTo(75);
    }

    @Test
    void motionLevelFromSceneCuts() {
        assertThat(TechnicalClassifier.motionLevel(51)).isEqualTo(25);
        assertThat(TechnicalClassifier.motionLevel(50)).isEqualTo(10);
        assertThat(TechnicalClassifier.motionLevel(10)).isEqualTo(10);
        assertThat(TechnicalClassifier.motionLevel(9)).isEqualTo(5);
    }

    @Test
    void grainEstimateFromBitrate() {
        assertThat(TechnicalClassifier.estimateGrain(Probes.withCodec(1920, 1080, "h264", 35_000_000L))).isEqualTo(1);
        assertThat(TechnicalClassifier.estimateGrain(Probes.withCodec(3840, 2160, "hevc", 60_000_000L))).isEqualTo(1);
        assertThat(TechnicalClassifier.estimateGrain(Probes.withCodec(3840, 2160, "hevc", 40_000_000L))).isEqualTo(3);
        assertThat(TechnicalClassifier.estimateGrain(Probes.withCodec(1920, 1080, "hevc", 25_000_000L))).isEqualTo(2);
        assertThat(TechnicalClassifier.estimateGrain(Probes.withCodec(1920, 1080, "hevc", 10_000_000L))).isEqualTo(8);
    }

    @Test
    void withoutAnalysisUsesProbeEstimate() {
        // 10 Mb/s HD estimates grain 8 with default motion
        Classification c = TechnicalClassifier.classify(HD, ComplexityScore.neutral());

        assertThat(c.type()).isEqualTo(ContentType.LIGHT_GRAIN);
    }

    @Test
    void unmeasuredGrainIsEstimatedNotReadAsZero() {
        // Grain sampling failed (default 0); scene cuts measured at 4 (low motion)
        ComplexitySignals signals = new ComplexitySignals(50, 50, 4, 4, 0, 0, false, false, true);

        Classification c = TechnicalClassifier.classify(HD, new ComplexityScore(60, signals));

        assertThat(c).isEqualTo(Classification.of(ContentType.LIGHT_GRAIN, 70, ClassificationSource.TECHNICAL));
    }

    @Test
    void measuredZeroGrainStillCountsAsClean() {
        ComplexitySignals signals = new ComplexitySignals(50, 50, 4, 4, 0, 0, false, true, true);

        Classification c = TechnicalClassifier.classify(HD, new ComplexityScore(60, signals));

        assertThat(c.type()).isEqualTo(ContentType.ANIMATION_3D);
    }
}
