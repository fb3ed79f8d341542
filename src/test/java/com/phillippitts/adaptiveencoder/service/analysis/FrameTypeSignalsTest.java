package com.phillippitts.adaptiveencoder.service.analysis;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FrameTypeSignalsTest {

    @Test
    void temporalInfoIsInterFramePercentage() {
        assertThat(FrameTypeSignals.temporalInfo("IPBB", 900, 50)).isEqualTo(75.0);
    }

    @Test
    void frameTypeComplexityIsIntraDensity() {
        assertThat(FrameTypeSignals.frameTypeComplexity("IPBB", 1800, 4)).isEqualTo(50.0);
        assertThat(FrameTypeSignals.frameTypeComplexity("IPBBPBBPBB", 1800, 4)).isEqualTo(20.0);
    }

    @Test
    void onlyTheLeadingWindowCounts() {
        assertThat(FrameTypeSignals.temporalInfo("PPPPI", 4, 50)).isEqualTo(100.0);
        assertThat(FrameTypeSignals.frameTypeComplexity("PPPPI", 4, 4)).isZero();
    }

    @Test
    void emptySequenceUsesFallback() {
        assertThat(FrameTypeSignals.temporalInfo("", 900, 50)).isEqualTo(50.0);
        assertThat(FrameTypeSignals.frameTypeComplexity(null, 1800, 4)).isEqualTo(4.0);
    }
}
