package com.phillippitts.adaptiveencoder.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void encoderExceptionCarriesKindMessageAndCause() {
        IOException cause = new IOException("IO failure");
        EncoderException ex = new EncoderException(FailureKind.INTERNAL, "wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
        assertThat(ex.getKind()).isEqualTo(FailureKind.INTERNAL);
    }

    @Test
    void probeFailureIncludesInput() {
        ProbeFailureException ex = new ProbeFailureException("No video stream", "/media/movie.mkv");

        assertThat(ex.getMessage()).contains("No video stream").contains("/media/movie.mkv");
        assertThat(ex.getInput()).isEqualTo("/media/movie.mkv");
        assertThat(ex.getKind()).isEqualTo(FailureKind.PROBE);
    }

    @Test
    void analysisFailureIncludesSignal() {
        AnalysisException ex = new AnalysisException("Filter produced no output", "temporal");

        assertThat(ex.getMessage()).contains("temporal");
        assertThat(ex.getSignal()).isEqualTo("temporal");
        assertThat(ex.getKind()).isEqualTo(FailureKind.ANALYSIS);
    }

    @Test
    void unknownProfileIncludesName() {
        UnknownProfileException ex = new UnknownProfileException("8k_film");

        assertThat(ex.getMessage()).isEqualTo("Unknown encoding profile: 8k_film");
        assertThat(ex.getProfileName()).isEqualTo("8k_film");
        assertThat(ex.getKind()).isEqualTo(FailureKind.PROFILE);
    }

    @Test
    void remainingKindsMapToTheirFailureKind() {
        assertThat(new ClassificationException("bad").getKind()).isEqualTo(FailureKind.CLASSIFICATION);
        assertThat(new CropDetectionException("bad").getKind()).isEqualTo(FailureKind.CROP_DETECTION);
        assertThat(new BinaryNotFoundException("ffmpeg missing").getKind()).isEqualTo(FailureKind.CONFIGURATION);
        assertThat(new PassFailureException("pass failed", 1, 1, null).getKind()).isEqualTo(FailureKind.PASS);
    }

    @Test
    void passFailureNormalizesMissingTail() {
        PassFailureException ex = new PassFailureException("pass failed", 2, 137, null);

        assertThat(ex.getPassIndex()).isEqualTo(2);
        assertThat(ex.getExitCode()).isEqualTo(137);
        assertThat(ex.getDiagnosticTail()).isEmpty();
    }

    @Test
    void allSubclassesAreEncoderExceptions() {
        assertThat(new ProbeFailureException("m", "i")).isInstanceOf(EncoderException.class);
        assertThat(new PassFailureException("m", 1, 1, "")).isInstanceOf(EncoderException.class);
        assertThat(new UnknownProfileException("p")).isInstanceOf(RuntimeException.class);
    }
}
