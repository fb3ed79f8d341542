package com.phillippitts.adaptiveencoder.config.validation;

import com.phillippitts.adaptiveencoder.config.properties.EncoderBinariesProperties;
import com.phillippitts.adaptiveencoder.exception.BinaryNotFoundException;
import com.phillippitts.adaptiveencoder.exception.FailureKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BinaryValidationServiceTest {

    @TempDir
    Path tmp;

    private Path executable(String name) throws IOException {
        Path file = Files.writeString(tmp.resolve(name), "#!/bin/sh\n");
        assertThat(file.toFile().setExecutable(true)).isTrue();
        return file;
    }

    private static EncoderBinariesProperties binaries(String ffmpeg, String ffprobe) {
        return new EncoderBinariesProperties(ffmpeg, ffprobe, 60, 600, 65536);
    }

    @Test
    void passesWhenBothBinariesAreExecutable() throws IOException {
        BinaryValidationService service = new BinaryValidationService(
                binaries(executable("ffmpeg").toString(), executable("ffprobe").toString()));

        assertThatCode(service::validateOnStartup).doesNotThrowAnyException();
    }

    @Test
    void missingFfprobeFailsStartupWithPropertyHint() throws IOException {
        String missing = tmp.resolve("nope/ffprobe").toString();
        BinaryValidationService service = new BinaryValidationService(
                binaries(executable("ffmpeg").toString(), missing));

        assertThatThrownBy(service::validateOnStartup)
                .isInstanceOf(BinaryNotFoundException.class)
                .hasMessageContaining("ffprobe not found")
                .hasMessageContaining("encoder.binaries.ffprobe-path")
                .satisfies(e -> assertThat(((BinaryNotFoundException) e).getKind())
                        .isEqualTo(FailureKind.CONFIGURATION));
    }
}
