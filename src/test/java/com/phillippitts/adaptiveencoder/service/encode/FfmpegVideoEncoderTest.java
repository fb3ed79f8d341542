package com.phillippitts.adaptiveencoder.service.encode;

import com.phillippitts.adaptiveencoder.config.properties.ProgressProperties;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.phillippitts.adaptiveencoder.testutil.ProcessTestDoubles.ProcessBehavior;
import static com.phillippitts.adaptiveencoder.testutil.ProcessTestDoubles.ScriptedProcessFactory;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FfmpegVideoEncoderTest {

    @Test
    void exposesProgressFeedAndDiagnosticTail() throws Exception {
        // Arrange
        ScriptedProcessFactory factory = ScriptedProcessFactory.of(
                ProcessBehavior.of("frame=10\nprogress=end\n", "line1\nline2\nline3\n", 0));
        FfmpegVideoEncoder encoder = new FfmpegVideoEncoder(factory, new ProgressProperties(10, 24, 0.01, 2));

        // Act
        RunningPass pass = encoder.start(List.of("/opt/ffmpeg", "-i", "in.mkv"), "crf");
        String progress = new String(pass.progressStream().readAllBytes(), StandardCharsets.UTF_8);
        int exit = pass.waitFor();

        // Assert
        assertThat(exit).isZero();
        assertThat(progress).contains("progress=end");
        assertThat(pass.diagnostics().text()).isEqualTo("line2\nline3");
        assertThat(factory.commands()).containsExactly(List.of("/opt/ffmpeg", "-i", "in.mkv"));
    }

    @Test
    void startFailurePropagates() {
        ScriptedProcessFactory factory = ScriptedProcessFactory.of().failingWith(new IOException("no such file"));
        FfmpegVideoEncoder encoder = new FfmpegVideoEncoder(factory, new ProgressProperties());

        assertThatThrownBy(() -> encoder.start(List.of("/missing/ffmpeg"), "crf"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("no such file");
    }
}
