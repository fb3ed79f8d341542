package com.phillippitts.adaptiveencoder.service.analysis;

import com.phillippitts.adaptiveencoder.config.properties.AnalysisProperties;
import com.phillippitts.adaptiveencoder.config.properties.EncoderBinariesProperties;
import com.phillippitts.adaptiveencoder.exception.AnalysisException;
import com.phillippitts.adaptiveencoder.service.process.ProcessRunner;
import com.phillippitts.adaptiveencoder.testutil.Probes;
import com.phillippitts.adaptiveencoder.testutil.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.adaptiveencoder.testutil.ProcessTestDoubles.ScriptedProcessFactory;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FfmpegSignalExtractorTest {

    private static final Path INPUT = Path.of("/media/movie.mkv");

    private static FfmpegSignalExtractor extractor(ScriptedProcessFactory factory) {
        EncoderBinariesProperties binaries = new EncoderBinariesProperties();
        return new FfmpegSignalExtractor(new ProcessRunner(factory, binaries), binaries, new AnalysisProperties());
    }

    @Test
    void spatialInfoAveragesEdgeMeans() {
        // Arrange
        String stderr = """
                [Parsed_metadata_5 @ 0x1] frame:0    pts:0       pts_time:0
                [Parsed_metadata_5 @ 0x1] lavfi.signalstats.YAVG=40.5
                [Parsed_metadata_5 @ 0x1] frame:1    pts:1       pts_time:1
                [Parsed_metadata_5 @ 0x1] lavfi.signalstats.YAVG=59.5
                """;
        ScriptedProcessFactory factory = ScriptedProcessFactory.of(ProcessBehavior.of("", stderr, 0));

        // Act
        double si = extractor(factory).spatialInfo(INPUT);

        // Assert
        assertThat(si).isEqualTo(50.0);
        List<String> cmd = factory.commands().get(0);
        assertThat(cmd).containsSequence("-t", "30", "-i", INPUT.toString());
        assertThat(cmd).containsSequence("-f", "null", "-");
    }

    @Test
    void spatialInfoWithoutStatisticsFails() {
        ScriptedProcessFactory factory = ScriptedProcessFactory.of(ProcessBehavior.of("", "nothing useful", 0));

        assertThatThrownBy(() -> extractor(factory).spatialInfo(INPUT))
                .isInstanceOf(AnalysisException.class)
                .satisfies(e -> assertThat(((AnalysisException) e).getSignal()).isEqualTo("spatial"));
    }

    @Test
    void sceneCutsCountsShowinfoFrames() {
        String stderr = """
                [Parsed_showinfo_1 @ 0x1] config in time_base: 1/1000
                [Parsed_showinfo_1 @ 0x1] n:   0 pts:  41708 pts_time:41.708
                [Parsed_showinfo_1 @ 0x1] n:   1 pts:  52052 pts_time:52.052
                [Parsed_showinfo_1 @ 0x1] n:   2 pts:  58100 pts_time:58.1
                """;
        ScriptedProcessFactory factory = ScriptedProcessFactory.of(ProcessBehavior.of("", stderr, 0));

        int cuts = extractor(factory).sceneCuts(INPUT);

        assertThat(cuts).isEqualTo(3);
        assertThat(factory.commands().get(0)).contains("select='gt(scene,0.30)',showinfo");
    }

    @Test
    void grainWindowIsCenteredAndSized() {
        byte[] pixels = new byte[64 * 64];
        ScriptedProcessFactory factory = ScriptedProcessFactory.of(new ProcessBehavior(pixels, "", 0, 0));

        GrayFrame frame = extractor(factory).grainWindow(INPUT, Probes.sdr1080p(), 60, 64);

        assertThat(frame.width()).isEqualTo(64);
        assertThat(frame.height()).isEqualTo(64);
        assertThat(factory.commands().get(0)).containsSequence("-ss", "60.000");
        assertThat(factory.commands().get(0)).contains("crop=64:64:928:508,format=gray");
    }

    @Test
    void shortFrameFails() {
        ScriptedProcessFactory factory = ScriptedProcessFactory.of(new ProcessBehavior(new byte[10], "", 0, 0));

        assertThatThrownBy(() -> extractor(factory).thumbnail(INPUT, 30, 32, 18))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("Short frame");
    }

    @Test
    void failedSamplerIsAnalysisFailure() {
        ScriptedProcessFactory factory = ScriptedProcessFactory.of(ProcessBehavior.of("", "Invalid data", 1));

        assertThatThrownBy(() -> extractor(factory).sceneCuts(INPUT))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("Sampler exited with 1");
    }

    @Test
    void samplerThatCannotStartIsAnalysisFailure() {
        ScriptedProcessFactory factory = ScriptedProcessFactory.of(ProcessBehavior.of("", "", 0))
                .failingWith(new IOException("No such file"));

        assertThatThrownBy(() -> extractor(factory).staticSceneWindow(INPUT, Probes.sdr1080p(), 180, 200))
                .isInstanceOf(AnalysisException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
