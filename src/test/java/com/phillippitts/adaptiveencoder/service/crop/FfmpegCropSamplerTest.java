package com.phillippitts.adaptiveencoder.service.crop;

import com.phillippitts.adaptiveencoder.config.properties.EncoderBinariesProperties;
import com.phillippitts.adaptiveencoder.domain.CropRegion;
import com.phillippitts.adaptiveencoder.exception.CropDetectionException;
import com.phillippitts.adaptiveencoder.service.process.ProcessRunner;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static com.phillippitts.adaptiveencoder.testutil.ProcessTestDoubles.ProcessBehavior;
import static com.phillippitts.adaptiveencoder.testutil.ProcessTestDoubles.ScriptedProcessFactory;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FfmpegCropSamplerTest {

    private static final String CROPDETECT_LOG = """
            [Parsed_cropdetect_1 @ 0x1] x1:0 x2:1919 y1:140 y2:939 w:1920 h:800 x:0 y:140 pts:0 t:0.000 crop=1920:800:0:140
            [Parsed_cropdetect_1 @ 0x1] x1:0 x2:1919 y1:0 y2:0 w:0 h:0 x:0 y:0 pts:4 t:4.000 crop=0:0:0:0
            frame=    8 fps=0.0 q=-0.0 size=N/A
            [Parsed_cropdetect_1 @ 0x1] x1:0 x2:1919 y1:132 y2:947 w:1920 h:816 x:0 y:132 pts:8 t:8.000 crop=1920:816:0:132
            """;

    private final EncoderBinariesProperties binaries =
            new EncoderBinariesProperties("/opt/ffmpeg", "/opt/ffprobe", 5, 5, 4096);

    @Test
    void parsesRectanglesAndSkipsBlackFrames() {
        List<CropRegion> regions = FfmpegCropSampler.parse(CROPDETECT_LOG.lines().toList());

        assertThat(regions).containsExactly(new CropRegion(1920, 800, 0, 140), new CropRegion(1920, 816, 0, 132));
    }

    @Test
    void runsCropdetectOverTheWindow() {
        ScriptedProcessFactory factory = ScriptedProcessFactory.of(ProcessBehavior.of("", CROPDETECT_LOG, 0));
        FfmpegCropSampler sampler = new FfmpegCropSampler(new ProcessRunner(factory, 64 * 1024), binaries);

        List<CropRegion> regions = sampler.sample(Path.of("movie.mkv"), 60, 30, 24);

        assertThat(regions).hasSize(2);
        List<String> cmd = factory.commands().get(0);
        assertThat(cmd.get(0)).isEqualTo("/opt/ffmpeg");
        assertThat(cmd).containsSequence("-ss", "60.000", "-i", "movie.mkv", "-t", "30");
        assertThat(cmd).contains("fps=1/4,cropdetect=limit=24:round=2:reset=1");
    }

    @Test
    void failedRunIsCropDetectionFailure() {
        ScriptedProcessFactory factory = ScriptedProcessFactory.of(ProcessBehavior.of("", "Invalid data", 1));
        FfmpegCropSampler sampler = new FfmpegCropSampler(new ProcessRunner(factory, 4096), binaries);

        assertThatThrownBy(() -> sampler.sample(Path.of("movie.mkv"), 60, 30, 24))
                .isInstanceOf(CropDetectionException.class)
                .hasMessageContaining("exit=1");
    }
}
