package com.phillippitts.adaptiveencoder.service.analysis;

import com.phillippitts.adaptiveencoder.config.properties.AnalysisProperties;
import com.phillippitts.adaptiveencoder.config.properties.EncoderBinariesProperties;
import com.phillippitts.adaptiveencoder.domain.MediaProbe;
import com.phillippitts.adaptiveencoder.exception.AnalysisException;
import com.phillippitts.adaptiveencoder.service.process.ProcessResult;
import com.phillippitts.adaptiveencoder.service.process.ProcessRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link SignalExtractor} that samples the source with ffmpeg filter graphs.
 *
 * <p>Frames are read as raw 8-bit gray from stdout; filter statistics are parsed from stderr.
 */
@Component
public class FfmpegSignalExtractor implements SignalExtractor {

    private static final Logger LOG = LogManager.getLogger(FfmpegSignalExtractor.class);

    private static final Pattern YAVG = Pattern.compile("lavfi\\.signalstats\\.YAVG=([0-9.]+)");

    private final ProcessRunner runner;
    private final EncoderBinariesProperties binaries;
    private final AnalysisProperties analysis;

    public FfmpegSignalExtractor(ProcessRunner runner, EncoderBinariesProperties binaries,
                                 AnalysisProperties analysis) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.binaries = Objects.requireNonNull(binaries, "binaries");
        this.analysis = Objects.requireNonNull(analysis, "analysis");
    }

    @Override
    public double spatialInfo(Path input) {
        List<String> cmd = filterCommand(input, analysis.spatialWindowSeconds(),
                "fps=1,format=gray,sobel,crop=iw-4:ih-4:2:2,signalstats,"
                        + "metadata=print:key=lavfi.signalstats.YAVG");
        ProcessResult result = execute(cmd, "spatial", "ffmpeg-si");
        double sum = 0;
        int n = 0;
        for (String line : result.stderrLines()) {
            Matcher m = YAVG.matcher(line);
            if (m.find()) {
                sum += Double.parseDouble(m.group(1));
                n++;
            }
        }
        if (n == 0) {
            throw new AnalysisException("No edge statistics reported", "spatial");
        }
        return sum / n;
    }

    @Override
    public int sceneCuts(Path input) {
        String threshold = String.format(Locale.ROOT, "%.2f", analysis.sceneThreshold());
        List<String> cmd = filterCommand(input, analysis.sceneWindowSeconds(),
                "select='gt(scene," + threshold + ")',showinfo");
        ProcessResult result = execute(cmd, "scene", "ffmpeg-scene");
        return (int) result.stderrLines().stream()
                .filter(l -> l.contains("Parsed_showinfo") && l.contains(" n:"))
                .count();
    }

    @Override
    public GrayFrame grainWindow(Path input, MediaProbe probe, double atSeconds, int size) {
        int w = Math.min(size, probe.width());
        int h = Math.min(size, probe.height());
        String crop = "crop=" + w + ":" + h + ":" + (probe.width() - w) / 2 + ":" + (probe.height() - h) / 2;
        return extract(input, atSeconds, crop + ",format=gray", w, h, "grain");
    }

    @Override
    public GrayFrame thumbnail(Path input, double atSeconds, int width, int height) {
        return extract(input, atSeconds, "scale=" + width + ":" + height + ",format=gray", width, height,
                "texture");
    }

    @Override
    public GrayFrame staticSceneWindow(Path input, MediaProbe probe, double atSeconds, int size) {
        int w = Math.min(size, probe.width());
        int h = Math.min(size, probe.height());
        String crop = "crop=" + w + ":" + h + ":" + (probe.width() - w) / 2 + ":" + (probe.height() - h) / 2;
        return extract(input, atSeconds, "select='lt(scene,0.1)'," + crop + ",format=gray", w, h, "dark-grain");
    }

    private GrayFrame extract(Path input, double atSeconds, String filter, int w, int h, String signal) {
        List<String> cmd = List.of(binaries.ffmpegPath(), "-hide_banner", "-nostats", "-v", "error",
                "-ss", seconds(atSeconds), "-i", input.toString(),
                "-an", "-sn", "-dn", "-vf", filter, "-frames:v", "1",
                "-f", "rawvideo", "-pix_fmt", "gray", "-");
        ProcessResult result = execute(cmd, signal, "ffmpeg-frame");
        byte[] data = result.stdout();
        if (data.length < w * h) {
            throw new AnalysisException("Short frame at " + seconds(atSeconds) + "s: " + data.length
                    + " of " + (w * h) + " bytes", signal);
        }
        byte[] pixels = data.length == w * h ? data : Arrays.copyOf(data, w * h);
        return new GrayFrame(w, h, pixels);
    }

    private List<String> filterCommand(Path input, int windowSeconds, String filter) {
        return List.of(binaries.ffmpegPath(), "-hide_banner", "-nostats",
                "-t", String.valueOf(windowSeconds), "-i", input.toString(),
                "-an", "-sn", "-dn", "-vf", filter, "-f", "null", "-");
    }

    private ProcessResult execute(List<String> cmd, String signal, String label) {
        ProcessResult result;
        try {
            result = runner.run(cmd, Duration.ofSeconds(binaries.analysisTimeoutSeconds()), label);
        } catch (IOException e) {
            throw new AnalysisException("Sampler could not run: " + e.getMessage(), signal, e);
        }
        if (!result.succeeded()) {
            String reason = result.timedOut() ? "Sampler timed out" : "Sampler exited with " + result.exitCode();
            LOG.debug("{} failed: {}", label, result.stderrTail(3));
            throw new AnalysisException(reason, signal);
        }
        return result;
    }

    private static String seconds(double s) {
        return String.format(Locale.ROOT, "%.3f", s);
    }
}
