package com.phillippitts.adaptiveencoder.service.crop;

import com.phillippitts.adaptiveencoder.config.properties.EncoderBinariesProperties;
import com.phillippitts.adaptiveencoder.domain.CropRegion;
import com.phillippitts.adaptiveencoder.exception.CropDetectionException;
import com.phillippitts.adaptiveencoder.service.process.ProcessResult;
import com.phillippitts.adaptiveencoder.service.process.ProcessRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link CropSampler} using ffmpeg's {@code cropdetect} filter at one frame every four seconds.
 */
@Component
public class FfmpegCropSampler implements CropSampler {

    private static final Pattern CROP_LINE = Pattern.compile("crop=(\\d+):(\\d+):(\\d+):(\\d+)");

    private final ProcessRunner runner;
    private final EncoderBinariesProperties binaries;

    public FfmpegCropSampler(ProcessRunner runner, EncoderBinariesProperties binaries) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.binaries = Objects.requireNonNull(binaries, "binaries");
    }

    @Override
    public List<CropRegion> sample(Path input, double startSeconds, int lengthSeconds, int limit) {
        List<String> cmd = List.of(binaries.ffmpegPath(), "-hide_banner", "-nostats", "-loglevel", "info",
                "-ss", String.format(Locale.ROOT, "%.3f", startSeconds), "-i", input.toString(),
                "-t", String.valueOf(lengthSeconds), "-an", "-sn", "-dn",
                "-vf", "fps=1/4,cropdetect=limit=" + limit + ":round=2:reset=1", "-f", "null", "-");
        ProcessResult result;
        try {
            result = runner.run(cmd, Duration.ofSeconds(binaries.analysisTimeoutSeconds()), "ffmpeg-crop");
        } catch (IOException e) {
            throw new CropDetectionException("Crop sample at " + startSeconds + "s could not run", e);
        }
        if (!result.succeeded()) {
            throw new CropDetectionException("Crop sample at " + startSeconds + "s failed (exit="
                    + result.exitCode() + ", timedOut=" + result.timedOut() + ")");
        }
        return parse(result.stderrLines());
    }

    static List<CropRegion> parse(List<String> lines) {
        List<CropRegion> regions = new ArrayList<>();
        for (String line : lines) {
            Matcher m = CROP_LINE.matcher(line);
            if (!m.find()) {
                continue;
            }
            int w = Integer.parseInt(m.group(1));
            int h = Integer.parseInt(m.group(2));
            // fully black frames report a zero-size rectangle
            if (w > 0 && h > 0) {
                regions.add(new CropRegion(w, h, Integer.parseInt(m.group(3)), Integer.parseInt(m.group(4))));
            }
        }
        return regions;
    }
}
