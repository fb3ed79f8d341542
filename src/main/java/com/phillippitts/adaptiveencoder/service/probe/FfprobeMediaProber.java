package com.phillippitts.adaptiveencoder.service.probe;

import com.phillippitts.adaptiveencoder.config.properties.EncoderBinariesProperties;
import com.phillippitts.adaptiveencoder.domain.MediaProbe;
import com.phillippitts.adaptiveencoder.exception.ProbeFailureException;
import com.phillippitts.adaptiveencoder.service.process.ProcessResult;
import com.phillippitts.adaptiveencoder.service.process.ProcessRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link MediaProber} backed by ffprobe.
 *
 * <p>Three calls per input:
 * <ol>
 *   <li>format and streams as JSON (fatal on failure)</li>
 *   <li>picture types of the first {@value #FRAME_TYPE_WINDOW} frames (empty on failure)</li>
 *   <li>exact packet count for frame-based progress, only when the container has no frame count
 *       (0 on failure)</li>
 * </ol>
 */
@Component
public class FfprobeMediaProber implements MediaProber {

    private static final Logger LOG = LogManager.getLogger(FfprobeMediaProber.class);

    /** Frame-type window shared by the temporal (first 900) and I-frame (1800) signals. */
    static final int FRAME_TYPE_WINDOW = 1800;

    private final ProcessRunner runner;
    private final EncoderBinariesProperties binaries;

    public FfprobeMediaProber(ProcessRunner runner, EncoderBinariesProperties binaries) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.binaries = Objects.requireNonNull(binaries, "binaries");
    }

    @Override
    public MediaProbe probe(Path input) {
        Objects.requireNonNull(input, "input");
        if (!Files.isRegularFile(input) || !Files.isReadable(input)) {
            throw new ProbeFailureException("Input is not a readable file", input.toString());
        }

        FfprobeJsonParser.StreamInfo info = probeStreams(input);
        String frameTypes = probeFrameTypes(input);
        long frameCount = info.frameCount() > 0 ? info.frameCount() : countPackets(input);

        MediaProbe probe = new MediaProbe(info.width(), info.height(), info.durationSeconds(), info.fps(),
                info.codecName(), info.bitrateBps(), info.colorPrimaries(), info.colorTransfer(),
                info.colorSpace(), frameTypes, frameCount, info.audioStreams(), info.subtitleStreams());
        LOG.info("Probed {}: {}x{} {} {}s @{}fps, {} kbps, hdr={}, audio={}, subtitles={}",
                input.getFileName(), probe.width(), probe.height(), probe.codecName(),
                Math.round(probe.durationSeconds()), fps(probe.fps()),
                probe.bitrateBps() / 1000, probe.isHdr(), probe.audioStreamCount(), probe.subtitleStreamCount());
        return probe;
    }

    static String fps(double fps) {
        return String.format(Locale.ROOT, "%.3f", fps);
    }

    private FfprobeJsonParser.StreamInfo probeStreams(Path input) {
        List<String> cmd = List.of(binaries.ffprobePath(), "-v", "error",
                "-analyzeduration", "100M", "-probesize", "50M",
                "-show_format", "-show_streams", "-of", "json", input.toString());
        ProcessResult result;
        try {
            result = runner.run(cmd, probeTimeout(), "ffprobe");
        } catch (IOException e) {
            throw new ProbeFailureException("Prober could not be started: " + e.getMessage(), input.toString(), e);
        }
        if (!result.succeeded()) {
            String reason = result.timedOut() ? "Prober timed out" : "Prober exited with " + result.exitCode();
            throw new ProbeFailureException(reason + ": " + result.stderrTail(5), input.toString());
        }
        FfprobeJsonParser.StreamInfo info;
        try {
            info = FfprobeJsonParser.parse(result.stdoutText());
        } catch (JSONException e) {
            throw new ProbeFailureException("Prober output is not valid JSON", input.toString(), e);
        }
        if (info == null) {
            throw new ProbeFailureException("No video stream found", input.toString());
        }
        return info;
    }

    private String probeFrameTypes(Path input) {
        List<String> cmd = List.of(binaries.ffprobePath(), "-v", "error", "-select_streams", "v:0",
                "-read_intervals", "%+#" + FRAME_TYPE_WINDOW, "-show_entries", "frame=pict_type",
                "-of", "csv=p=0", input.toString());
        try {
            ProcessResult result = runner.run(cmd, analysisTimeout(), "ffprobe-frames");
            if (result.succeeded()) {
                return FfprobeJsonParser.parseFrameTypes(result.stdoutText());
            }
            LOG.warn("Frame-type sampling failed (exit={}, timedOut={}); temporal signals use defaults",
                    result.exitCode(), result.timedOut());
        } catch (IOException e) {
            LOG.warn("Frame-type sampling could not run: {}", e.toString());
        }
        return "";
    }

    private long countPackets(Path input) {
        List<String> cmd = List.of(binaries.ffprobePath(), "-v", "error", "-select_streams", "v:0",
                "-count_packets", "-show_entries", "stream=nb_read_packets", "-of", "csv=p=0", input.toString());
        try {
            ProcessResult result = runner.run(cmd, analysisTimeout(), "ffprobe-count");
            if (result.succeeded()) {
                return FfprobeJsonParser.parseCount(result.stdoutText());
            }
            LOG.debug("Packet count unavailable (exit={})", result.exitCode());
        } catch (IOException e) {
            LOG.debug("Packet count could not run: {}", e.toString());
        }
        return 0;
    }

    private Duration probeTimeout() {
        return Duration.ofSeconds(binaries.probeTimeoutSeconds());
    }

    private Duration analysisTimeout() {
        return Duration.ofSeconds(binaries.analysisTimeoutSeconds());
    }
}
