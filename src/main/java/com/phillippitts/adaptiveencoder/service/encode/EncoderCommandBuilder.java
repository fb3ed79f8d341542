package com.phillippitts.adaptiveencoder.service.encode;

import com.phillippitts.adaptiveencoder.domain.EncoderParams;
import com.phillippitts.adaptiveencoder.domain.Pass;
import com.phillippitts.adaptiveencoder.domain.RateControl;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the encoder command line for one pass.
 *
 * <p>Every pass reports machine-readable progress on stdout ({@code -progress pipe:1}). The
 * analysis pass drops non-video streams and writes to the null device.
 */
public final class EncoderCommandBuilder {

    public static final String NULL_DEVICE =
            System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows") ? "NUL" : "/dev/null";

    private EncoderCommandBuilder() {}

    public static List<String> build(EncodeJob job, Pass pass) {
        List<String> cmd = new ArrayList<>();
        cmd.add(job.ffmpegPath());
        cmd.add("-y");
        if (job.hardwareAccel()) {
            cmd.addAll(List.of("-hwaccel", "cuda", "-hwaccel_output_format", "cuda"));
        }
        cmd.addAll(List.of("-i", job.input().toString(),
                "-max_muxing_queue_size", String.valueOf(job.maxMuxingQueueSize())));
        if (job.title() != null && !job.title().isBlank()) {
            cmd.addAll(List.of("-metadata", "title=" + job.title()));
        }
        if (job.filterGraph().isEmpty()) {
            cmd.addAll(List.of("-map", "0:v:0"));
        } else {
            cmd.addAll(List.of("-filter_complex", job.filterGraph().render(), "-map", FilterGraph.OUTPUT_LABEL));
        }
        cmd.addAll(List.of("-c:v", job.videoCodec(), "-pix_fmt", job.pixelFormat(), "-profile:v", job.codecProfile()));

        EncoderParams params = job.encoderParams().without("bitrate");
        RateControl rate = pass.rateControl();
        if (rate.isQualityDriven()) {
            cmd.addAll(List.of("-crf", String.format(Locale.ROOT, "%.1f", rate.crf()), "-preset:v", pass.preset()));
            if (!params.isEmpty()) {
                cmd.addAll(List.of("-x265-params", params.toArgument()));
            }
        } else {
            cmd.addAll(List.of("-x265-params", twoPassParams(params, pass).toArgument()));
            cmd.addAll(rateArguments(rate));
            cmd.addAll(List.of("-preset:v", pass.preset()));
        }

        if (pass.writesOutput()) {
            cmd.addAll(job.streamMap());
            cmd.addAll(List.of("-default_mode", "infer_no_subs"));
        } else {
            cmd.addAll(List.of("-an", "-sn", "-dn", "-f", "mp4"));
        }
        cmd.addAll(List.of("-progress", "pipe:1", "-nostats", "-loglevel", "warning"));
        cmd.add(pass.writesOutput() ? job.output().toString() : NULL_DEVICE);
        return cmd;
    }

    /**
     * Statistics parameters: pass 1 writes ({@code pass=1}, fast first pass), pass 2 reads.
     */
    static EncoderParams twoPassParams(EncoderParams params, Pass pass) {
        String stats = pass.statsFile().toString();
        if (pass.writesOutput()) {
            return params.with("pass", "2").with("stats", stats);
        }
        return params.with("pass", "1").with("slow-firstpass", "0").with("stats", stats);
    }

    static List<String> rateArguments(RateControl rate) {
        List<String> args = new ArrayList<>(List.of("-b:v", rate.targetKbps() + "k"));
        if (rate.isConstrained()) {
            args.addAll(List.of("-minrate", rate.minrateKbps() + "k", "-maxrate", rate.maxrateKbps() + "k",
                    "-bufsize", rate.bufsizeKbps() + "k"));
        }
        return args;
    }
}
