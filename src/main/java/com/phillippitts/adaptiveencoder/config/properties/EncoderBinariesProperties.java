package com.phillippitts.adaptiveencoder.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Locations and limits for the external encoder and prober binaries.
 * Binds to properties prefixed with "encoder.binaries".
 *
 * <p>Example application.properties:
 * <pre>
 * encoder.binaries.ffmpeg-path=/usr/local/bin/ffmpeg
 * encoder.binaries.ffprobe-path=/usr/local/bin/ffprobe
 * encoder.binaries.probe-timeout-seconds=60
 * encoder.binaries.analysis-timeout-seconds=600
 * encoder.binaries.max-diagnostic-bytes=65536
 * </pre>
 *
 * @param ffmpegPath encoder binary, absolute path or a bare name resolved on PATH
 * @param ffprobePath prober binary, absolute path or a bare name resolved on PATH
 * @param probeTimeoutSeconds limit for a single prober call
 * @param analysisTimeoutSeconds limit for a single sampling call (signals, crop samples)
 * @param maxDiagnosticBytes cap on captured stdout/stderr per short-lived call
 */
@ConfigurationProperties(prefix = "encoder.binaries")
@Validated
public record EncoderBinariesProperties(
        @NotBlank(message = "ffmpeg path must not be blank")
        String ffmpegPath,

        @NotBlank(message = "ffprobe path must not be blank")
        String ffprobePath,

        @Positive(message = "Probe timeout must be positive")
        int probeTimeoutSeconds,

        @Positive(message = "Analysis timeout must be positive")
        int analysisTimeoutSeconds,

        @Positive(message = "Max diagnostic bytes must be positive")
        int maxDiagnosticBytes
) {
    @ConstructorBinding
    public EncoderBinariesProperties {
    }

    public EncoderBinariesProperties() {
        this("ffmpeg", "ffprobe", 60, 600, 65536);
    }
}
