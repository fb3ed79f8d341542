package com.phillippitts.adaptiveencoder.config.properties;

import com.phillippitts.adaptiveencoder.domain.EncodingMode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Encoder invocation defaults. Binds to "encoder.encode".
 *
 * @param defaultMode mode used when the caller does not name one
 * @param analysisPreset preset of the first (statistics) pass
 * @param videoCodec encoder library
 * @param hardwareAccel decode on the GPU and download frames before filtering
 * @param maxMuxingQueueSize muxer queue size
 */
@ConfigurationProperties(prefix = "encoder.encode")
@Validated
public record EncodeProperties(
        @NotNull
        EncodingMode defaultMode,

        @NotBlank
        String analysisPreset,

        @NotBlank
        String videoCodec,

        boolean hardwareAccel,

        @Positive
        int maxMuxingQueueSize
) {
    @ConstructorBinding
    public EncodeProperties {
    }

    public EncodeProperties() {
        this(EncodingMode.ABR, "slow", "libx265", false, 1024);
    }
}
