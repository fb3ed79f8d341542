package com.phillippitts.adaptiveencoder.config.properties;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Crop-detection sampling and acceptance thresholds. Binds to "encoder.crop".
 *
 * @param enabled run detection when no manual crop is supplied
 * @param minThreshold minimum pixel delta for acceptance
 * @param sdrLimit black-level limit for SDR sources
 * @param hdrLimit black-level limit for HDR sources (PQ blacks are lifted)
 * @param sampleSeconds length of each sample window
 * @param edgeSkipSeconds distance kept from the true start and end
 * @param percentThreshold alternative acceptance: delta as percent of {@code width + height}
 */
@ConfigurationProperties(prefix = "encoder.crop")
@Validated
public record CropProperties(
        boolean enabled,

        @PositiveOrZero
        int minThreshold,

        @Positive
        int sdrLimit,

        @Positive
        int hdrLimit,

        @Positive
        int sampleSeconds,

        @PositiveOrZero
        int edgeSkipSeconds,

        @PositiveOrZero
        double percentThreshold
) {
    @ConstructorBinding
    public CropProperties {
    }

    public CropProperties() {
        this(true, 20, 24, 64, 30, 60, 1.0);
    }
}
