package com.phillippitts.adaptiveencoder.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Progress-monitor tuning. Binds to "encoder.progress".
 *
 * @param stallSeconds unchanged-progress window after which the ETA is suppressed
 * @param maxEtaHours ETAs above this are discarded as unreliable
 * @param minSizeProjectionFraction progress required before projecting the final size
 * @param diagnosticTailLines encoder stderr lines kept for failure reports
 */
@ConfigurationProperties(prefix = "encoder.progress")
@Validated
public record ProgressProperties(
        @Positive
        int stallSeconds,

        @Positive
        int maxEtaHours,

        @DecimalMin("0.0") @DecimalMax("1.0")
        double minSizeProjectionFraction,

        @Positive
        int diagnosticTailLines
) {
    @ConstructorBinding
    public ProgressProperties {
    }

    public ProgressProperties() {
        this(10, 24, 0.01, 20);
    }
}
