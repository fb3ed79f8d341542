package com.phillippitts.adaptiveencoder.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Content-oracle policy. Binds to "encoder.oracle".
 *
 * @param mode DISABLED never consults the oracle, ENABLED consults it when the technical label is
 *             not confident, FORCE always consults it
 * @param highConfidence technical confidence at which the oracle is skipped
 * @param minTitleConfidence minimum title-extraction confidence before the oracle is asked
 */
@ConfigurationProperties(prefix = "encoder.oracle")
@Validated
public record OracleProperties(
        @NotNull
        Mode mode,

        @Min(0) @Max(100)
        int highConfidence,

        @Min(0) @Max(100)
        int minTitleConfidence
) {
    @ConstructorBinding
    public OracleProperties {
    }

    public OracleProperties() {
        this(Mode.ENABLED, 80, 30);
    }

    public enum Mode {
        DISABLED,
        ENABLED,
        FORCE
    }
}
