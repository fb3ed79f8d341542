package com.phillippitts.adaptiveencoder.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Complexity-analysis sampling windows. Binds to "encoder.analysis".
 *
 * @param complexityEnabled run analysis for explicitly named profiles (auto selection always analyzes)
 * @param grainSamplePercents positions of the grain samples as percentages of duration
 * @param darkBoostThreshold averaged grain below which the dark-scene sample runs
 * @param sceneThreshold scene-difference threshold for cut detection
 * @param temporalWindowFrames frames inspected for the P/B ratio
 * @param frameTypeWindowFrames frames inspected for the I-frame ratio
 * @param spatialWindowSeconds seconds inspected for edge detail
 * @param sceneWindowSeconds seconds inspected for scene cuts
 */
@ConfigurationProperties(prefix = "encoder.analysis")
@Validated
public record AnalysisProperties(
        boolean complexityEnabled,

        @NotEmpty
        List<Integer> grainSamplePercents,

        @Positive
        double darkBoostThreshold,

        @DecimalMin("0.0") @DecimalMax("1.0")
        double sceneThreshold,

        @Positive
        int temporalWindowFrames,

        @Positive
        int frameTypeWindowFrames,

        @Positive
        int spatialWindowSeconds,

        @Positive
        int sceneWindowSeconds
) {
    @ConstructorBinding
    public AnalysisProperties {
    }

    public AnalysisProperties() {
        this(false, List.of(10, 25, 50, 75, 90), 5, 0.3, 900, 1800, 30, 60);
    }
}
