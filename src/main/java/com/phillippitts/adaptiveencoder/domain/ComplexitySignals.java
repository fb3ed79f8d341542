package com.phillippitts.adaptiveencoder.domain;

/**
 * Sampled measurements feeding the complexity score.
 *
 * @param spatialInfo edge-detail measure (SI)
 * @param temporalInfo percentage of inter (P/B) frames in the sampled window (TI)
 * @param sceneChangeRate scene cuts detected in the sampled window
 * @param frameTypeComplexity I-frame density of the sampled window
 * @param grainLevel averaged grain estimate (rounded)
 * @param textureScore strong-edge pixel density averaged over the grain samples
 * @param hdr whether the source is HDR10
 * @param grainMeasured whether {@code grainLevel} came from at least one sampled frame
 * @param sceneCutsMeasured whether {@code sceneChangeRate} came from the scene filter
 */
public record ComplexitySignals(
        double spatialInfo,
        double temporalInfo,
        double sceneChangeRate,
        double frameTypeComplexity,
        double grainLevel,
        double textureScore,
        boolean hdr,
        boolean grainMeasured,
        boolean sceneCutsMeasured
) {
    public static final double DEFAULT_SPATIAL_INFO = 50;
    public static final double DEFAULT_TEMPORAL_INFO = 50;
    public static final double DEFAULT_SCENE_CHANGES = 10;
    public static final double DEFAULT_FRAME_COMPLEXITY = 4;

    /**
     * Signals with grain and scene cuts both measured.
     */
    public ComplexitySignals(double spatialInfo, double temporalInfo, double sceneChangeRate,
                             double frameTypeComplexity, double grainLevel, double textureScore, boolean hdr) {
        this(spatialInfo, temporalInfo, sceneChangeRate, frameTypeComplexity, grainLevel, textureScore, hdr,
                true, true);
    }

    /**
     * Signals used when no measurement is available.
     */
    public static ComplexitySignals neutral(boolean hdr) {
        return new ComplexitySignals(DEFAULT_SPATIAL_INFO, DEFAULT_TEMPORAL_INFO, DEFAULT_SCENE_CHANGES,
                DEFAULT_FRAME_COMPLEXITY, 0, 0, hdr, false, false);
    }

    /**
     * True when grain or scene cuts were measured, so the content can be classified from them.
     */
    public boolean contentMeasured() {
        return grainMeasured || sceneCutsMeasured;
    }
}
