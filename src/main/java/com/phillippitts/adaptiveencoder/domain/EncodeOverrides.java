package com.phillippitts.adaptiveencoder.domain;

/**
 * Caller-supplied adjustments to a run. All fields are optional.
 *
 * @param manualCrop crop that bypasses detection entirely (null = detect)
 * @param scale scale filter argument such as {@code 1920:-2} (null = no scaling)
 * @param denoise whether to insert the denoise stage
 * @param title container title metadata (null = keep source title)
 * @param complexityAnalysis forces complexity analysis on or off (null = configured default)
 * @param forceOracle consult the content oracle even when the technical label is confident
 */
public record EncodeOverrides(
        CropRegion manualCrop,
        String scale,
        boolean denoise,
        String title,
        Boolean complexityAnalysis,
        boolean forceOracle
) {
    private static final EncodeOverrides NONE = new EncodeOverrides(null, null, false, null, null, false);

    public static EncodeOverrides none() {
        return NONE;
    }

    public EncodeOverrides withManualCrop(CropRegion crop) {
        return new EncodeOverrides(crop, scale, denoise, title, complexityAnalysis, forceOracle);
    }

    public EncodeOverrides withComplexityAnalysis(Boolean enabled) {
        return new EncodeOverrides(manualCrop, scale, denoise, title, enabled, forceOracle);
    }

    public EncodeOverrides withDenoise(boolean enabled) {
        return new EncodeOverrides(manualCrop, scale, enabled, title, complexityAnalysis, forceOracle);
    }

    public EncodeOverrides withScale(String value) {
        return new EncodeOverrides(manualCrop, value, denoise, title, complexityAnalysis, forceOracle);
    }

    public EncodeOverrides withTitle(String value) {
        return new EncodeOverrides(manualCrop, scale, denoise, value, complexityAnalysis, forceOracle);
    }

    public EncodeOverrides withForceOracle(boolean force) {
        return new EncodeOverrides(manualCrop, scale, denoise, title, complexityAnalysis, force);
    }
}
