package com.phillippitts.adaptiveencoder.presentation.controller;

import com.phillippitts.adaptiveencoder.domain.CropRegion;
import com.phillippitts.adaptiveencoder.domain.EncodeOverrides;
import com.phillippitts.adaptiveencoder.domain.EncodingMode;

/**
 * JSON overrides shared by single and batch requests. Every field is optional.
 *
 * @param profile profile name or "auto"
 * @param mode "crf", "abr" or "cbr"
 * @param crop manual crop {@code W:H:X:Y}
 * @param scale scale filter argument
 * @param denoise insert the denoise stage
 * @param title container title
 * @param complexityAnalysis force complexity analysis on or off
 * @param forceOracle consult the content oracle regardless of technical confidence
 */
record EncodeRequestBody(
        String profile,
        String mode,
        String crop,
        String scale,
        Boolean denoise,
        String title,
        Boolean complexityAnalysis,
        Boolean forceOracle
) {
    EncodingMode encodingMode() {
        return mode == null || mode.isBlank() ? null : EncodingMode.parse(mode);
    }

    EncodeOverrides overrides() {
        return new EncodeOverrides(
                crop == null || crop.isBlank() ? null : CropRegion.parse(crop),
                scale == null || scale.isBlank() ? null : scale.trim(),
                Boolean.TRUE.equals(denoise),
                title,
                complexityAnalysis,
                Boolean.TRUE.equals(forceOracle));
    }
}
