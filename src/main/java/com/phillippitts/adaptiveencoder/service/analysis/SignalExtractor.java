package com.phillippitts.adaptiveencoder.service.analysis;

import com.phillippitts.adaptiveencoder.domain.MediaProbe;

import java.nio.file.Path;

/**
 * Source-sampling operations behind the complexity signals.
 *
 * <p>Every method throws {@link com.phillippitts.adaptiveencoder.exception.AnalysisException}
 * when the sample cannot be taken; callers recover each signal independently.
 */
public interface SignalExtractor {

    /**
     * Mean Sobel-filtered luma over the leading spatial window (one frame per second).
     */
    double spatialInfo(Path input);

    /**
     * Number of scene cuts in the leading scene window.
     */
    int sceneCuts(Path input);

    /**
     * Centered native-resolution luma window of at most {@code size x size} pixels at {@code atSeconds}.
     */
    GrayFrame grainWindow(Path input, MediaProbe probe, double atSeconds, int size);

    /**
     * Downscaled luma thumbnail at {@code atSeconds}.
     */
    GrayFrame thumbnail(Path input, double atSeconds, int width, int height);

    /**
     * Centered luma window of the first static (low scene-difference) frame at or after {@code atSeconds}.
     */
    GrayFrame staticSceneWindow(Path input, MediaProbe probe, double atSeconds, int size);
}
