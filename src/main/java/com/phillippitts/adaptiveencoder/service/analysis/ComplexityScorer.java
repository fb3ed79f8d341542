package com.phillippitts.adaptiveencoder.service.analysis;

import com.phillippitts.adaptiveencoder.domain.ComplexityScore;
import com.phillippitts.adaptiveencoder.domain.ComplexitySignals;

import java.util.Objects;

/**
 * Weighted composite of the complexity signals.
 *
 * <pre>
 * score = 0.25*SI + 0.35*TI + 1.5*sceneRate + 8*grain + 0.3*texture + 0.25*frameComplexity
 * </pre>
 * clamped to [10, 100] and rounded half-up. Grain carries the largest weight because it drives
 * required bitrate more than motion does.
 */
public final class ComplexityScorer {

    static final double W_SPATIAL = 0.25;
    static final double W_TEMPORAL = 0.35;
    static final double W_SCENE = 1.5;
    static final double W_GRAIN = 8;
    static final double W_TEXTURE = 0.3;
    static final double W_FRAME = 0.25;

    private ComplexityScorer() {}

    /**
     * Unclamped weighted sum.
     */
    public static double rawScore(ComplexitySignals s) {
        Objects.requireNonNull(s, "signals");
        return s.spatialInfo() * W_SPATIAL
                + s.temporalInfo() * W_TEMPORAL
                + s.sceneChangeRate() * W_SCENE
                + s.grainLevel() * W_GRAIN
                + s.textureScore() * W_TEXTURE
                + s.frameTypeComplexity() * W_FRAME;
    }

    /**
     * Deterministic score in [10, 100]. Non-finite sums (NaN inputs) fall back to the neutral score.
     */
    public static ComplexityScore score(ComplexitySignals s) {
        double raw = rawScore(s);
        if (!Double.isFinite(raw)) {
            return new ComplexityScore(ComplexityScore.NEUTRAL_VALUE, s);
        }
        double clamped = Math.max(ComplexityScore.MIN, Math.min(ComplexityScore.MAX, raw));
        return new ComplexityScore((int) Math.round(clamped), s);
    }
}
