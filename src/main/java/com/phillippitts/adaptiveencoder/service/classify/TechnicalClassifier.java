package com.phillippitts.adaptiveencoder.service.classify;

import com.phillippitts.adaptiveencoder.domain.Classification;
import com.phillippitts.adaptiveencoder.domain.ClassificationSource;
import com.phillippitts.adaptiveencoder.domain.ComplexityScore;
import com.phillippitts.adaptiveencoder.domain.ComplexitySignals;
import com.phillippitts.adaptiveencoder.domain.ContentType;
import com.phillippitts.adaptiveencoder.domain.MediaProbe;

import java.util.Locale;

/**
 * Threshold classifier over grain, motion and geometry.
 *
 * <p>Rules, first match wins:
 * <ul>
 *   <li>grain 0, at least 1920x1080, motion below 20, aspect 1.33-1.90: 3d_animation (80%)</li>
 *   <li>grain at most 3, motion below 15, width at most 1920: anime (70%)</li>
 *   <li>grain 15 or more: heavy_grain (85%)</li>
 *   <li>grain between 5 and 15: light_grain (70%)</li>
 *   <li>motion above 20: action (75%)</li>
 *   <li>otherwise film (75%)</li>
 * </ul>
 */
public final class TechnicalClassifier {

    private TechnicalClassifier() {}

    /**
     * Classifies from the measured signals, filling unmeasured ones from probe metadata.
     *
     * @param probe source probe
     * @param score complexity score; only signals it actually measured are read
     * @return technical classification
     */
    public static Classification classify(MediaProbe probe, ComplexityScore score) {
        ComplexitySignals signals = score == null ? null : score.signals();
        double grain = signals != null && signals.grainMeasured() ? signals.grainLevel() : estimateGrain(probe);
        double scenes = signals != null && signals.sceneCutsMeasured()
                ? signals.sceneChangeRate()
                : ComplexitySignals.DEFAULT_SCENE_CHANGES;
        return classify(probe, grain, motionLevel(scenes));
    }

    static Classification classify(MediaProbe probe, double grain, int motion) {
        double aspect = probe.aspectRatio();
        if (grain == 0 && probe.width() >= 1920 && probe.height() >= 1080 && motion < 20
                && aspect >= 1.33 && aspect <= 1.90) {
            return technical(ContentType.ANIMATION_3D, 80);
        }
        if (grain <= 3 && motion < 15 && probe.width() <= 1920) {
            return technical(ContentType.ANIME, 70);
        }
        if (grain >= 15) {
            return technical(ContentType.HEAVY_GRAIN, 85);
        }
        if (grain > 5) {
            return technical(ContentType.LIGHT_GRAIN, 70);
        }
        if (motion > 20) {
            return technical(ContentType.ACTION, 75);
        }
        return technical(ContentType.FILM, 75);
    }

    /**
     * Motion level from the scene-cut count: above 50 is high (25), below 10 low (5), else 10.
     */
    static int motionLevel(double sceneCuts) {
        if (sceneCuts > 50) {
            return 25;
        }
        if (sceneCuts < 10) {
            return 5;
        }
        return 10;
    }

    /**
     * Grain guess from bitrate when no frames were analysed. High-bitrate masters are assumed clean.
     */
    static double estimateGrain(MediaProbe probe) {
        long mbps = probe.bitrateBps() / 1_000_000;
        if (probe.codecName().toLowerCase(Locale.ROOT).equals("h264") && probe.width() >= 1920 && mbps > 30) {
            return 1;
        }
        if (probe.width() >= 3000) {
            return mbps > 50 ? 1 : 3;
        }
        return mbps > 20 ? 2 : 8;
    }

    private static Classification technical(ContentType type, int confidence) {
        return Classification.of(type, confidence, ClassificationSource.TECHNICAL);
    }
}
