package com.phillippitts.adaptiveencoder.service.analysis;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure grain and texture arithmetic plus the sampling schedule.
 */
public final class GrainEstimator {

    /** Center window analysed for grain at native resolution. */
    public static final int GRAIN_WINDOW = 400;
    /** Thumbnail size used for texture. */
    public static final int TEXTURE_WIDTH = 320;
    public static final int TEXTURE_HEIGHT = 240;

    static final int VARIANCE_WINDOW = 300;
    static final int EDGE_WINDOW = 200;
    static final int VARIANCE_PATCH = 10;
    static final int GRAIN_EDGE_THRESHOLD = 40;
    static final int TEXTURE_EDGE_THRESHOLD = 50;

    /** Relative position of the dark-scene sample. */
    static final double DARK_SCENE_POSITION = 0.3;

    private GrainEstimator() {}

    /**
     * Sample timestamps at the given percentages of duration. Each time is clamped to
     * {@code [2, duration - 5]}; duplicates are dropped. Very short inputs fall back to
     * {@code 2,5,8} (over 8s), {@code 2,duration/2} (over 4s) or {@code 1}.
     *
     * @param durationSeconds input duration
     * @param percents sample positions in percent
     * @return distinct sample times in seconds, in order
     */
    public static List<Double> sampleTimes(double durationSeconds, List<Integer> percents) {
        List<Double> times = new ArrayList<>();
        double whole = Math.floor(durationSeconds);
        for (int percent : percents) {
            double t = Math.floor(whole * percent / 100.0);
            if (t < 2) {
                t = 2;
            } else if (t > whole - 5) {
                t = whole - 5;
            }
            if (t >= 2 && t <= whole && !times.contains(t)) {
                times.add(t);
            }
        }
        if (times.isEmpty()) {
            if (durationSeconds > 8) {
                times.addAll(List.of(2.0, 5.0, 8.0));
            } else if (durationSeconds > 4) {
                times.addAll(List.of(2.0, Math.floor(whole / 2)));
            } else {
                times.add(1.0);
            }
        }
        return times;
    }

    /**
     * Timestamp of the dark-scene sample, proportional to duration and always inside the input.
     */
    public static double darkSceneTime(double durationSeconds) {
        if (durationSeconds <= 1) {
            return 0;
        }
        return Math.min(Math.floor(durationSeconds * DARK_SCENE_POSITION), durationSeconds - 1);
    }

    /**
     * Grain composite of one sample: {@code noise*0.4 + variance*0.1 + edges*0.5}.
     *
     * @param grainWindow centered native-resolution luma window
     * @return grain estimate for the sample
     */
    public static double sampleGrain(GrayFrame grainWindow) {
        double noise = FrameMetrics.highFrequencyNoise(grainWindow);
        double variance = FrameMetrics.medianPatchVariance(grainWindow.center(VARIANCE_WINDOW, VARIANCE_WINDOW),
                VARIANCE_PATCH);
        double edges = FrameMetrics.edgeDensityPercent(grainWindow.center(EDGE_WINDOW, EDGE_WINDOW),
                GRAIN_EDGE_THRESHOLD) / 10.0;
        return noise * 0.4 + variance * 0.1 + edges * 0.5;
    }

    /**
     * Texture of one sample: strong-edge pixel count of the thumbnail divided by 100.
     */
    public static double sampleTexture(GrayFrame thumbnail) {
        return FrameMetrics.strongEdgeCount(thumbnail, TEXTURE_EDGE_THRESHOLD) / 100.0;
    }

    /**
     * Grain of a dark, static frame after contrast stretching.
     */
    public static double darkSceneGrain(GrayFrame darkWindow) {
        return FrameMetrics.highFrequencyNoise(FrameMetrics.stretchContrast(darkWindow)) * 0.4;
    }
}
