package com.phillippitts.adaptiveencoder.service.analysis;

/**
 * Temporal signals derived from the sampled picture-type sequence.
 */
public final class FrameTypeSignals {

    private FrameTypeSignals() {}

    /**
     * Percentage of P and B pictures among the first {@code window} frames.
     *
     * @return percentage, or {@code fallback} when no frames were sampled
     */
    public static double temporalInfo(String frameTypes, int window, double fallback) {
        String sample = head(frameTypes, window);
        if (sample.isEmpty()) {
            return fallback;
        }
        long inter = sample.chars().filter(c -> c == 'P' || c == 'B').count();
        return inter * 100.0 / sample.length();
    }

    /**
     * I-picture density: {@code I * 200 / total} over the first {@code window} frames.
     *
     * @return density, or {@code fallback} when no frames were sampled
     */
    public static double frameTypeComplexity(String frameTypes, int window, double fallback) {
        String sample = head(frameTypes, window);
        if (sample.isEmpty()) {
            return fallback;
        }
        long intra = sample.chars().filter(c -> c == 'I').count();
        return intra * 200.0 / sample.length();
    }

    private static String head(String frameTypes, int window) {
        if (frameTypes == null) {
            return "";
        }
        return frameTypes.length() > window ? frameTypes.substring(0, window) : frameTypes;
    }
}
