package com.phillippitts.adaptiveencoder.domain;

/**
 * Composite complexity score, always within [{@value #MIN}, {@value #MAX}].
 *
 * @param value score value
 * @param signals signals the score was computed from, or null when the neutral default was used
 */
public record ComplexityScore(int value, ComplexitySignals signals) {

    public static final int MIN = 10;
    public static final int MAX = 100;
    public static final int NEUTRAL_VALUE = 50;

    public ComplexityScore {
        if (value < MIN || value > MAX) {
            throw new IllegalArgumentException("Complexity score must be within [" + MIN + "," + MAX + "]: " + value);
        }
    }

    public static ComplexityScore neutral() {
        return new ComplexityScore(NEUTRAL_VALUE, null);
    }

    public boolean analyzed() {
        return signals != null;
    }

    /**
     * True when analysis ran and measured at least one of the signals the technical classifier reads.
     */
    public boolean contentMeasured() {
        return signals != null && signals.contentMeasured();
    }
}
