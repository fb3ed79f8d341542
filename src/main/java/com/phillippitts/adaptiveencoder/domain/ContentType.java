package com.phillippitts.adaptiveencoder.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Content category resolved once per run.
 *
 * <p>Each category carries the CRF offset and bitrate multiplier applied by
 * {@link com.phillippitts.adaptiveencoder.service.profile.ParameterAdapter}.
 */
public enum ContentType {
    ANIME("anime", 0.2, 0.90),
    CLASSIC_ANIME("classic_anime", 0.5, 0.85),
    ANIMATION_3D("3d_animation", -0.4, 1.05),
    FILM("film", 0.0, 1.00),
    HEAVY_GRAIN("heavy_grain", -0.8, 1.25),
    LIGHT_GRAIN("light_grain", -0.3, 1.10),
    ACTION("action", -0.2, 1.15),
    CLEAN_DIGITAL("clean_digital", 0.3, 0.80),
    MIXED("mixed", 0.1, 1.00);

    private final String label;
    private final double crfModifier;
    private final double bitrateModifier;

    ContentType(String label, double crfModifier, double bitrateModifier) {
        this.label = label;
        this.crfModifier = crfModifier;
        this.bitrateModifier = bitrateModifier;
    }

    public String label() {
        return label;
    }

    public double crfModifier() {
        return crfModifier;
    }

    public double bitrateModifier() {
        return bitrateModifier;
    }

    /**
     * Looks up a content type by its label ({@code "3d_animation"}) or enum name ({@code "ANIMATION_3D"}).
     *
     * @param value label or name, case-insensitive (may be null)
     * @return matching content type, or empty when unknown
     */
    public static Optional<ContentType> fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.label.equals(normalized) || t.name().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return label;
    }
}
