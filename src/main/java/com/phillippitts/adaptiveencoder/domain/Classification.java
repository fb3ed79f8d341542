package com.phillippitts.adaptiveencoder.domain;

import java.util.Objects;

/**
 * Resolved content label with a confidence percentage.
 *
 * @param type resolved content type
 * @param confidence confidence in percent (0-100)
 * @param source decision path that produced the label
 */
public record Classification(ContentType type, int confidence, ClassificationSource source) {

    public Classification {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(source, "source");
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be within [0,100]: " + confidence);
        }
    }

    public static Classification of(ContentType type, int confidence, ClassificationSource source) {
        return new Classification(type, confidence, source);
    }
}
