package com.phillippitts.adaptiveencoder.domain;

/**
 * Which decision path produced a {@link Classification}.
 */
public enum ClassificationSource {
    PROFILE,
    TECHNICAL,
    ORACLE,
    MERGED,
    FILENAME
}
