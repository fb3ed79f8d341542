package com.phillippitts.adaptiveencoder.domain;

import java.util.Locale;

/**
 * Rate-control mode; each maps to a fixed pass plan.
 */
public enum EncodingMode {
    /** Single quality-driven pass, no bitrate target. */
    CRF(1),
    /** Two-pass average bitrate. */
    ABR(2),
    /** Two-pass constant bitrate with pinned min/max rate and VBV buffer. */
    CBR(2);

    private final int passCount;

    EncodingMode(int passCount) {
        this.passCount = passCount;
    }

    public int passCount() {
        return passCount;
    }

    public boolean isTwoPass() {
        return passCount == 2;
    }

    /**
     * Parses a mode name case-insensitively.
     *
     * @param value mode name such as "crf", "abr" or "cbr"
     * @return parsed mode
     * @throws IllegalArgumentException if the value is not a known mode
     */
    public static EncodingMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Encoding mode must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown encoding mode: " + value + " (expected crf, abr or cbr)", e);
        }
    }
}
