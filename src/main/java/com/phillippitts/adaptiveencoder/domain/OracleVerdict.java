package com.phillippitts.adaptiveencoder.domain;

/**
 * Advisory answer from a content oracle.
 *
 * @param type suggested content type, or null when the oracle does not know
 * @param confidence confidence in percent (0-100)
 */
public record OracleVerdict(ContentType type, int confidence) {

    private static final OracleVerdict UNKNOWN = new OracleVerdict(null, 0);

    public OracleVerdict {
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be within [0,100]: " + confidence);
        }
    }

    public static OracleVerdict unknown() {
        return UNKNOWN;
    }

    public static OracleVerdict of(ContentType type, int confidence) {
        return new OracleVerdict(type, confidence);
    }

    public boolean isUnknown() {
        return type == null;
    }
}
