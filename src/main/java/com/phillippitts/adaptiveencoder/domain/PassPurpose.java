package com.phillippitts.adaptiveencoder.domain;

/**
 * Role of a pass within a {@link PassPlan}.
 */
public enum PassPurpose {
    /** First pass of a two-pass plan; writes statistics and discards video output. */
    ANALYSIS,
    /** Pass that produces the output file. */
    FINAL
}
