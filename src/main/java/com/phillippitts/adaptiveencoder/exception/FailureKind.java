package com.phillippitts.adaptiveencoder.exception;

/**
 * Distinguishable failure categories surfaced to callers and metrics.
 */
public enum FailureKind {
    PROBE,
    PASS,
    CLASSIFICATION,
    CROP_DETECTION,
    ANALYSIS,
    PROFILE,
    CONFIGURATION,
    INTERNAL
}
