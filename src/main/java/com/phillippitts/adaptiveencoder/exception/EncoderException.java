package com.phillippitts.adaptiveencoder.exception;

/**
 * Base exception for all adaptive-encoder errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class EncoderException extends RuntimeException {

    private final FailureKind kind;

    public EncoderException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EncoderException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
