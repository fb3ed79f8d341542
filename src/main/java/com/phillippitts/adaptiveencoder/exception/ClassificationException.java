package com.phillippitts.adaptiveencoder.exception;

/**
 * Thrown by content oracles when they cannot answer. Always recovered by the classifier.
 */
public class ClassificationException extends EncoderException {

    public ClassificationException(String message) {
        super(FailureKind.CLASSIFICATION, message);
    }

    public ClassificationException(String message, Throwable cause) {
        super(FailureKind.CLASSIFICATION, message, cause);
    }
}
