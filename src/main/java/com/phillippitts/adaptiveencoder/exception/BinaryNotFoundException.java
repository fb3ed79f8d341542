package com.phillippitts.adaptiveencoder.exception;

/**
 * Thrown at startup when a configured encoder or prober binary cannot be executed.
 */
public class BinaryNotFoundException extends EncoderException {

    public BinaryNotFoundException(String message) {
        super(FailureKind.CONFIGURATION, message);
    }
}
