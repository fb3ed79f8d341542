package com.phillippitts.adaptiveencoder.exception;

/**
 * Thrown when the input cannot be probed or has no video stream. Fatal: no pass is attempted.
 */
public class ProbeFailureException extends EncoderException {

    private final String input;

    public ProbeFailureException(String message, String input) {
        super(FailureKind.PROBE, message + " (input: " + input + ")");
        this.input = input;
    }

    public ProbeFailureException(String message, String input, Throwable cause) {
        super(FailureKind.PROBE, message + " (input: " + input + ")", cause);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
