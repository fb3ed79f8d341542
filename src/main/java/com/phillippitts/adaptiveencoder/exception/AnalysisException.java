package com.phillippitts.adaptiveencoder.exception;

/**
 * Thrown when a single complexity signal cannot be measured. Recovered to the signal's default.
 */
public class AnalysisException extends EncoderException {

    private final String signal;

    public AnalysisException(String message, String signal) {
        super(FailureKind.ANALYSIS, message + " (signal: " + signal + ")");
        this.signal = signal;
    }

    public AnalysisException(String message, String signal, Throwable cause) {
        super(FailureKind.ANALYSIS, message + " (signal: " + signal + ")", cause);
        this.signal = signal;
    }

    public String getSignal() {
        return signal;
    }
}
