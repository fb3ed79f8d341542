package com.phillippitts.adaptiveencoder.exception;

/**
 * Thrown when an encoder pass exits non-zero or cannot be started. Fatal and never retried.
 */
public class PassFailureException extends EncoderException {

    private final int passIndex;
    private final int exitCode;
    private final String diagnosticTail;

    public PassFailureException(String message, int passIndex, int exitCode, String diagnosticTail) {
        super(FailureKind.PASS, message);
        this.passIndex = passIndex;
        this.exitCode = exitCode;
        this.diagnosticTail = diagnosticTail == null ? "" : diagnosticTail;
    }

    public PassFailureException(String message, int passIndex, int exitCode, String diagnosticTail,
                                Throwable cause) {
        super(FailureKind.PASS, message, cause);
        this.passIndex = passIndex;
        this.exitCode = exitCode;
        this.diagnosticTail = diagnosticTail == null ? "" : diagnosticTail;
    }

    public int getPassIndex() {
        return passIndex;
    }

    public int getExitCode() {
        return exitCode;
    }

    /**
     * Last lines of the encoder's diagnostic stream.
     */
    public String getDiagnosticTail() {
        return diagnosticTail;
    }
}
