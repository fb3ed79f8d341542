package com.phillippitts.adaptiveencoder.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link PassFailureException} with contextual details.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw PassFailureExceptionBuilder.create("Encoder pass failed")
 *         .pass(2)
 *         .exitCode(1)
 *         .durationMs(81234)
 *         .metadata("mode", "ABR")
 *         .diagnosticTail(stderrTail)
 *         .build();
 * </pre>
 */
public final class PassFailureExceptionBuilder {

    private final String message;
    private int passIndex;
    private int exitCode = -1;
    private Long durationMs;
    private String diagnosticTail = "";
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private PassFailureExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static PassFailureExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new PassFailureExceptionBuilder(message);
    }

    public PassFailureExceptionBuilder pass(int passIndex) {
        this.passIndex = passIndex;
        return this;
    }

    public PassFailureExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public PassFailureExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Sets the captured diagnostic output. It is kept on the exception rather than in the message.
     */
    public PassFailureExceptionBuilder diagnosticTail(String tail) {
        this.diagnosticTail = tail == null ? "" : tail;
        return this;
    }

    public PassFailureExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public PassFailureExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. The message format is:
     * <pre>
     * {message} (pass={n}, exitCode={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     */
    public PassFailureException build() {
        String detailed = buildDetailedMessage();
        if (cause != null) {
            return new PassFailureException(detailed, passIndex, exitCode, diagnosticTail, cause);
        }
        return new PassFailureException(detailed, passIndex, exitCode, diagnosticTail);
    }

    private String buildDetailedMessage() {
        StringBuilder sb = new StringBuilder(message);
        sb.append(" (pass=").append(passIndex);
        sb.append(", exitCode=").append(exitCode);
        if (durationMs != null) {
            sb.append(", durationMs=").append(durationMs);
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            sb.append(", ").append(entry.getKey()).append("=").append(entry.getValue());
        }
        sb.append(")");
        return sb.toString();
    }
}
