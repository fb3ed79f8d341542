package com.phillippitts.adaptiveencoder.presentation.exception;

import com.phillippitts.adaptiveencoder.exception.BinaryNotFoundException;
import com.phillippitts.adaptiveencoder.exception.PassFailureException;
import com.phillippitts.adaptiveencoder.exception.ProbeFailureException;
import com.phillippitts.adaptiveencoder.exception.UnknownProfileException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring; only the encoder's diagnostic tail is passed through to clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - unknown profile name (HTTP 400).
     */
    @ExceptionHandler(UnknownProfileException.class)
    ResponseEntity<ApiError> handleUnknownProfile(UnknownProfileException ex) {
        LOG.warn("Unknown profile requested: {}", ex.getProfileName());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Unknown encoding profile",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - malformed mode, crop or missing fields (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentNotValidException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Invalid encode request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Input could not be probed (HTTP 422).
     */
    @ExceptionHandler(ProbeFailureException.class)
    ResponseEntity<ApiError> handleProbeFailure(ProbeFailureException ex) {
        LOG.warn("Probe failed: input={}", ex.getInput());
        return ResponseEntity
            .status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Input could not be probed",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Encoder pass failed (HTTP 502); the diagnostic tail is returned for troubleshooting.
     */
    @ExceptionHandler(PassFailureException.class)
    ResponseEntity<ApiError> handlePassFailure(PassFailureException ex) {
        LOG.error("Encoder pass {} failed with exit code {}", ex.getPassIndex(), ex.getExitCode());
        return ResponseEntity
            .status(HttpStatus.BAD_GATEWAY)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                ex.getMessage(),
                ex.getDiagnosticTail(),
                Instant.now()
            ));
    }

    /**
     * Configuration error - binaries unavailable at runtime (HTTP 503).
     */
    @ExceptionHandler(BinaryNotFoundException.class)
    ResponseEntity<ApiError> handleBinaryNotFound(BinaryNotFoundException ex) {
        LOG.error("Encoder binary unavailable: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Encoder unavailable",
                "Encoder binaries not installed. Contact administrator.",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
