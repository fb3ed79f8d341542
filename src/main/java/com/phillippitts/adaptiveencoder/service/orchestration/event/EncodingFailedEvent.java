package com.phillippitts.adaptiveencoder.service.orchestration.event;

import com.phillippitts.adaptiveencoder.exception.FailureKind;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Emitted when a run aborts with a fatal error.
 *
 * @param runId run identifier, or null when the run never started
 * @param input source file
 * @param kind failure kind
 * @param message failure message
 * @param timestamp failure time
 */
public record EncodingFailedEvent(String runId, Path input, FailureKind kind, String message, Instant timestamp) {}
