package com.phillippitts.adaptiveencoder.service.orchestration.event;

import com.phillippitts.adaptiveencoder.domain.EncodingMode;

import java.time.Instant;

/**
 * Emitted after each encoder pass exits successfully.
 *
 * @param runId run identifier
 * @param mode encoding mode
 * @param passIndex 1-based pass number
 * @param durationMs wall-clock duration of the pass
 * @param timestamp completion time
 */
public record PassCompletedEvent(String runId, EncodingMode mode, int passIndex, long durationMs, Instant timestamp) {}
