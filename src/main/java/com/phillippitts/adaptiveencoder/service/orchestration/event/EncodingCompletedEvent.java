package com.phillippitts.adaptiveencoder.service.orchestration.event;

import com.phillippitts.adaptiveencoder.domain.EncodeResult;

import java.time.Instant;

/**
 * Emitted when a run produced its output file.
 *
 * @param result run summary
 * @param timestamp completion time
 */
public record EncodingCompletedEvent(EncodeResult result, Instant timestamp) {}
