/**
 * Logging correlation support.
 *
 * <p>{@link com.phillippitts.adaptiveencoder.config.logging.MdcFilter} tags HTTP requests with a
 * {@code requestId}; {@link com.phillippitts.adaptiveencoder.domain.RunContext} tags each run with a
 * {@code runId}; the pass orchestrator adds {@code pass}. The console layout in
 * {@code log4j2-spring.xml} prints all three.
 */
package com.phillippitts.adaptiveencoder.config.logging;
