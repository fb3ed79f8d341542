package com.phillippitts.adaptiveencoder.util;

import java.time.Duration;

/**
 * Standard timeout values for subprocess and monitor-thread management.
 *
 * <p>Used by {@link com.phillippitts.adaptiveencoder.service.process.ProcessRunner} for the short
 * prober/analysis invocations and by the encoder pass handle for long-running passes.
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Time allowed for stream readers to flush buffered output after the process exits.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Best-effort join of stream readers during cleanup. Readers are daemon threads.
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Wait after {@link Process#destroy()} before escalating to a forcible kill.
     * Encoders flush container trailers on SIGTERM, so this is longer than for short tools.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofSeconds(2);

    /**
     * Wait after {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
