package com.phillippitts.adaptiveencoder.service.process;

import com.phillippitts.adaptiveencoder.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.TimeUnit;

/**
 * Graceful-then-forcible process termination.
 */
public final class ProcessTermination {

    private static final Logger LOG = LogManager.getLogger(ProcessTermination.class);

    private ProcessTermination() {
        // Utility class - prevent instantiation
    }

    /**
     * Sends a polite termination request, then kills the process if it has not exited in time.
     */
    public static void destroy(Process process) {
        if (process == null) {
            return;
        }
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        }
    }
}
