package com.phillippitts.adaptiveencoder.service.process;

import com.phillippitts.adaptiveencoder.config.properties.EncoderBinariesProperties;
import com.phillippitts.adaptiveencoder.util.ProcessTimeouts;
import com.phillippitts.adaptiveencoder.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs short-lived prober and sampling commands to completion.
 *
 * <p>Responsibilities:
 * - Start the process via {@link ProcessFactory}
 * - Capture stdout (raw bytes: JSON or frames) and stderr (filter diagnostics) concurrently
 * - Enforce a timeout and terminate runaway processes
 *
 * <p>Long-running encoder passes do not go through this class; they are streamed by the encoder.
 */
@Component
public class ProcessRunner {

    private static final Logger LOG = LogManager.getLogger(ProcessRunner.class);

    /** Raw frame extraction of a 4K gray frame is ~8.3 MB. */
    static final int STDOUT_MAX_BYTES = 16 * 1024 * 1024;

    private final ProcessFactory processFactory;
    private final int maxStderrBytes;

    @Autowired
    public ProcessRunner(ProcessFactory processFactory, EncoderBinariesProperties binaries) {
        this(processFactory, binaries.maxDiagnosticBytes());
    }

    public ProcessRunner(ProcessFactory processFactory, int maxStderrBytes) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.maxStderrBytes = maxStderrBytes;
    }

    /**
     * Runs a command and waits for it to finish.
     *
     * @param command full command line
     * @param timeout maximum run time; the process is destroyed when exceeded
     * @param label short name used for gobbler threads and logs
     * @return captured result; {@link ProcessResult#timedOut()} is set when the timeout fired
     * @throws IOException if the process cannot be started, or the wait is interrupted
     *                     ({@link InterruptedIOException}, interrupt flag restored)
     */
    public ProcessResult run(List<String> command, Duration timeout, String label) throws IOException {
        Objects.requireNonNull(command, "command");
        long start = System.nanoTime();
        LOG.debug("Running {}: {}", label, command);

        Process process = processFactory.start(command, null);
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        StringBuilder stderr = new StringBuilder();
        Thread outGobbler = StreamGobblers.bytes(process.getInputStream(), stdout, label + "-out", STDOUT_MAX_BYTES);
        Thread errGobbler = StreamGobblers.text(process.getErrorStream(), stderr, label + "-err", maxStderrBytes);

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                LOG.warn("{} timed out after {}s; terminating", label, timeout.toSeconds());
                ProcessTermination.destroy(process);
                StreamGobblers.joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
                StreamGobblers.joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
                return result(-1, stdout, stderr, start, true);
            }
            StreamGobblers.joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            StreamGobblers.joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            ProcessResult result = result(process.exitValue(), stdout, stderr, start, false);
            LOG.debug("{} exited {} in {}ms ({} stdout bytes)", label, result.exitCode(), result.durationMs(),
                    result.stdout().length);
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ProcessTermination.destroy(process);
            InterruptedIOException ex = new InterruptedIOException("Interrupted while waiting for " + label);
            ex.initCause(e);
            throw ex;
        }
    }

    private static ProcessResult result(int exitCode, ByteArrayOutputStream stdout, StringBuilder stderr,
                                        long start, boolean timedOut) {
        byte[] out;
        synchronized (stdout) {
            out = stdout.toByteArray();
        }
        String err;
        synchronized (stderr) {
            err = stderr.toString();
        }
        return new ProcessResult(exitCode, out, err, TimeUtils.elapsedMillis(start), timedOut);
    }
}
