package com.phillippitts.adaptiveencoder.domain;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Per-run state passed explicitly to every component that needs it.
 *
 * <p>Owns a private work directory under the configured temp root so that concurrent runs never
 * share stats files or sample frames. Closing the context deletes the directory and removes the
 * {@code runId} logging key.
 */
public final class RunContext implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(RunContext.class);
    public static final String MDC_RUN_ID = "runId";
    public static final String MDC_PASS = "pass";

    private final String runId;
    private final Path input;
    private final Path workDir;
    private final long startNanos;

    private RunContext(String runId, Path input, Path workDir) {
        this.runId = runId;
        this.input = input;
        this.workDir = workDir;
        this.startNanos = System.nanoTime();
    }

    /**
     * Creates the run's work directory and registers the run id in the logging context.
     *
     * @param tempRoot root directory for per-run work directories
     * @param input input file of the run
     * @return open run context
     * @throws UncheckedIOException if the work directory cannot be created
     */
    public static RunContext open(Path tempRoot, Path input) {
        Objects.requireNonNull(tempRoot, "tempRoot");
        Objects.requireNonNull(input, "input");
        String runId = UUID.randomUUID().toString().substring(0, 8);
        Path dir = tempRoot.resolve("run-" + runId);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create work directory " + dir, e);
        }
        ThreadContext.put(MDC_RUN_ID, runId);
        return new RunContext(runId, input, dir);
    }

    public String runId() {
        return runId;
    }

    public Path input() {
        return input;
    }

    public Path workDir() {
        return workDir;
    }

    public long startNanos() {
        return startNanos;
    }

    /**
     * Stats handle shared by both passes of a two-pass plan.
     */
    public Path statsFile() {
        return workDir.resolve("x265_2pass_" + runId + ".log");
    }

    @Override
    public void close() {
        ThreadContext.remove(MDC_RUN_ID);
        if (!Files.exists(workDir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(workDir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(RunContext::deleteQuietly);
        } catch (IOException e) {
            LOG.warn("Could not clean work directory {}: {}", workDir, e.toString());
        }
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            LOG.debug("Could not delete {}: {}", p, e.toString());
        }
    }
}
