package com.phillippitts.adaptiveencoder.service.orchestration;

import com.phillippitts.adaptiveencoder.domain.Pass;
import com.phillippitts.adaptiveencoder.domain.PassPlan;
import com.phillippitts.adaptiveencoder.domain.RunContext;
import com.phillippitts.adaptiveencoder.exception.PassFailureException;
import com.phillippitts.adaptiveencoder.exception.PassFailureExceptionBuilder;
import com.phillippitts.adaptiveencoder.service.encode.EncodeJob;
import com.phillippitts.adaptiveencoder.service.encode.EncoderCommandBuilder;
import com.phillippitts.adaptiveencoder.service.encode.PassStateMachine;
import com.phillippitts.adaptiveencoder.service.encode.RunningPass;
import com.phillippitts.adaptiveencoder.service.encode.VideoEncoder;
import com.phillippitts.adaptiveencoder.service.metrics.EncodingMetrics;
import com.phillippitts.adaptiveencoder.service.orchestration.event.PassCompletedEvent;
import com.phillippitts.adaptiveencoder.service.progress.ProgressFormat;
import com.phillippitts.adaptiveencoder.service.progress.ProgressListener;
import com.phillippitts.adaptiveencoder.service.progress.ProgressMonitor;
import com.phillippitts.adaptiveencoder.service.progress.ProgressTarget;
import com.phillippitts.adaptiveencoder.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.stream.Stream;

/**
 * Executes a {@link PassPlan} one pass at a time.
 *
 * <p>Each pass is started through the {@link VideoEncoder} and watched by its own
 * {@link ProgressMonitor} task; the orchestrator blocks on the monitor's future for the exit code.
 * A non-zero exit aborts the remaining plan immediately (pass 2 never starts after a failed
 * pass 1) and is reported as a {@link PassFailureException} carrying the diagnostic tail.
 * There is no retry. Statistics files are removed after the plan, whatever the outcome.
 */
@Component
public class PassOrchestrator {

    private static final Logger LOG = LogManager.getLogger(PassOrchestrator.class);

    private final VideoEncoder encoder;
    private final ProgressMonitor monitor;
    private final ProgressListener listener;
    private final ApplicationEventPublisher publisher;
    private final EncodingMetrics metrics;

    public PassOrchestrator(VideoEncoder encoder, ProgressMonitor monitor, ProgressListener listener,
                            ApplicationEventPublisher publisher, EncodingMetrics metrics) {
        this.encoder = Objects.requireNonNull(encoder, "encoder must not be null");
        this.monitor = Objects.requireNonNull(monitor, "monitor must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Runs every pass of the plan in order.
     *
     * @param ctx run context
     * @param plan pass plan
     * @param job shared command inputs
     * @param progress progress expectations; the label is replaced per pass
     * @return exit status of the last pass (always 0)
     * @throws PassFailureException if any pass cannot start or exits non-zero
     */
    public int execute(RunContext ctx, PassPlan plan, EncodeJob job, ProgressTarget progress) {
        PassStateMachine state = new PassStateMachine(plan.mode());
        int exit = 0;
        try {
            for (Pass pass : plan.passes()) {
                exit = runPass(ctx, plan, pass, job, progress, state);
            }
            LOG.info("{} plan complete ({} pass{})", plan.mode(), plan.passes().size(),
                    plan.passes().size() == 1 ? "" : "es");
            return exit;
        } finally {
            ThreadContext.remove(RunContext.MDC_PASS);
            if (plan.hasStats()) {
                deleteStats(plan.statsFile());
            }
        }
    }

    private int runPass(RunContext ctx, PassPlan plan, Pass pass, EncodeJob job, ProgressTarget progress,
                        PassStateMachine state) {
        ThreadContext.put(RunContext.MDC_PASS, String.valueOf(pass.index()));
        String label = label(plan, pass);
        String mode = plan.mode().name().toLowerCase(Locale.ROOT);
        List<String> command = EncoderCommandBuilder.build(job, pass);
        state.begin(pass.index());
        long start = System.nanoTime();

        RunningPass running;
        try {
            running = encoder.start(command, label);
        } catch (IOException e) {
            state.fail();
            throw PassFailureExceptionBuilder.create("Encoder could not be started")
                    .pass(pass.index())
                    .metadata("mode", plan.mode())
                    .cause(e)
                    .build();
        }

        ProgressTarget target = new ProgressTarget(label, progress.durationSeconds(), progress.totalFrames(),
                progress.updateIntervalSeconds());
        int exit;
        try {
            exit = monitor.monitor(running, target, listener).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.destroy();
            state.fail();
            throw PassFailureExceptionBuilder.create("Interrupted while waiting for encoder pass")
                    .pass(pass.index())
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .diagnosticTail(running.diagnostics().text())
                    .cause(e)
                    .build();
        } catch (ExecutionException e) {
            running.destroy();
            state.fail();
            throw PassFailureExceptionBuilder.create("Progress monitoring failed")
                    .pass(pass.index())
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .diagnosticTail(running.diagnostics().text())
                    .cause(e.getCause())
                    .build();
        }

        long durationMs = TimeUtils.elapsedMillis(start);
        metrics.recordPassLatency(mode, pass.index(), durationMs);
        if (exit != 0) {
            state.fail();
            String tail = running.diagnostics().text();
            LOG.error("{} failed with exit code {}:\n{}", label, exit, tail);
            throw PassFailureExceptionBuilder.create(label + " failed")
                    .pass(pass.index())
                    .exitCode(exit)
                    .durationMs(durationMs)
                    .metadata("mode", plan.mode())
                    .diagnosticTail(tail)
                    .build();
        }
        state.complete(pass.index());
        LOG.info("{} finished in {}", label, ProgressFormat.duration(durationMs / 1000));
        publisher.publishEvent(new PassCompletedEvent(ctx.runId(), plan.mode(), pass.index(), durationMs,
                Instant.now()));
        return exit;
    }

    static String label(PassPlan plan, Pass pass) {
        if (!plan.mode().isTwoPass()) {
            return plan.mode() + " Encoding (Single Pass)";
        }
        return pass.writesOutput()
                ? plan.mode() + " Second Pass (Final Encoding)"
                : plan.mode() + " First Pass (Analysis)";
    }

    /**
     * Removes the statistics file and its companions ({@code .cutree}, {@code .temp}).
     */
    static void deleteStats(Path statsFile) {
        Path dir = statsFile.toAbsolutePath().getParent();
        String prefix = statsFile.getFileName().toString();
        if (dir == null || !Files.isDirectory(dir)) {
            return;
        }
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(p -> p.getFileName().toString().startsWith(prefix)).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                    LOG.debug("Deleted stats file {}", p.getFileName());
                } catch (IOException e) {
                    LOG.warn("Could not delete stats file {}: {}", p, e.toString());
                }
            });
        } catch (IOException e) {
            LOG.warn("Could not list stats directory {}: {}", dir, e.toString());
        }
    }
}
