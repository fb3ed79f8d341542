package com.phillippitts.adaptiveencoder.service.progress;

import com.phillippitts.adaptiveencoder.config.properties.ProgressProperties;
import com.phillippitts.adaptiveencoder.domain.ProgressEstimate;
import com.phillippitts.adaptiveencoder.domain.ProgressSample;
import com.phillippitts.adaptiveencoder.service.encode.RunningPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs one monitoring task per encoder pass.
 *
 * <p>The task reads the pass's progress feed until it closes, notifies the listener at most once
 * per update interval (always for the first and the final block), then waits for the process and
 * completes the returned future with its exit code. A stalled feed suppresses the ETA but never
 * cancels the pass.
 */
@Component
public class ProgressMonitor {

    private static final Logger LOG = LogManager.getLogger(ProgressMonitor.class);

    private final Executor executor;
    private final ProgressProperties props;
    private final Clock clock;

    @Autowired
    public ProgressMonitor(@Qualifier("progressExecutor") Executor executor, ProgressProperties props) {
        this(executor, props, Clock.systemUTC());
    }

    ProgressMonitor(Executor executor, ProgressProperties props, Clock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Starts monitoring a pass.
     *
     * @param pass running pass
     * @param target expected output used for fractions and ETA
     * @param listener progress receiver
     * @return future completed with the pass exit code
     */
    public CompletableFuture<Integer> monitor(RunningPass pass, ProgressTarget target, ProgressListener listener) {
        Objects.requireNonNull(pass, "pass");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(listener, "listener");
        return CompletableFuture.supplyAsync(() -> watch(pass, target, listener), executor);
    }

    private int watch(RunningPass pass, ProgressTarget target, ProgressListener listener) {
        Instant start = clock.instant();
        ProgressParser parser = new ProgressParser();
        ProgressEstimator estimator = new ProgressEstimator(props.maxEtaHours(), props.minSizeProjectionFraction());
        StallDetector stall = new StallDetector(Duration.ofSeconds(props.stallSeconds()));
        Duration interval = Duration.ofSeconds(target.updateIntervalSeconds());
        Instant lastEmit = null;
        boolean wasStalled = false;

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(pass.progressStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                Instant now = clock.instant();
                Optional<ProgressSample> parsed = parser.accept(line, now);
                if (parsed.isEmpty()) {
                    continue;
                }
                ProgressSample sample = parsed.get();
                double elapsed = Duration.between(start, now).toMillis() / 1000.0;
                ProgressEstimate estimate = estimator.estimate(sample, target, elapsed);
                boolean stalled = !sample.finished() && stall.update(estimate.fractionComplete(), now);
                if (stalled) {
                    estimate = estimate.asStalled();
                    if (!wasStalled) {
                        LOG.warn("{}: no progress for {}s; ETA suppressed, still waiting",
                                target.label(), props.stallSeconds());
                    }
                }
                wasStalled = stalled;
                if (lastEmit == null || sample.finished() || !now.isBefore(lastEmit.plus(interval))) {
                    notify(listener, target.label(), sample, estimate);
                    lastEmit = now;
                }
            }
        } catch (IOException e) {
            LOG.debug("{}: progress feed closed: {}", target.label(), e.toString());
        }

        try {
            int exit = pass.waitFor();
            LOG.debug("{}: exited {}", target.label(), exit);
            return exit;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pass.destroy();
            throw new CompletionException(e);
        }
    }

    private static void notify(ProgressListener listener, String label, ProgressSample sample,
                               ProgressEstimate estimate) {
        try {
            listener.onProgress(label, sample, estimate);
        } catch (RuntimeException e) {
            LOG.warn("Progress listener failed: {}", e.toString());
        }
    }
}
