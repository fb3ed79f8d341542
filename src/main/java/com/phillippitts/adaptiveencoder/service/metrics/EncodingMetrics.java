package com.phillippitts.adaptiveencoder.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for encoding runs.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Run and pass latency per mode</li>
 *   <li>Success/failure counts per mode and failure kind</li>
 *   <li>Classification decisions per content type and source</li>
 *   <li>Crop decisions (detected, manual, none)</li>
 *   <li>Complexity score distribution</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class EncodingMetrics {

    private static final String METRIC_PREFIX = "adaptiveencoder";

    private final MeterRegistry registry;

    public EncodingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the duration of a whole run.
     *
     * @param mode encoding mode (crf, abr, cbr)
     * @param durationMillis duration in milliseconds
     */
    public void recordRunLatency(String mode, long durationMillis) {
        Timer.builder(METRIC_PREFIX + ".run.latency")
                .description("Time taken by a complete encoding run")
                .tag("mode", mode)
                .register(registry)
                .record(durationMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * Records the duration of one encoder pass.
     */
    public void recordPassLatency(String mode, int passIndex, long durationMillis) {
        Timer.builder(METRIC_PREFIX + ".pass.latency")
                .description("Time taken by a single encoder pass")
                .tag("mode", mode)
                .tag("pass", String.valueOf(passIndex))
                .register(registry)
                .record(durationMillis, TimeUnit.MILLISECONDS);
    }

    public void incrementSuccess(String mode) {
        Counter.builder(METRIC_PREFIX + ".run.success")
                .description("Number of successful encoding runs")
                .tag("mode", mode)
                .register(registry)
                .increment();
    }

    /**
     * @param mode encoding mode, or "unknown" when the run failed before planning
     * @param kind failure kind (probe, pass, profile, internal)
     */
    public void incrementFailure(String mode, String kind) {
        Counter.builder(METRIC_PREFIX + ".run.failure")
                .description("Number of failed encoding runs")
                .tag("mode", mode)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    /**
     * Records which content type was chosen and by which decision path.
     */
    public void recordClassification(String contentType, String source) {
        Counter.builder(METRIC_PREFIX + ".classification")
                .description("Content classifications by type and decision path")
                .tag("type", contentType)
                .tag("source", source)
                .register(registry)
                .increment();
    }

    /**
     * @param decision "detected", "manual" or "none"
     */
    public void recordCropDecision(String decision) {
        Counter.builder(METRIC_PREFIX + ".crop.decision")
                .description("Crop decisions per run")
                .tag("decision", decision)
                .register(registry)
                .increment();
    }

    public void recordComplexity(int score) {
        DistributionSummary.builder(METRIC_PREFIX + ".complexity.score")
                .description("Complexity scores of analysed inputs")
                .register(registry)
                .record(score);
    }
}
