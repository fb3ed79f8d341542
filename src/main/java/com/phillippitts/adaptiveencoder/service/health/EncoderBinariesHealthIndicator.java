package com.phillippitts.adaptiveencoder.service.health;

import com.phillippitts.adaptiveencoder.config.properties.EncoderBinariesProperties;
import com.phillippitts.adaptiveencoder.util.BinaryLocator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Health indicator for the external encoder and prober binaries.
 *
 * <p>UP when both resolve to executable files (absolute paths or bare names on {@code PATH}),
 * DOWN otherwise. Exposed via /actuator/health endpoint.
 */
@Component
public class EncoderBinariesHealthIndicator implements HealthIndicator {

    private final EncoderBinariesProperties binaries;

    public EncoderBinariesHealthIndicator(EncoderBinariesProperties binaries) {
        this.binaries = binaries;
    }

    @Override
    public Health health() {
        Optional<Path> ffmpeg = BinaryLocator.resolve(binaries.ffmpegPath());
        Optional<Path> ffprobe = BinaryLocator.resolve(binaries.ffprobePath());

        Health.Builder builder = ffmpeg.isPresent() && ffprobe.isPresent()
                ? Health.up().withDetail("status", "Encoder binaries accessible")
                : Health.down().withDetail("status", "Missing or non-executable encoder binaries");
        return builder
                .withDetail("ffmpeg", formatStatus(binaries.ffmpegPath(), ffmpeg))
                .withDetail("ffprobe", formatStatus(binaries.ffprobePath(), ffprobe))
                .build();
    }

    private static String formatStatus(String configured, Optional<Path> resolved) {
        return resolved.map(p -> "executable at " + p)
                .orElse("NOT FOUND or not executable: " + configured);
    }
}
