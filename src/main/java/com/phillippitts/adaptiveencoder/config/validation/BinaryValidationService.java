package com.phillippitts.adaptiveencoder.config.validation;

import com.phillippitts.adaptiveencoder.config.properties.EncoderBinariesProperties;
import com.phillippitts.adaptiveencoder.exception.BinaryNotFoundException;
import com.phillippitts.adaptiveencoder.util.BinaryLocator;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Validates the encoder and prober binaries at startup.
 *
 * Fail-fast: abort application startup with an actionable error if either binary is missing
 * or not executable. Disable with {@code encoder.validation.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "encoder.validation.enabled", havingValue = "true", matchIfMissing = true)
class BinaryValidationService {

    private static final Logger LOG = LogManager.getLogger(BinaryValidationService.class);

    private final EncoderBinariesProperties binaries;

    BinaryValidationService(EncoderBinariesProperties binaries) {
        this.binaries = binaries;
    }

    @PostConstruct
    void validateOnStartup() {
        LOG.info("Validating encoder binaries... os={}, arch={}",
                System.getProperty("os.name"), System.getProperty("os.arch"));
        Path ffmpeg = validate(binaries.ffmpegPath(), "ffmpeg", "encoder.binaries.ffmpeg-path");
        Path ffprobe = validate(binaries.ffprobePath(), "ffprobe", "encoder.binaries.ffprobe-path");
        LOG.info("Binary validation complete: ffmpeg='{}', ffprobe='{}'", ffmpeg, ffprobe);
    }

    // Visible for tests
    Path validate(String configured, String description, String property) {
        return BinaryLocator.resolve(configured).orElseThrow(() -> new BinaryNotFoundException(
                description + " not found or not executable: '" + configured + "' (set " + property
                        + " to an absolute path or install it on PATH)"));
    }
}
