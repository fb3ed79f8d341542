package com.phillippitts.adaptiveencoder.service.events;

import com.phillippitts.adaptiveencoder.service.orchestration.event.EncodingCompletedEvent;
import com.phillippitts.adaptiveencoder.service.orchestration.event.EncodingFailedEvent;
import com.phillippitts.adaptiveencoder.service.orchestration.event.PassCompletedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central handler for run outcome events. Failure hints are throttled to avoid log spam in batches.
 */
@Component
class EncodingEventsListener {
    private static final Logger LOG = LogManager.getLogger(EncodingEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onPassCompleted(PassCompletedEvent e) {
        LOG.debug("Run {} {} pass {} completed in {} ms", e.runId(), e.mode(), e.passIndex(), e.durationMs());
    }

    @EventListener
    void onCompleted(EncodingCompletedEvent e) {
        var r = e.result();
        LOG.info("Run {} finished: {} -> {} ({}, {} passes, ratio {})", r.runId(), r.profileName(),
                r.outputPath().getFileName(), r.mode(), r.passCount(), ratio(r.compressionRatio()));
    }

    static String ratio(double compressionRatio) {
        return String.format(Locale.ROOT, "%.2f", compressionRatio);
    }

    @EventListener
    void onFailed(EncodingFailedEvent e) {
        String key = "failure-" + e.kind();
        if (!shouldLog(key)) {
            return;
        }
        switch (e.kind()) {
            case PROBE -> LOG.warn("Input could not be probed ({}). Check that the file is a readable video "
                    + "and that encoder.binaries.ffprobe-path is correct.", e.input().getFileName());
            case PASS -> LOG.warn("Encoder pass failed for {}. Check encoder.binaries.ffmpeg-path and that the "
                    + "encoder build includes the configured codec.", e.input().getFileName());
            case PROFILE -> LOG.warn("Unknown profile requested. GET /api/profiles lists the catalog.");
            default -> LOG.warn("Run failed for {}: {}", e.input().getFileName(), e.message());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
