package com.phillippitts.adaptiveencoder.service.progress;

import com.phillippitts.adaptiveencoder.domain.ProgressEstimate;
import com.phillippitts.adaptiveencoder.domain.ProgressSample;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Writes one progress line per notification.
 */
@Component
public class LoggingProgressListener implements ProgressListener {

    private static final Logger LOG = LogManager.getLogger(LoggingProgressListener.class);

    @Override
    public void onProgress(String label, ProgressSample sample, ProgressEstimate estimate) {
        String line = format(label, sample, estimate);
        if (estimate.stalled()) {
            LOG.warn("{} (progress stalled)", line);
        } else {
            LOG.info(line);
        }
    }

    static String format(String label, ProgressSample sample, ProgressEstimate estimate) {
        StringBuilder sb = new StringBuilder(label)
                .append(": ").append(String.format(Locale.ROOT, "%.1f%%", estimate.fractionComplete() * 100))
                .append(" | ETA ").append(ProgressFormat.duration(estimate.etaSeconds().orElse(0)));
        if (sample.totalSizeBytes() > 0) {
            sb.append(" | ").append(ProgressFormat.fileSize(sample.totalSizeBytes()));
            estimate.estimatedFinalSizeBytes()
                    .ifPresent(b -> sb.append(" -> ~").append(ProgressFormat.fileSize(b)));
        }
        if (sample.fps() > 0) {
            sb.append(" | ").append(String.format(Locale.ROOT, "%.1f fps", sample.fps()));
        }
        if (sample.speed() > 0) {
            sb.append(" | ").append(String.format(Locale.ROOT, "%.2fx", sample.speed()));
        }
        return sb.toString();
    }
}
