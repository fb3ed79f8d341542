package com.phillippitts.adaptiveencoder.service.progress;

import com.phillippitts.adaptiveencoder.domain.ProgressEstimate;
import com.phillippitts.adaptiveencoder.domain.ProgressSample;

/**
 * Receives throttled progress updates from the monitor thread.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(String label, ProgressSample sample, ProgressEstimate estimate);
}
