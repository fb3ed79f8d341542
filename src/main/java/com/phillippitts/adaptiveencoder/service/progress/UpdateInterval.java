package com.phillippitts.adaptiveencoder.service.progress;

import com.phillippitts.adaptiveencoder.domain.EncodingMode;

/**
 * Adaptive notification interval: 1s baseline, 2s for 1440p-class and 3s for 4K-class frames,
 * +2 above score 70 or +1 above 50, +1 for CBR, clamped to [1, 5].
 */
public final class UpdateInterval {

    static final int MIN_SECONDS = 1;
    static final int MAX_SECONDS = 5;

    private UpdateInterval() {}

    public static int seconds(int width, int height, int complexityScore, EncodingMode mode) {
        int interval;
        if (width >= 3000 || height >= 2160) {
            interval = 3;
        } else if (height >= 1440) {
            interval = 2;
        } else {
            interval = 1;
        }
        if (complexityScore > 70) {
            interval += 2;
        } else if (complexityScore > 50) {
            interval += 1;
        }
        if (mode == EncodingMode.CBR) {
            interval += 1;
        }
        return Math.max(MIN_SECONDS, Math.min(MAX_SECONDS, interval));
    }
}
