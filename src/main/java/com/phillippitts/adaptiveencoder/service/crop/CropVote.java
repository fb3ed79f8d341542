package com.phillippitts.adaptiveencoder.service.crop;

import com.phillippitts.adaptiveencoder.domain.CropRegion;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pure voting and acceptance rules for crop detection.
 */
public final class CropVote {

    private CropVote() {}

    /**
     * Most frequent exact rectangle. Ties go to the largest area, i.e. the least aggressive crop.
     *
     * @param candidates rectangles to vote on
     * @return winning rectangle, or empty when there are no candidates
     */
    public static Optional<CropRegion> mode(Collection<CropRegion> candidates) {
        Map<CropRegion, Integer> counts = new LinkedHashMap<>();
        for (CropRegion c : candidates) {
            counts.merge(c, 1, Integer::sum);
        }
        CropRegion best = null;
        int bestCount = 0;
        for (Map.Entry<CropRegion, Integer> e : counts.entrySet()) {
            CropRegion c = e.getKey();
            int n = e.getValue();
            if (n > bestCount || (n == bestCount && area(c) > area(best))) {
                best = c;
                bestCount = n;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Accepts a crop when its pixel delta reaches {@code minThreshold} or exceeds
     * {@code percentThreshold} percent of {@code width + height}.
     */
    public static boolean accept(CropRegion crop, int sourceWidth, int sourceHeight, int minThreshold,
                                 double percentThreshold) {
        int delta = crop.pixelDelta(sourceWidth, sourceHeight);
        return delta >= minThreshold || percentDelta(crop, sourceWidth, sourceHeight) > percentThreshold;
    }

    static double percentDelta(CropRegion crop, int sourceWidth, int sourceHeight) {
        return crop.pixelDelta(sourceWidth, sourceHeight) * 100.0 / (sourceWidth + sourceHeight);
    }

    /**
     * Start times of the near-start, middle and near-end windows. Each is kept {@code edgeSkip}
     * away from the true start and end where the duration allows, and inside the input.
     */
    public static List<Double> sampleStarts(double duration, int edgeSkip, int sampleLength) {
        double latest = Math.max(0, Math.floor(duration) - 1);
        double start = Math.min(edgeSkip, Math.max(0, Math.floor(duration) - sampleLength));
        double middle = Math.floor(duration / 2);
        double end = Math.max(start, Math.floor(duration) - edgeSkip);
        return List.of(Math.min(start, latest), Math.min(middle, latest), Math.min(end, latest));
    }

    private static long area(CropRegion c) {
        return c == null ? -1 : (long) c.width() * c.height();
    }
}
