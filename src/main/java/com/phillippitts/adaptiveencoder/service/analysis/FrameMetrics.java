package com.phillippitts.adaptiveencoder.service.analysis;

import java.util.Arrays;

/**
 * Pure image statistics used for grain and texture estimation.
 */
final class FrameMetrics {

    private FrameMetrics() {}

    /**
     * Mean absolute 4-neighbour Laplacian response. Flat, clean areas give ~0; film grain gives a
     * response proportional to its amplitude.
     */
    static double highFrequencyNoise(GrayFrame f) {
        if (f.width() < 3 || f.height() < 3) {
            return 0;
        }
        long sum = 0;
        long n = 0;
        for (int y = 1; y < f.height() - 1; y++) {
            for (int x = 1; x < f.width() - 1; x++) {
                int lap = 4 * f.at(x, y) - f.at(x - 1, y) - f.at(x + 1, y) - f.at(x, y - 1) - f.at(x, y + 1);
                sum += Math.abs(lap);
                n++;
            }
        }
        return (double) sum / n;
    }

    /**
     * Median variance of non-overlapping {@code patch x patch} blocks. The median ignores the
     * minority of blocks that straddle real edges.
     */
    static double medianPatchVariance(GrayFrame f, int patch) {
        int cols = f.width() / patch;
        int rows = f.height() / patch;
        if (cols == 0 || rows == 0) {
            return 0;
        }
        double[] variances = new double[cols * rows];
        int count = patch * patch;
        for (int by = 0; by < rows; by++) {
            for (int bx = 0; bx < cols; bx++) {
                long sum = 0;
                long sumSq = 0;
                for (int y = by * patch; y < (by + 1) * patch; y++) {
                    for (int x = bx * patch; x < (bx + 1) * patch; x++) {
                        int v = f.at(x, y);
                        sum += v;
                        sumSq += (long) v * v;
                    }
                }
                double mean = (double) sum / count;
                variances[by * cols + bx] = (double) sumSq / count - mean * mean;
            }
        }
        Arrays.sort(variances);
        int mid = variances.length / 2;
        return variances.length % 2 == 1 ? variances[mid] : (variances[mid - 1] + variances[mid]) / 2;
    }

    /**
     * Number of interior pixels whose Sobel gradient magnitude exceeds {@code threshold}.
     */
    static long strongEdgeCount(GrayFrame f, int threshold) {
        long count = 0;
        for (int y = 1; y < f.height() - 1; y++) {
            for (int x = 1; x < f.width() - 1; x++) {
                if (sobelMagnitude(f, x, y) > threshold) {
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * Percentage of interior pixels whose Sobel gradient magnitude exceeds {@code threshold}.
     */
    static double edgeDensityPercent(GrayFrame f, int threshold) {
        long interior = (long) Math.max(0, f.width() - 2) * Math.max(0, f.height() - 2);
        if (interior == 0) {
            return 0;
        }
        return strongEdgeCount(f, threshold) * 100.0 / interior;
    }

    /**
     * Linearly stretches the luma range to 0-255, exposing grain hidden in dark frames.
     */
    static GrayFrame stretchContrast(GrayFrame f) {
        int min = 255;
        int max = 0;
        for (byte b : f.pixels()) {
            int v = b & 0xFF;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        if (max <= min) {
            return f;
        }
        double scale = 255.0 / (max - min);
        byte[] out = new byte[f.pixels().length];
        for (int i = 0; i < out.length; i++) {
            out[i] = (byte) Math.round(((f.pixels()[i] & 0xFF) - min) * scale);
        }
        return new GrayFrame(f.width(), f.height(), out);
    }

    private static double sobelMagnitude(GrayFrame f, int x, int y) {
        int gx = -f.at(x - 1, y - 1) - 2 * f.at(x - 1, y) - f.at(x - 1, y + 1)
                + f.at(x + 1, y - 1) + 2 * f.at(x + 1, y) + f.at(x + 1, y + 1);
        int gy = -f.at(x - 1, y - 1) - 2 * f.at(x, y - 1) - f.at(x + 1, y - 1)
                + f.at(x - 1, y + 1) + 2 * f.at(x, y + 1) + f.at(x + 1, y + 1);
        return Math.sqrt((double) gx * gx + (double) gy * gy);
    }
}
