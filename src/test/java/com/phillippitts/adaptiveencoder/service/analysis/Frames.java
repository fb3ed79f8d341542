package com.phillippitts.adaptiveencoder.service.analysis;

import java.util.Arrays;

/**
 * Synthetic luma frames for analysis tests.
 */
final class Frames {

    private Frames() {}

    static GrayFrame flat(int w, int h, int value) {
        byte[] px = new byte[w * h];
        Arrays.fill(px, (byte) value);
        return new GrayFrame(w, h, px);
    }

    /**
     * Pixel-level checkerboard {@code base +/- amplitude}: Laplacian response {@code 8 * amplitude},
     * patch variance {@code amplitude^2}, no Sobel edges.
     */
    static GrayFrame checker(int w, int h, int base, int amplitude) {
        byte[] px = new byte[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                px[y * w + x] = (byte) ((x + y) % 2 == 0 ? base + amplitude : base - amplitude);
            }
        }
        return new GrayFrame(w, h, px);
    }

    /**
     * Left half black, right half white.
     */
    static GrayFrame split(int w, int h) {
        byte[] px = new byte[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = w / 2; x < w; x++) {
                px[y * w + x] = (byte) 255;
            }
        }
        return new GrayFrame(w, h, px);
    }
}
