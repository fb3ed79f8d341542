package com.phillippitts.adaptiveencoder.service.analysis;

import java.util.Objects;

/**
 * 8-bit luma plane extracted from the source.
 *
 * @param width width in pixels
 * @param height height in pixels
 * @param pixels row-major luma values, length {@code width * height}
 */
public record GrayFrame(int width, int height, byte[] pixels) {

    public GrayFrame {
        Objects.requireNonNull(pixels, "pixels");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Frame dimensions must be positive: " + width + "x" + height);
        }
        if (pixels.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " bytes, got " + pixels.length);
        }
    }

    /**
     * Luma at (x, y) in 0-255.
     */
    public int at(int x, int y) {
        return pixels[y * width + x] & 0xFF;
    }

    /**
     * Centered sub-window of at most {@code w x h} pixels.
     */
    public GrayFrame center(int w, int h) {
        int cw = Math.min(w, width);
        int ch = Math.min(h, height);
        if (cw == width && ch == height) {
            return this;
        }
        int x0 = (width - cw) / 2;
        int y0 = (height - ch) / 2;
        byte[] out = new byte[cw * ch];
        for (int y = 0; y < ch; y++) {
            System.arraycopy(pixels, (y0 + y) * width + x0, out, y * cw, cw);
        }
        return new GrayFrame(cw, ch, out);
    }
}
