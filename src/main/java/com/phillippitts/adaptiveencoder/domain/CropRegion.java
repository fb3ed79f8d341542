package com.phillippitts.adaptiveencoder.domain;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Crop rectangle in source pixels.
 */
public record CropRegion(int width, int height, int x, int y) {

    private static final Pattern CROP = Pattern.compile("(?:crop=)?(\\d+):(\\d+):(\\d+):(\\d+)");

    public CropRegion {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Crop dimensions must be positive: " + width + "x" + height);
        }
        if (x < 0 || y < 0) {
            throw new IllegalArgumentException("Crop offsets must be non-negative: " + x + "," + y);
        }
    }

    /**
     * Parses {@code W:H:X:Y} or {@code crop=W:H:X:Y}.
     *
     * @throws IllegalArgumentException when the value is malformed
     */
    public static CropRegion parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Crop value must not be null");
        }
        Matcher m = CROP.matcher(value.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid crop value '" + value + "' (expected W:H:X:Y)");
        }
        return new CropRegion(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                Integer.parseInt(m.group(3)), Integer.parseInt(m.group(4)));
    }

    /**
     * Pixels removed relative to the full frame: {@code (origW - w) + (origH - h)}.
     */
    public int pixelDelta(int sourceWidth, int sourceHeight) {
        return (sourceWidth - width) + (sourceHeight - height);
    }

    public String toFilter() {
        return "crop=" + width + ":" + height + ":" + x + ":" + y;
    }

    @Override
    public String toString() {
        return width + ":" + height + ":" + x + ":" + y;
    }
}
