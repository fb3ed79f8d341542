package com.phillippitts.adaptiveencoder.service.progress;

import java.util.Locale;

/**
 * Human-readable sizes and durations for progress lines.
 */
public final class ProgressFormat {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private ProgressFormat() {}

    /**
     * Binary units with one decimal; a trailing {@code .0} is dropped ({@code 1536 -> "1.5KB"},
     * {@code 2048 -> "2KB"}).
     */
    public static String fileSize(long bytes) {
        double size = bytes;
        int unit = 0;
        while (size >= 1024 && unit < UNITS.length - 1) {
            size /= 1024;
            unit++;
        }
        if (unit == 0) {
            return bytes + UNITS[0];
        }
        String text = String.format(Locale.ROOT, "%.1f", size);
        if (text.endsWith(".0")) {
            text = text.substring(0, text.length() - 2);
        }
        return text + UNITS[unit];
    }

    /**
     * {@code HH:MM:SS} from one hour, else {@code MM:SS}; {@code calculating...} when not positive.
     */
    public static String duration(long seconds) {
        if (seconds <= 0) {
            return "calculating...";
        }
        long h = seconds / 3600;
        long m = (seconds % 3600) / 60;
        long s = seconds % 60;
        if (h > 0) {
            return String.format(Locale.ROOT, "%02d:%02d:%02d", h, m, s);
        }
        return String.format(Locale.ROOT, "%02d:%02d", m, s);
    }
}
