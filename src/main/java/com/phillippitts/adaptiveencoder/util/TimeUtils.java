package com.phillippitts.adaptiveencoder.util;

/**
 * Time conversions shared by the process runner, progress monitor and orchestrator.
 *
 * @since 1.0
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;
    public static final long MICROS_PER_SECOND = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to milliseconds (truncated).
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Elapsed milliseconds since a {@link System#nanoTime()} timestamp.
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Converts encoder output time in microseconds to fractional seconds.
     */
    public static double microsToSeconds(long micros) {
        return (double) micros / MICROS_PER_SECOND;
    }

    /**
     * Formats seconds for encoder arguments ({@code -ss}, {@code -t}) with millisecond precision.
     */
    public static String formatSeconds(double seconds) {
        return String.format(java.util.Locale.ROOT, "%.3f", Math.max(0, seconds));
    }
}
