package com.phillippitts.adaptiveencoder.service.progress;

import com.phillippitts.adaptiveencoder.domain.ProgressSample;

import java.time.Instant;
import java.util.Optional;

/**
 * Incremental parser for the encoder's {@code -progress} feed.
 *
 * <p>The feed is a sequence of {@code key=value} lines; each block ends with
 * {@code progress=continue} or {@code progress=end}. Not thread-safe; one parser per pass.
 */
public final class ProgressParser {

    private long outTimeMicros;
    private long frame;
    private double fps;
    private double speed;
    private long totalSize;

    /**
     * Consumes one line.
     *
     * @param line raw feed line
     * @param now receive time of the line
     * @return a sample when the line closes a block
     */
    public Optional<ProgressSample> accept(String line, Instant now) {
        if (line == null) {
            return Optional.empty();
        }
        int eq = line.indexOf('=');
        if (eq <= 0) {
            return Optional.empty();
        }
        String key = line.substring(0, eq).trim();
        String value = line.substring(eq + 1).trim();
        switch (key) {
            case "out_time_us", "out_time_ms" -> outTimeMicros = parseLong(value, outTimeMicros);
            case "frame" -> frame = parseLong(value, frame);
            case "fps" -> fps = parseDouble(value, fps);
            case "speed" -> speed = parseDouble(value.endsWith("x") ? value.substring(0, value.length() - 1) : value, 0);
            case "total_size" -> totalSize = parseLong(value, totalSize);
            case "progress" -> {
                return Optional.of(new ProgressSample(now, Math.max(0, outTimeMicros), frame, fps, speed,
                        totalSize, "end".equals(value)));
            }
            default -> { }
        }
        return Optional.empty();
    }

    private static long parseLong(String v, long fallback) {
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static double parseDouble(String v, double fallback) {
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
