package com.phillippitts.adaptiveencoder.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable, insertion-ordered set of encoder-library parameters ({@code key=value}).
 *
 * <p>Parsing accepts the colon-separated form used in profile definitions. Bare flags become
 * {@code flag=1} and {@code no-flag} becomes {@code flag=0}. Commas inside values
 * (e.g. {@code deblock=-1,-1}) are preserved.
 */
public final class EncoderParams {

    private static final EncoderParams EMPTY = new EncoderParams(Map.of());

    private final Map<String, String> values;

    private EncoderParams(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static EncoderParams empty() {
        return EMPTY;
    }

    public static EncoderParams of(Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        return new EncoderParams(values);
    }

    /**
     * Parses a colon-separated parameter string.
     *
     * @param params string such as {@code "no-sao:bframes=8:weightb"} (may be null or blank)
     * @return parsed parameters
     */
    public static EncoderParams parse(String params) {
        if (params == null || params.isBlank()) {
            return EMPTY;
        }
        Map<String, String> parsed = new LinkedHashMap<>();
        for (String token : params.split(":")) {
            String t = token.trim();
            if (t.isEmpty()) {
                continue;
            }
            int eq = t.indexOf('=');
            if (eq > 0) {
                parsed.put(t.substring(0, eq), t.substring(eq + 1));
            } else if (t.startsWith("no-")) {
                parsed.put(t.substring(3), "0");
            } else {
                parsed.put(t, "1");
            }
        }
        return new EncoderParams(parsed);
    }

    public EncoderParams with(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new EncoderParams(copy);
    }

    public EncoderParams withAll(EncoderParams other) {
        Map<String, String> copy = new LinkedHashMap<>(values);
        copy.putAll(other.values);
        return new EncoderParams(copy);
    }

    /**
     * Returns a copy without any key equal to {@code key} or ending in {@code -key}
     * ({@code without("bitrate")} also drops {@code vbv-bitrate}-style keys).
     */
    public EncoderParams without(String key) {
        Map<String, String> copy = new LinkedHashMap<>(values);
        copy.keySet().removeIf(k -> k.equals(key) || k.endsWith("-" + key));
        return new EncoderParams(copy);
    }

    public String get(String key) {
        return values.get(key);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, String> asMap() {
        return values;
    }

    /**
     * Renders the parameters as a single encoder argument, e.g. {@code "sao=0:bframes=8"}.
     */
    public String toArgument() {
        return values.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(":"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof EncoderParams other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return toArgument();
    }
}
