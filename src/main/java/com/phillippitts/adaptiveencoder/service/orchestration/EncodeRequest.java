package com.phillippitts.adaptiveencoder.service.orchestration;

import com.phillippitts.adaptiveencoder.domain.EncodeOverrides;
import com.phillippitts.adaptiveencoder.domain.EncodingMode;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Input of {@link AdaptiveEncodingService#decideAndEncode(EncodeRequest)}.
 *
 * @param input source file
 * @param profile profile name, or null/blank/{@value #AUTO} for automatic selection
 * @param mode encoding mode, or null for the configured default
 * @param overrides caller adjustments, or null for none
 * @param output destination file, or null for {@code <name>_<id>.<ext>} next to the input
 */
public record EncodeRequest(Path input, String profile, EncodingMode mode, EncodeOverrides overrides, Path output) {

    public static final String AUTO = "auto";

    public EncodeRequest {
        Objects.requireNonNull(input, "input");
        overrides = overrides == null ? EncodeOverrides.none() : overrides;
        profile = profile == null ? null : profile.trim();
    }

    public static EncodeRequest auto(Path input, EncodingMode mode) {
        return new EncodeRequest(input, AUTO, mode, null, null);
    }

    public boolean isAuto() {
        return profile == null || profile.isEmpty() || AUTO.equals(profile.toLowerCase(Locale.ROOT));
    }
}
