package com.phillippitts.adaptiveencoder.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One encoder invocation within a {@link PassPlan}.
 *
 * @param index 1-based pass number
 * @param purpose analysis or final
 * @param preset encoder preset for this pass
 * @param rateControl rate-control arguments
 * @param statsFile statistics file shared by a two-pass plan, or null for single-pass plans
 */
public record Pass(int index, PassPurpose purpose, String preset, RateControl rateControl, Path statsFile) {

    public Pass {
        if (index < 1) {
            throw new IllegalArgumentException("Pass index is 1-based: " + index);
        }
        Objects.requireNonNull(purpose, "purpose");
        Objects.requireNonNull(preset, "preset");
        Objects.requireNonNull(rateControl, "rateControl");
    }

    public boolean writesOutput() {
        return purpose == PassPurpose.FINAL;
    }
}
