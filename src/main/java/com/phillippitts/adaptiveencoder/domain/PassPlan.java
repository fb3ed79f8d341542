package com.phillippitts.adaptiveencoder.domain;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Ordered passes for one encoding mode.
 *
 * @param mode encoding mode the plan was built for
 * @param passes passes in execution order
 * @param statsFile statistics handle shared by both passes, or null for CRF
 */
public record PassPlan(EncodingMode mode, List<Pass> passes, Path statsFile) {

    public PassPlan {
        Objects.requireNonNull(mode, "mode");
        passes = List.copyOf(passes);
        if (passes.size() != mode.passCount()) {
            throw new IllegalArgumentException(mode + " requires " + mode.passCount() + " passes, got " + passes.size());
        }
        if (mode.isTwoPass() && statsFile == null) {
            throw new IllegalArgumentException(mode + " requires a stats handle");
        }
        if (!mode.isTwoPass() && statsFile != null) {
            throw new IllegalArgumentException(mode + " must not carry a stats handle");
        }
    }

    public boolean hasStats() {
        return statsFile != null;
    }
}
