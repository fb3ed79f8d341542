package com.phillippitts.adaptiveencoder.service.encode;

import com.phillippitts.adaptiveencoder.domain.AdaptedParameters;
import com.phillippitts.adaptiveencoder.domain.EncodingMode;
import com.phillippitts.adaptiveencoder.domain.Pass;
import com.phillippitts.adaptiveencoder.domain.PassPlan;
import com.phillippitts.adaptiveencoder.domain.PassPurpose;
import com.phillippitts.adaptiveencoder.domain.RateControl;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Maps an encoding mode to its fixed pass plan.
 *
 * <ul>
 *   <li>CRF: one final pass at the adapted CRF, no stats handle</li>
 *   <li>ABR: analysis pass at the analysis preset, then final pass at the profile preset, both
 *       at the adapted bitrate</li>
 *   <li>CBR: as ABR with {@code minrate = maxrate = B} and {@code bufsize = round(1.5 * B)}</li>
 * </ul>
 */
public final class PassPlanner {

    private PassPlanner() {}

    public static PassPlan plan(EncodingMode mode, AdaptedParameters params, String profilePreset,
                                String analysisPreset, Path statsFile) {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(params, "params");
        return switch (mode) {
            case CRF -> new PassPlan(mode,
                    List.of(new Pass(1, PassPurpose.FINAL, profilePreset, RateControl.crf(params.crf()), null)),
                    null);
            case ABR -> twoPass(mode, RateControl.average(params.bitrateKbps()), profilePreset, analysisPreset,
                    statsFile);
            case CBR -> twoPass(mode, RateControl.constant(params.bitrateKbps()), profilePreset, analysisPreset,
                    statsFile);
        };
    }

    private static PassPlan twoPass(EncodingMode mode, RateControl rate, String profilePreset,
                                    String analysisPreset, Path statsFile) {
        Objects.requireNonNull(statsFile, "statsFile");
        return new PassPlan(mode, List.of(
                new Pass(1, PassPurpose.ANALYSIS, analysisPreset, rate, statsFile),
                new Pass(2, PassPurpose.FINAL, profilePreset, rate, statsFile)), statsFile);
    }
}
