package com.phillippitts.adaptiveencoder.domain;

import java.util.Objects;

/**
 * Final rate-control values for one run.
 *
 * @param crf final CRF, always within [{@value #MIN_CRF}, {@value #MAX_CRF}]
 * @param bitrateKbps target bitrate in kbps (a target, not a cap)
 * @param encoderParams profile parameters merged with HDR additions when applicable
 */
public record AdaptedParameters(double crf, int bitrateKbps, EncoderParams encoderParams) {

    public static final double MIN_CRF = 15.0;
    public static final double MAX_CRF = 28.0;

    public AdaptedParameters {
        if (crf < MIN_CRF || crf > MAX_CRF) {
            throw new IllegalArgumentException("CRF must be within [" + MIN_CRF + "," + MAX_CRF + "]: " + crf);
        }
        if (bitrateKbps <= 0) {
            throw new IllegalArgumentException("bitrateKbps must be positive: " + bitrateKbps);
        }
        Objects.requireNonNull(encoderParams, "encoderParams");
    }

    /**
     * CRF as passed to the encoder, with one decimal place.
     */
    public String crfArgument() {
        return String.format(java.util.Locale.ROOT, "%.1f", crf);
    }
}
