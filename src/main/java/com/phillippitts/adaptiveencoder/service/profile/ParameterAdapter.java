package com.phillippitts.adaptiveencoder.service.profile;

import com.phillippitts.adaptiveencoder.domain.AdaptedParameters;
import com.phillippitts.adaptiveencoder.domain.ContentType;
import com.phillippitts.adaptiveencoder.domain.EncoderParams;
import com.phillippitts.adaptiveencoder.domain.EncodingProfile;

import java.util.Objects;

/**
 * Pure mapping from a base profile to final rate-control values.
 *
 * <pre>
 * crf     = clamp(baseCrf [+2 if HDR] + type.crfModifier + (score - 50) * -0.05, 15, 28)
 * bitrate = round(base[SDR|HDR] * (0.7 + score/100 * 0.6) * type.bitrateModifier)
 * </pre>
 * HDR substitution happens before any modifier. Bitrate is not clamped.
 */
public final class ParameterAdapter {

    static final double HDR_CRF_OFFSET = 2.0;
    static final double CRF_PER_SCORE_POINT = -0.05;
    static final int NEUTRAL_SCORE = 50;

    static final EncoderParams HDR_PARAMS = EncoderParams.parse(
            "colorprim=bt2020:transfer=smpte2084:colormatrix=bt2020nc:hdr10_opt=1");

    private ParameterAdapter() {}

    /**
     * Full adaptation with content-type and complexity modifiers.
     */
    public static AdaptedParameters adapt(EncodingProfile profile, int score, ContentType type, boolean hdr) {
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(type, "type");
        double crf = baseCrf(profile, hdr) + type.crfModifier() + adaptCrfDelta(score);
        long bitrate = Math.round(baseBitrate(profile, hdr) * complexityFactor(score) * type.bitrateModifier());
        return new AdaptedParameters(clampCrf(crf), (int) bitrate, params(profile, hdr));
    }

    /**
     * Base profile values with only the HDR substitution applied.
     */
    public static AdaptedParameters base(EncodingProfile profile, boolean hdr) {
        Objects.requireNonNull(profile, "profile");
        return new AdaptedParameters(clampCrf(baseCrf(profile, hdr)), baseBitrate(profile, hdr), params(profile, hdr));
    }

    /**
     * Bitrate multiplier for a complexity score: {@code 0.7 + score/100 * 0.6}.
     */
    public static double complexityFactor(int score) {
        return 0.7 + score / 100.0 * 0.6;
    }

    static double adaptCrfDelta(int score) {
        return (score - NEUTRAL_SCORE) * CRF_PER_SCORE_POINT;
    }

    /**
     * Clamps to [15, 28] and rounds to one decimal.
     */
    static double clampCrf(double crf) {
        double clamped = Math.max(AdaptedParameters.MIN_CRF, Math.min(AdaptedParameters.MAX_CRF, crf));
        return Math.round(clamped * 10) / 10.0;
    }

    private static double baseCrf(EncodingProfile profile, boolean hdr) {
        return profile.baseCrf() + (hdr ? HDR_CRF_OFFSET : 0);
    }

    private static int baseBitrate(EncodingProfile profile, boolean hdr) {
        return hdr ? profile.baseBitrateHdr() : profile.baseBitrateSdr();
    }

    private static EncoderParams params(EncodingProfile profile, boolean hdr) {
        return hdr ? profile.encoderParams().withAll(HDR_PARAMS) : profile.encoderParams();
    }
}
