package com.phillippitts.adaptiveencoder.service.profile;

import com.phillippitts.adaptiveencoder.domain.AdaptedParameters;
import com.phillippitts.adaptiveencoder.domain.ContentType;
import com.phillippitts.adaptiveencoder.domain.EncoderParams;
import com.phillippitts.adaptiveencoder.domain.EncodingProfile;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ParameterAdapterTest {

    private static EncodingProfile profile(double crf, int sdr, int hdr) {
        return new EncodingProfile("test_film", "Test", "slow", crf, "yuv420p10le", "main10", sdr, hdr,
                EncoderParams.parse("aq-mode=3:no-sao"), ContentType.FILM);
    }

    @Test
    void heavyGrainAboveNeutralScore() {
        // crf 19 - 0.8 + (62 - 50) * -0.05; bitrate 4500 * 1.072 * 1.25
        AdaptedParameters p = ParameterAdapter.adapt(profile(19, 4500, 5500), 62, ContentType.HEAVY_GRAIN, false);

        assertThat(p.crf()).isEqualTo(17.6);
        assertThat(p.bitrateKbps()).isEqualTo(6030);
        assertThat(p.crfArgument()).isEqualTo("17.6");
        assertThat(p.encoderParams().toArgument()).isEqualTo("aq-mode=3:sao=0");
    }

    @Test
    void hdrSubstitutesBitrateRaisesCrfAndAddsColorParameters() {
        AdaptedParameters p = ParameterAdapter.adapt(profile(19, 4500, 5500), 62, ContentType.HEAVY_GRAIN, true);

        assertThat(p.crf()).isEqualTo(19.6);
        assertThat(p.bitrateKbps()).isEqualTo(7370);
        assertThat(p.encoderParams().get("colorprim")).isEqualTo("bt2020");
        assertThat(p.encoderParams().get("transfer")).isEqualTo("smpte2084");
        assertThat(p.encoderParams().get("hdr10_opt")).isEqualTo("1");
        assertThat(p.encoderParams().get("aq-mode")).isEqualTo("3");
    }

    @Test
    void crfIsClampedToEncoderRange() {
        AdaptedParameters high = ParameterAdapter.adapt(profile(28, 3000, 4000), 10, ContentType.CLASSIC_ANIME, true);
        AdaptedParameters low = ParameterAdapter.adapt(profile(15, 3000, 4000), 100, ContentType.HEAVY_GRAIN, false);

        assertThat(high.crf()).isEqualTo(AdaptedParameters.MAX_CRF);
        assertThat(low.crf()).isEqualTo(AdaptedParameters.MIN_CRF);
    }

    @Test
    void higherComplexityNeverLowersQuality() {
        EncodingProfile film = profile(20, 4000, 5000);
        AdaptedParameters previous = ParameterAdapter.adapt(film, 10, ContentType.FILM, false);
        for (int score = 11; score <= 100; score++) {
            AdaptedParameters current = ParameterAdapter.adapt(film, score, ContentType.FILM, false);

            assertThat(current.crf()).isLessThanOrEqualTo(previous.crf());
            assertThat(current.bitrateKbps()).isGreaterThanOrEqualTo(previous.bitrateKbps());
            previous = current;
        }
    }

    @Test
    void neutralFilmKeepsBaseCrf() {
        AdaptedParameters p = ParameterAdapter.adapt(profile(20, 4000, 5000), 50, ContentType.FILM, false);

        assertThat(p.crf()).isEqualTo(20.0);
        assertThat(p.bitrateKbps()).isEqualTo(4000);
    }

    @Test
    void baseAppliesOnlyHdrSubstitution() {
        AdaptedParameters sdr = ParameterAdapter.base(profile(19, 4500, 5500), false);
        AdaptedParameters hdr = ParameterAdapter.base(profile(19, 4500, 5500), true);

        assertThat(sdr.crf()).isEqualTo(19.0);
        assertThat(sdr.bitrateKbps()).isEqualTo(4500);
        assertThat(sdr.encoderParams().contains("colorprim")).isFalse();
        assertThat(hdr.crf()).isEqualTo(21.0);
        assertThat(hdr.bitrateKbps()).isEqualTo(5500);
    }

    @Test
    void complexityFactorSpansSeventyToOneThirtyPercent() {
        assertThat(ParameterAdapter.complexityFactor(0)).isCloseTo(0.7, within(1e-9));
        assertThat(ParameterAdapter.complexityFactor(50)).isCloseTo(1.0, within(1e-9));
        assertThat(ParameterAdapter.complexityFactor(100)).isCloseTo(1.3, within(1e-9));
    }
}
