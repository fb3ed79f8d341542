package com.phillippitts.adaptiveencoder.service.orchestration;

import com.phillippitts.adaptiveencoder.domain.EncodeOverrides;
import com.phillippitts.adaptiveencoder.domain.EncodingMode;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EncodeRequestTest {

    private static final Path INPUT = Path.of("/media/movie.mkv");

    @Test
    void autoIsRecognizedRegardlessOfCaseAndBlank() {
        assertThat(EncodeRequest.auto(INPUT, EncodingMode.CRF).isAuto()).isTrue();
        assertThat(new EncodeRequest(INPUT, " AUTO ", null, null, null).isAuto()).isTrue();
        assertThat(new EncodeRequest(INPUT, null, null, null, null).isAuto()).isTrue();
        assertThat(new EncodeRequest(INPUT, "", null, null, null).isAuto()).isTrue();
        assertThat(new EncodeRequest(INPUT, "4k_film", null, null, null).isAuto()).isFalse();
    }

    @Test
    void missingOverridesDefaultToNone() {
        assertThat(new EncodeRequest(INPUT, "auto", null, null, null).overrides()).isEqualTo(EncodeOverrides.none());
    }

    @Test
    void profileNameIsTrimmed() {
        assertThat(new EncodeRequest(INPUT, " 1080p_film ", null, null, null).profile()).isEqualTo("1080p_film");
    }

    @Test
    void inputIsRequired() {
        assertThatThrownBy(() -> new EncodeRequest(null, "auto", null, null, null))
                .isInstanceOf(NullPointerException.class);
    }
}
