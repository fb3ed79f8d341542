package com.phillippitts.adaptiveencoder.service.profile;

import com.phillippitts.adaptiveencoder.domain.ContentType;
import com.phillippitts.adaptiveencoder.domain.EncodingProfile;
import com.phillippitts.adaptiveencoder.exception.UnknownProfileException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonProfileStoreTest {

    @Test
    void loadsBundledCatalog() {
        JsonProfileStore store = new JsonProfileStore();

        EncodingProfile profile = store.get("4k_heavy_grain");

        assertThat(profile.preset()).isEqualTo("slow");
        assertThat(profile.baseBitrateSdr()).isEqualTo(12000);
        assertThat(profile.baseBitrateHdr()).isEqualTo(15000);
        assertThat(profile.contentType()).isEqualTo(ContentType.HEAVY_GRAIN);
        assertThat(profile.encoderParams().get("deblock")).isEqualTo("-1,-1");
    }

    @Test
    void catalogCoversEveryAutomaticSelection() {
        JsonProfileStore store = new JsonProfileStore();

        for (String category : List.of("1080p", "4k")) {
            for (String suffix : List.of("anime", "3d_animation", "heavy_grain", "light_grain", "action", "film")) {
                assertThat(store.find(category + "_" + suffix)).as(category + "_" + suffix).isPresent();
            }
        }
    }

    @Test
    void listIsSortedByName() {
        List<EncodingProfile> profiles = new JsonProfileStore().listProfiles();

        assertThat(profiles).extracting(EncodingProfile::name).isSorted();
    }

    @Test
    void unknownNameThrows() {
        JsonProfileStore store = new JsonProfileStore();

        assertThat(store.find("nope")).isEmpty();
        assertThat(store.find(null)).isEmpty();
        assertThatThrownBy(() -> store.get("nope"))
                .isInstanceOf(UnknownProfileException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void parsesDefaultsForOptionalFields() {
        Map<String, EncodingProfile> parsed = JsonProfileStore.parse("""
                {"profiles": {"plain": {"preset": "medium", "crf": 22, "pixelFormat": "yuv420p",
                  "codecProfile": "main", "baseBitrate": 3000, "hdrBitrate": 4000}}}
                """);

        EncodingProfile plain = parsed.get("plain");
        assertThat(plain.title()).isEqualTo("plain");
        assertThat(plain.contentType()).isEqualTo(ContentType.FILM);
        assertThat(plain.encoderParams().isEmpty()).isTrue();
    }

    @Test
    void rejectsUnknownContentType() {
        assertThatThrownBy(() -> JsonProfileStore.parse("""
                {"profiles": {"odd": {"preset": "medium", "crf": 22, "pixelFormat": "yuv420p",
                  "codecProfile": "main", "baseBitrate": 3000, "hdrBitrate": 4000, "contentType": "puppetry"}}}
                """))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("puppetry");
    }

    @Test
    void missingResourceFailsFast() {
        assertThatThrownBy(() -> new JsonProfileStore("/no-such-catalog.json"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not found");
    }
}
