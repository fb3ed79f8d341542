package com.phillippitts.adaptiveencoder.service.profile;

import com.phillippitts.adaptiveencoder.domain.ComplexityScore;
import com.phillippitts.adaptiveencoder.domain.ContentType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContentTypeRefinerTest {

    private static ComplexityScore score(int value) {
        return new ComplexityScore(value, null);
    }

    @Test
    void grainyAnimeBecomesClassicAnime() {
        assertThat(ContentTypeRefiner.refine(ContentType.ANIME, score(61))).isEqualTo(ContentType.CLASSIC_ANIME);
        assertThat(ContentTypeRefiner.refine(ContentType.ANIME, score(60))).isEqualTo(ContentType.ANIME);
    }

    @Test
    void veryComplexFilmBecomesHeavyGrain() {
        assertThat(ContentTypeRefiner.refine(ContentType.FILM, score(81))).isEqualTo(ContentType.HEAVY_GRAIN);
        assertThat(ContentTypeRefiner.refine(ContentType.FILM, score(80))).isEqualTo(ContentType.FILM);
    }

    @Test
    void otherTypesAreUnchanged() {
        assertThat(ContentTypeRefiner.refine(ContentType.ACTION, score(100))).isEqualTo(ContentType.ACTION);
        assertThat(ContentTypeRefiner.refine(ContentType.ANIMATION_3D, score(95))).isEqualTo(ContentType.ANIMATION_3D);
    }
}
