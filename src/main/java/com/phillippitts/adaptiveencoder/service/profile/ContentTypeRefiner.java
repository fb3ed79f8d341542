package com.phillippitts.adaptiveencoder.service.profile;

import com.phillippitts.adaptiveencoder.domain.ComplexityScore;
import com.phillippitts.adaptiveencoder.domain.ContentType;

/**
 * Sharpens a declared content type using the measured complexity.
 */
public final class ContentTypeRefiner {

    static final int CLASSIC_ANIME_SCORE = 60;
    static final int HEAVY_GRAIN_SCORE = 80;

    private ContentTypeRefiner() {}

    /**
     * anime above 60 becomes classic_anime (older hand-drawn material carries grain); film above
     * 80 becomes heavy_grain. Other types are returned unchanged.
     */
    public static ContentType refine(ContentType declared, ComplexityScore score) {
        int value = score.value();
        if (declared == ContentType.ANIME && value > CLASSIC_ANIME_SCORE) {
            return ContentType.CLASSIC_ANIME;
        }
        if (declared == ContentType.FILM && value > HEAVY_GRAIN_SCORE) {
            return ContentType.HEAVY_GRAIN;
        }
        return declared;
    }
}
