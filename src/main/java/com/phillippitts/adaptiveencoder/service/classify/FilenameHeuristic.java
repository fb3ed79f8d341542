package com.phillippitts.adaptiveencoder.service.classify;

import com.phillippitts.adaptiveencoder.domain.Classification;
import com.phillippitts.adaptiveencoder.domain.ClassificationSource;
import com.phillippitts.adaptiveencoder.domain.ContentType;

import java.util.Locale;

/**
 * Last-resort content label from words in the file name.
 */
public final class FilenameHeuristic {

    static final int CONFIDENCE = 40;

    private FilenameHeuristic() {}

    public static ContentType guess(String fileName) {
        String name = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        if (name.matches(".*(anime|animation|cartoon).*")) {
            return ContentType.ANIME;
        }
        if (name.matches(".*(cgi|3d).*")) {
            return ContentType.ANIMATION_3D;
        }
        if (name.matches(".*(action|sports).*")) {
            return ContentType.ACTION;
        }
        if (name.matches(".*(classic|vintage|old).*")) {
            return ContentType.LIGHT_GRAIN;
        }
        return ContentType.FILM;
    }

    public static Classification classify(String fileName) {
        return Classification.of(guess(fileName), CONFIDENCE, ClassificationSource.FILENAME);
    }
}
