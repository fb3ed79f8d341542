package com.phillippitts.adaptiveencoder.service.profile;

import com.phillippitts.adaptiveencoder.domain.ContentType;
import com.phillippitts.adaptiveencoder.domain.EncodingProfile;
import com.phillippitts.adaptiveencoder.domain.MediaProbe;
import com.phillippitts.adaptiveencoder.service.classify.FilenameHeuristic;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Maps a resolution class and content type to a catalog profile for automatic selection.
 */
@Component
public class ProfileRecommender {

    private static final Logger LOG = LogManager.getLogger(ProfileRecommender.class);

    static final int UHD_MIN_WIDTH = 3000;

    private final ProfileStore store;

    public ProfileRecommender(ProfileStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Picks {@code <category>_<suffix>}; falls back to the file-name heuristic profile and then
     * to {@code <category>_film}.
     */
    public EncodingProfile recommend(MediaProbe probe, ContentType type, String fileName) {
        String category = resolutionCategory(probe);
        String primary = category + "_" + suffix(type);
        if (store.find(primary).isPresent()) {
            return store.get(primary);
        }
        String heuristic = category + "_" + suffix(FilenameHeuristic.guess(fileName));
        if (store.find(heuristic).isPresent()) {
            LOG.warn("Profile {} not in catalog; using file-name profile {}", primary, heuristic);
            return store.get(heuristic);
        }
        LOG.warn("Profiles {} and {} not in catalog; using {}_film", primary, heuristic, category);
        return store.get(category + "_film");
    }

    static String resolutionCategory(MediaProbe probe) {
        return probe.width() >= UHD_MIN_WIDTH ? "4k" : "1080p";
    }

    static String suffix(ContentType type) {
        return switch (type) {
            case ANIME, CLASSIC_ANIME -> "anime";
            case ANIMATION_3D -> "3d_animation";
            case HEAVY_GRAIN -> "heavy_grain";
            case LIGHT_GRAIN -> "light_grain";
            case ACTION -> "action";
            default -> "film";
        };
    }
}
