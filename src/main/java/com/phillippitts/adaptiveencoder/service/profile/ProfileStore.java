package com.phillippitts.adaptiveencoder.service.profile;

import com.phillippitts.adaptiveencoder.domain.EncodingProfile;

import java.util.List;
import java.util.Optional;

/**
 * Read-only catalog of named encoding profiles.
 */
public interface ProfileStore {

    Optional<EncodingProfile> find(String name);

    /**
     * @throws com.phillippitts.adaptiveencoder.exception.UnknownProfileException if the name is not in the catalog
     */
    EncodingProfile get(String name);

    /**
     * All profiles sorted by name.
     */
    List<EncodingProfile> listProfiles();
}
