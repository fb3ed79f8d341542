package com.phillippitts.adaptiveencoder.exception;

/**
 * Thrown when a caller names a profile that is not in the catalog.
 */
public class UnknownProfileException extends EncoderException {

    private final String profileName;

    public UnknownProfileException(String profileName) {
        super(FailureKind.PROFILE, "Unknown encoding profile: " + profileName);
        this.profileName = profileName;
    }

    public String getProfileName() {
        return profileName;
    }
}
