package com.phillippitts.adaptiveencoder.domain;

import java.util.Objects;

/**
 * Named, immutable encoding template loaded from the profile catalog.
 *
 * @param name catalog key
 * @param title human-readable title
 * @param preset encoder preset used by the final pass
 * @param baseCrf CRF before HDR, content and complexity adjustments
 * @param pixelFormat output pixel format
 * @param codecProfile codec profile (e.g. {@code main10})
 * @param baseBitrateSdr base bitrate for SDR sources in kbps
 * @param baseBitrateHdr base bitrate for HDR sources in kbps
 * @param encoderParams encoder-library parameters
 * @param contentType declared content type
 */
public record EncodingProfile(
        String name,
        String title,
        String preset,
        double baseCrf,
        String pixelFormat,
        String codecProfile,
        int baseBitrateSdr,
        int baseBitrateHdr,
        EncoderParams encoderParams,
        ContentType contentType
) {
    public EncodingProfile {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(preset, "preset");
        Objects.requireNonNull(pixelFormat, "pixelFormat");
        Objects.requireNonNull(codecProfile, "codecProfile");
        Objects.requireNonNull(contentType, "contentType");
        encoderParams = encoderParams == null ? EncoderParams.empty() : encoderParams;
        title = title == null ? name : title;
        if (baseBitrateSdr <= 0 || baseBitrateHdr <= 0) {
            throw new IllegalArgumentException("Base bitrates must be positive for profile " + name);
        }
    }

    /**
     * Copy of this profile carrying a different content type.
     */
    public EncodingProfile withContentType(ContentType type) {
        if (type == contentType) {
            return this;
        }
        return new EncodingProfile(name, title, preset, baseCrf, pixelFormat, codecProfile,
                baseBitrateSdr, baseBitrateHdr, encoderParams, type);
    }
}
