package com.phillippitts.adaptiveencoder.domain;

import java.util.Locale;

/**
 * Technical description of an input, produced once per run by the media prober.
 *
 * @param width frame width in pixels
 * @param height frame height in pixels
 * @param durationSeconds container duration in seconds
 * @param fps average frame rate (0 when unknown)
 * @param codecName video codec name as reported by the prober
 * @param bitrateBps overall bitrate in bits per second (0 when unknown)
 * @param colorPrimaries colour primaries tag (may be empty)
 * @param colorTransfer transfer characteristics tag (may be empty)
 * @param colorSpace colour matrix tag (may be empty)
 * @param sampledFrameTypes picture types of the sampled leading frames, e.g. {@code "IPBBP"}
 * @param frameCount exact frame count if the container reports one, else 0
 * @param audioStreamCount number of audio streams to carry through
 * @param subtitleStreamCount number of subtitle streams to carry through
 */
public record MediaProbe(
        int width,
        int height,
        double durationSeconds,
        double fps,
        String codecName,
        long bitrateBps,
        String colorPrimaries,
        String colorTransfer,
        String colorSpace,
        String sampledFrameTypes,
        long frameCount,
        int audioStreamCount,
        int subtitleStreamCount
) {
    public MediaProbe {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Frame dimensions must be positive: " + width + "x" + height);
        }
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("durationSeconds must be >= 0");
        }
        codecName = codecName == null ? "" : codecName;
        colorPrimaries = colorPrimaries == null ? "" : colorPrimaries;
        colorTransfer = colorTransfer == null ? "" : colorTransfer;
        colorSpace = colorSpace == null ? "" : colorSpace;
        sampledFrameTypes = sampledFrameTypes == null ? "" : sampledFrameTypes;
    }

    /**
     * HDR10 requires BT.2020 primaries together with the SMPTE 2084 (PQ) transfer curve.
     */
    public boolean isHdr() {
        return colorPrimaries.toLowerCase(Locale.ROOT).contains("bt2020")
                && colorTransfer.toLowerCase(Locale.ROOT).contains("smpte2084");
    }

    public double aspectRatio() {
        return (double) width / height;
    }

    public boolean is4k() {
        return width >= 3840 && height >= 2160;
    }

    /**
     * Total frames used by the frame-based progress estimator: the exact count when known,
     * otherwise {@code duration * fps}.
     */
    public long estimatedTotalFrames() {
        if (frameCount > 0) {
            return frameCount;
        }
        return Math.round(durationSeconds * fps);
    }
}
