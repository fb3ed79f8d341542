package com.phillippitts.adaptiveencoder.service.crop;

import com.phillippitts.adaptiveencoder.config.properties.CropProperties;
import com.phillippitts.adaptiveencoder.domain.CropRegion;
import com.phillippitts.adaptiveencoder.domain.MediaProbe;
import com.phillippitts.adaptiveencoder.exception.CropDetectionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Three-sample crop detection with mode voting.
 *
 * <p>Each window contributes its most frequent rectangle; the most frequent of those wins. The
 * winner is kept only when it removes enough pixels. A manual crop bypasses detection.
 * Detection failures leave the frame uncropped.
 */
@Service
public class CropDetector {

    private static final Logger LOG = LogManager.getLogger(CropDetector.class);

    private final CropSampler sampler;
    private final CropProperties props;

    public CropDetector(CropSampler sampler, CropProperties props) {
        this.sampler = Objects.requireNonNull(sampler, "sampler");
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * @param input source file
     * @param probe source probe
     * @param manual caller-supplied crop, or null
     * @return crop to apply, or empty for the full frame
     */
    public Optional<CropRegion> detect(Path input, MediaProbe probe, CropRegion manual) {
        if (manual != null) {
            LOG.info("Using manual crop {}", manual);
            return Optional.of(manual);
        }
        if (!props.enabled()) {
            return Optional.empty();
        }
        int limit = probe.isHdr() ? props.hdrLimit() : props.sdrLimit();
        LOG.info("Detecting crop ({} limit {})", probe.isHdr() ? "HDR" : "SDR", limit);

        List<CropRegion> votes = new ArrayList<>();
        for (double start : CropVote.sampleStarts(probe.durationSeconds(), props.edgeSkipSeconds(),
                props.sampleSeconds())) {
            try {
                CropVote.mode(sampler.sample(input, start, props.sampleSeconds(), limit)).ifPresent(votes::add);
            } catch (CropDetectionException e) {
                LOG.warn("Crop sample skipped: {}", e.getMessage());
            }
        }

        Optional<CropRegion> winner = CropVote.mode(votes);
        if (winner.isEmpty()) {
            LOG.warn("No usable crop signal in any sample; encoding full frame");
            return Optional.empty();
        }
        CropRegion crop = winner.get();
        int delta = crop.pixelDelta(probe.width(), probe.height());
        String percent = String.format(Locale.ROOT, "%.2f",
                CropVote.percentDelta(crop, probe.width(), probe.height()));
        if (CropVote.accept(crop, probe.width(), probe.height(), props.minThreshold(), props.percentThreshold())) {
            LOG.info("Crop detected: {}x{} -> {}x{} ({} pixels, {}%)", probe.width(), probe.height(),
                    crop.width(), crop.height(), delta, percent);
            return Optional.of(crop);
        }
        LOG.info("No significant crop required ({} pixels, {}%)", delta, percent);
        return Optional.empty();
    }
}
