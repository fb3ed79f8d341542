package com.phillippitts.adaptiveencoder.service.analysis;

import com.phillippitts.adaptiveencoder.config.properties.AnalysisProperties;
import com.phillippitts.adaptiveencoder.domain.ComplexityScore;
import com.phillippitts.adaptiveencoder.domain.ComplexitySignals;
import com.phillippitts.adaptiveencoder.domain.MediaProbe;
import com.phillippitts.adaptiveencoder.exception.AnalysisException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Measures the complexity signals of an input and folds them into a {@link ComplexityScore}.
 *
 * <p>Each signal is measured independently; a signal that cannot be measured falls back to its
 * default and the remaining signals still contribute. Analysis never fails the run.
 */
@Service
public class ComplexityAnalyzer {

    private static final Logger LOG = LogManager.getLogger(ComplexityAnalyzer.class);

    private final SignalExtractor extractor;
    private final AnalysisProperties props;

    public ComplexityAnalyzer(SignalExtractor extractor, AnalysisProperties props) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * Samples the input and computes its complexity score.
     *
     * @param input source file
     * @param probe probe of the source
     * @return score in [10, 100] with the signals it was computed from
     */
    public ComplexityScore analyze(Path input, MediaProbe probe) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(probe, "probe");

        double spatial = spatialInfo(input);
        double temporal = FrameTypeSignals.temporalInfo(probe.sampledFrameTypes(), props.temporalWindowFrames(),
                ComplexitySignals.DEFAULT_TEMPORAL_INFO);
        OptionalDouble sceneCuts = sceneCuts(input);
        double scenes = sceneCuts.orElse(ComplexitySignals.DEFAULT_SCENE_CHANGES);
        double frameComplexity = FrameTypeSignals.frameTypeComplexity(probe.sampledFrameTypes(),
                props.frameTypeWindowFrames(), ComplexitySignals.DEFAULT_FRAME_COMPLEXITY);
        GrainReading grain = grain(input, probe);

        ComplexitySignals signals = new ComplexitySignals(spatial, temporal, scenes, frameComplexity,
                grain.grain(), grain.texture(), probe.isHdr(), grain.measured(), sceneCuts.isPresent());
        if (!signals.contentMeasured()) {
            LOG.warn("Neither grain nor scene cuts could be measured for {}", input.getFileName());
        }
        ComplexityScore score = ComplexityScorer.score(signals);
        LOG.info("Complexity {} (SI={}, TI={}, scenes={}, frameComplexity={}, grain={}, texture={})",
                score.value(), fmt(spatial), fmt(temporal), (int) scenes, fmt(frameComplexity),
                (int) grain.grain(), fmt(grain.texture()));
        return score;
    }

    /**
     * Averaged grain and texture of the sampled frames, with the dark-scene boost applied.
     * Package-private for tests.
     */
    GrainReading grain(Path input, MediaProbe probe) {
        List<Double> times = GrainEstimator.sampleTimes(probe.durationSeconds(), props.grainSamplePercents());
        double grainSum = 0;
        double textureSum = 0;
        int grainSamples = 0;
        int textureSamples = 0;
        for (double t : times) {
            try {
                grainSum += GrainEstimator.sampleGrain(
                        extractor.grainWindow(input, probe, t, GrainEstimator.GRAIN_WINDOW));
                grainSamples++;
            } catch (AnalysisException e) {
                LOG.debug("Grain sample at {}s skipped: {}", t, e.getMessage());
            }
            try {
                textureSum += GrainEstimator.sampleTexture(extractor.thumbnail(input, t,
                        GrainEstimator.TEXTURE_WIDTH, GrainEstimator.TEXTURE_HEIGHT));
                textureSamples++;
            } catch (AnalysisException e) {
                LOG.debug("Texture sample at {}s skipped: {}", t, e.getMessage());
            }
        }
        boolean measured = grainSamples > 0;
        if (!measured) {
            LOG.warn("No grain sample could be taken from {}; grain defaults to 0", input.getFileName());
        }
        double grain = grainSamples == 0 ? 0 : Math.round(grainSum / grainSamples);
        double texture = textureSamples == 0 ? 0 : textureSum / textureSamples;

        if (grain < props.darkBoostThreshold()) {
            double at = GrainEstimator.darkSceneTime(probe.durationSeconds());
            try {
                double dark = GrainEstimator.darkSceneGrain(
                        extractor.staticSceneWindow(input, probe, at, GrainEstimator.GRAIN_WINDOW));
                measured = true;
                if (dark > grain) {
                    LOG.info("Dark-scene sample at {}s raised grain {} -> {}", (long) at, (int) grain, (int) dark);
                    grain = Math.floor(dark);
                }
            } catch (AnalysisException e) {
                LOG.debug("Dark-scene sample skipped: {}", e.getMessage());
            }
        }
        return new GrainReading(grain, texture, measured);
    }

    private double spatialInfo(Path input) {
        try {
            return extractor.spatialInfo(input);
        } catch (AnalysisException e) {
            LOG.warn("Spatial detail unavailable, using default {}: {}",
                    ComplexitySignals.DEFAULT_SPATIAL_INFO, e.getMessage());
            return ComplexitySignals.DEFAULT_SPATIAL_INFO;
        }
    }

    private OptionalDouble sceneCuts(Path input) {
        try {
            return OptionalDouble.of(extractor.sceneCuts(input));
        } catch (AnalysisException e) {
            LOG.warn("Scene cuts unavailable, using default {}: {}",
                    ComplexitySignals.DEFAULT_SCENE_CHANGES, e.getMessage());
            return OptionalDouble.empty();
        }
    }

    static String fmt(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }

    /**
     * @param measured false when no grain sample and no dark-scene sample could be taken
     */
    record GrainReading(double grain, double texture, boolean measured) {}
}
