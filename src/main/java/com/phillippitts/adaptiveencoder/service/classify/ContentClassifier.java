package com.phillippitts.adaptiveencoder.service.classify;

import com.phillippitts.adaptiveencoder.config.properties.OracleProperties;
import com.phillippitts.adaptiveencoder.domain.Classification;
import com.phillippitts.adaptiveencoder.domain.ComplexityScore;
import com.phillippitts.adaptiveencoder.domain.MediaProbe;
import com.phillippitts.adaptiveencoder.domain.OracleVerdict;
import com.phillippitts.adaptiveencoder.exception.ClassificationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Resolves the content type of an input for automatic profile selection.
 *
 * <p>The technical label is computed first. The {@link ContentOracle} is consulted only when the
 * technical label is not confident (or the lookup is forced) and its verdict is merged by
 * {@link ClassificationMerger}. Oracle failures never fail the run. Without any technical inputs
 * (analysis measured neither grain nor scene cuts, or no analysis and no bitrate) the file-name
 * heuristic decides.
 */
@Service
public class ContentClassifier {

    private static final Logger LOG = LogManager.getLogger(ContentClassifier.class);

    static final int MIN_TITLE_LENGTH = 3;

    private final ContentOracle oracle;
    private final OracleProperties props;

    public ContentClassifier(ContentOracle oracle, OracleProperties props) {
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * @param input source file (its name feeds title extraction)
     * @param probe source probe
     * @param score complexity score, neutral when analysis did not run
     * @param forceOracle caller requests an oracle lookup regardless of technical confidence
     * @return final classification
     */
    public Classification classify(Path input, MediaProbe probe, ComplexityScore score, boolean forceOracle) {
        String fileName = input.getFileName().toString();
        if (!technicalInputsAvailable(probe, score)) {
            Classification fallback = FilenameHeuristic.classify(fileName);
            LOG.warn("No technical inputs for {}; using file-name heuristic: {}", fileName, fallback.type());
            return fallback;
        }

        Classification technical = TechnicalClassifier.classify(probe, score);
        LOG.info("Technical classification: {} ({}%)", technical.type(), technical.confidence());

        boolean force = forceOracle || props.mode() == OracleProperties.Mode.FORCE;
        if (props.mode() == OracleProperties.Mode.DISABLED && !forceOracle) {
            return technical;
        }
        if (!ClassificationMerger.shouldConsultOracle(technical, props.highConfidence(), force)) {
            LOG.info("Technical classification is confident; oracle skipped");
            return technical;
        }

        OracleVerdict verdict = consult(fileName, force);
        Classification merged = ClassificationMerger.merge(technical, verdict);
        if (!verdict.isUnknown()) {
            LOG.info("Oracle verdict {} ({}%); final {} ({}%, {})", verdict.type(), verdict.confidence(),
                    merged.type(), merged.confidence(), merged.source());
        }
        return merged;
    }

    /**
     * Analysis that ran but measured neither grain nor scene cuts leaves nothing to classify from.
     * Without analysis the bitrate-based grain estimate is used when the probe reports a bitrate.
     */
    static boolean technicalInputsAvailable(MediaProbe probe, ComplexityScore score) {
        if (score.analyzed()) {
            return score.contentMeasured();
        }
        return probe.bitrateBps() > 0;
    }

    private OracleVerdict consult(String fileName, boolean force) {
        TitleInfo title = TitleExtractor.extract(fileName);
        LOG.info("Extracted title: '{}' (year={}, series={}, confidence={}%)", title.title(), title.year(),
                title.series(), title.confidence());
        if (title.title().length() < MIN_TITLE_LENGTH) {
            LOG.warn("Title too short for lookup: '{}'", title.title());
            return OracleVerdict.unknown();
        }
        if (title.confidence() < props.minTitleConfidence() && !force) {
            LOG.warn("Title extraction confidence too low: {}%", title.confidence());
            return OracleVerdict.unknown();
        }
        try {
            OracleVerdict verdict = oracle.classify(title.title(), title.year(), title.series());
            return verdict == null ? OracleVerdict.unknown() : verdict;
        } catch (ClassificationException e) {
            LOG.warn("Oracle unavailable, keeping technical classification: {}", e.getMessage());
            return OracleVerdict.unknown();
        }
    }
}
