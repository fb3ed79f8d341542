package com.phillippitts.adaptiveencoder.service.classify;

import com.phillippitts.adaptiveencoder.config.properties.AnalysisProperties;
import com.phillippitts.adaptiveencoder.config.properties.OracleProperties;
import com.phillippitts.adaptiveencoder.domain.Classification;
import com.phillippitts.adaptiveencoder.domain.ClassificationSource;
import com.phillippitts.adaptiveencoder.domain.ComplexityScore;
import com.phillippitts.adaptiveencoder.domain.ComplexitySignals;
import com.phillippitts.adaptiveencoder.domain.ContentType;
import com.phillippitts.adaptiveencoder.domain.MediaProbe;
import com.phillippitts.adaptiveencoder.domain.OracleVerdict;
import com.phillippitts.adaptiveencoder.exception.AnalysisException;
import com.phillippitts.adaptiveencoder.exception.ClassificationException;
import com.phillippitts.adaptiveencoder.service.analysis.ComplexityAnalyzer;
import com.phillippitts.adaptiveencoder.service.analysis.GrayFrame;
import com.phillippitts.adaptiveencoder.service.analysis.SignalExtractor;
import com.phillippitts.adaptiveencoder.testutil.Probes;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContentClassifierTest {

    private static final MediaProbe UHD = Probes.of(3840, 2160, 600, 40_000_000L);
    private static final Path INTERSTELLAR = Path.of("/in/Interstellar.2014.2160p.BluRay.x265.mkv");

    private static ComplexityScore analyzedWithGrain(double grain) {
        return new ComplexityScore(60, new ComplexitySignals(50, 50, 10, 4, grain, 0, false));
    }

    @Test
    void fileNameHeuristicWhenNothingWasMeasured() {
        RecordingOracle oracle = new RecordingOracle(OracleVerdict.of(ContentType.FILM, 85));
        ContentClassifier classifier = new ContentClassifier(oracle, new OracleProperties());

        Classification c = classifier.classify(Path.of("My.Anime.Show.mkv"), Probes.of(1920, 1080, 600, 0),
                ComplexityScore.neutral(), false);

        assertThat(c).isEqualTo(Classification.of(ContentType.ANIME, 40, ClassificationSource.FILENAME));
        assertThat(oracle.calls).isEmpty();
    }

    @Test
    void fileNameHeuristicWhenAnalysisMeasuredNothing() {
        // Arrange: every sample fails, so grain and scene cuts are defaults, not measurements
        ComplexityAnalyzer analyzer = new ComplexityAnalyzer(new FailingExtractor(), new AnalysisProperties());
        MediaProbe hd = Probes.sdr1080p();
        Path input = Path.of("/in/Some.Gritty.Film.2010.mkv");
        ComplexityScore score = analyzer.analyze(input, hd);
        RecordingOracle oracle = new RecordingOracle(OracleVerdict.of(ContentType.HEAVY_GRAIN, 85));
        ContentClassifier classifier = new ContentClassifier(oracle, new OracleProperties());

        // Act
        Classification c = classifier.classify(input, hd, score, false);

        // Assert
        assertThat(score.analyzed()).isTrue();
        assertThat(score.contentMeasured()).isFalse();
        assertThat(c).isEqualTo(Classification.of(ContentType.FILM, 40, ClassificationSource.FILENAME));
        assertThat(oracle.calls).isEmpty();
    }

    @Test
    void technicalInputsAvailability() {
        MediaProbe noBitrate = Probes.of(1920, 1080, 600, 0);
        MediaProbe withBitrate = Probes.of(1920, 1080, 600, 8_000_000L);
        ComplexityScore nothingMeasured = new ComplexityScore(60, ComplexitySignals.neutral(false));

        assertThat(ContentClassifier.technicalInputsAvailable(withBitrate, ComplexityScore.neutral())).isTrue();
        assertThat(ContentClassifier.technicalInputsAvailable(noBitrate, ComplexityScore.neutral())).isFalse();
        assertThat(ContentClassifier.technicalInputsAvailable(withBitrate, nothingMeasured)).isFalse();
        assertThat(ContentClassifier.technicalInputsAvailable(noBitrate, analyzedWithGrain(8))).isTrue();
    }

    @Test
    void lowConfidenceTechnicalConsultsOracle() {
        // Arrange: grain 8 -> light_grain at 70%
        RecordingOracle oracle = new RecordingOracle(OracleVerdict.of(ContentType.FILM, 82));
        ContentClassifier classifier = new ContentClassifier(oracle, new OracleProperties());

        // Act
        Classification c = classifier.classify(INTERSTELLAR, UHD, analyzedWithGrain(8), false);

        // Assert
        assertThat(oracle.calls).containsExactly("Interstellar|2014|false");
        assertThat(c).isEqualTo(Classification.of(ContentType.FILM, 82, ClassificationSource.ORACLE));
    }

    @Test
    void confidentTechnicalSkipsOracle() {
        RecordingOracle oracle = new RecordingOracle(OracleVerdict.of(ContentType.FILM, 85));
        ContentClassifier classifier = new ContentClassifier(oracle, new OracleProperties());

        Classification c = classifier.classify(INTERSTELLAR, UHD, analyzedWithGrain(20), false);

        assertThat(c.type()).isEqualTo(ContentType.HEAVY_GRAIN);
        assertThat(oracle.calls).isEmpty();
    }

    @Test
    void forcedLookupOverridesConfidence() {
        RecordingOracle oracle = new RecordingOracle(OracleVerdict.of(ContentType.HEAVY_GRAIN, 85));
        ContentClassifier classifier = new ContentClassifier(oracle, new OracleProperties());

        Classification c = classifier.classify(INTERSTELLAR, UHD, analyzedWithGrain(20), true);

        assertThat(oracle.calls).hasSize(1);
        assertThat(c).isEqualTo(Classification.of(ContentType.HEAVY_GRAIN, 95, ClassificationSource.MERGED));
    }

    @Test
    void disabledOracleIsNeverAsked() {
        RecordingOracle oracle = new RecordingOracle(OracleVerdict.of(ContentType.FILM, 85));
        OracleProperties props = new OracleProperties(OracleProperties.Mode.DISABLED, 80, 30);
        ContentClassifier classifier = new ContentClassifier(oracle, props);

        Classification c = classifier.classify(INTERSTELLAR, UHD, analyzedWithGrain(8), false);

        assertThat(c.source()).isEqualTo(ClassificationSource.TECHNICAL);
        assertThat(oracle.calls).isEmpty();
    }

    @Test
    void oracleFailureKeepsTechnical() {
        ContentOracle failing = (title, year, series) -> {
            throw new ClassificationException("search service down");
        };
        ContentClassifier classifier = new ContentClassifier(failing, new OracleProperties());

        Classification c = classifier.classify(INTERSTELLAR, UHD, analyzedWithGrain(8), false);

        assertThat(c).isEqualTo(Classification.of(ContentType.LIGHT_GRAIN, 70, ClassificationSource.TECHNICAL));
    }

    @Test
    void shortTitleIsNotLookedUp() {
        RecordingOracle oracle = new RecordingOracle(OracleVerdict.of(ContentType.FILM, 85));
        ContentClassifier classifier = new ContentClassifier(oracle, new OracleProperties());

        classifier.classify(Path.of("Up.mkv"), UHD, analyzedWithGrain(8), true);

        assertThat(oracle.calls).isEmpty();
    }

    @Test
    void lowTitleConfidenceNeedsForce() {
        RecordingOracle oracle = new RecordingOracle(OracleVerdict.of(ContentType.FILM, 85));
        OracleProperties props = new OracleProperties(OracleProperties.Mode.ENABLED, 80, 50);
        ContentClassifier classifier = new ContentClassifier(oracle, props);
        Path generic = Path.of("holiday_video.mkv");

        classifier.classify(generic, UHD, analyzedWithGrain(8), false);
        assertThat(oracle.calls).isEmpty();

        classifier.classify(generic, UHD, analyzedWithGrain(8), true);
        assertThat(oracle.calls).containsExactly("holiday video|null|false");
    }

    private static final class FailingExtractor implements SignalExtractor {
        @Override
        public double spatialInfo(Path input) {
            throw new AnalysisException("decode error", "spatial");
        }

        @Override
        public int sceneCuts(Path input) {
            throw new AnalysisException("decode error", "scenes");
        }

        @Override
        public GrayFrame grainWindow(Path input, MediaProbe probe, double atSeconds, int size) {
            throw new AnalysisException("decode error", "grain");
        }

        @Override
        public GrayFrame thumbnail(Path input, double atSeconds, int width, int height) {
            throw new AnalysisException("decode error", "texture");
        }

        @Override
        public GrayFrame staticSceneWindow(Path input, MediaProbe probe, double atSeconds, int size) {
            throw new AnalysisException("decode error", "dark-scene");
        }
    }

    private static final class RecordingOracle implements ContentOracle {
        private final OracleVerdict answer;
        final List<String> calls = new ArrayList<>();

        RecordingOracle(OracleVerdict answer) {
            this.answer = answer;
        }

        @Override
        public OracleVerdict classify(String title, Integer year, boolean series) {
            calls.add(title + "|" + year + "|" + series);
            return answer;
        }
    }
}
