package com.phillippitts.adaptiveencoder.service.orchestration;

import com.phillippitts.adaptiveencoder.config.properties.AnalysisProperties;
import com.phillippitts.adaptiveencoder.config.properties.EncodeProperties;
import com.phillippitts.adaptiveencoder.config.properties.EncoderBinariesProperties;
import com.phillippitts.adaptiveencoder.config.properties.WorkspaceProperties;
import com.phillippitts.adaptiveencoder.domain.AdaptedParameters;
import com.phillippitts.adaptiveencoder.domain.Classification;
import com.phillippitts.adaptiveencoder.domain.ClassificationSource;
import com.phillippitts.adaptiveencoder.domain.ComplexityScore;
import com.phillippitts.adaptiveencoder.domain.ContentType;
import com.phillippitts.adaptiveencoder.domain.CropRegion;
import com.phillippitts.adaptiveencoder.domain.EncodeOverrides;
import com.phillippitts.adaptiveencoder.domain.EncodeResult;
import com.phillippitts.adaptiveencoder.domain.EncodingMode;
import com.phillippitts.adaptiveencoder.domain.EncodingProfile;
import com.phillippitts.adaptiveencoder.domain.MediaProbe;
import com.phillippitts.adaptiveencoder.domain.PassPlan;
import com.phillippitts.adaptiveencoder.domain.RunContext;
import com.phillippitts.adaptiveencoder.exception.EncoderException;
import com.phillippitts.adaptiveencoder.exception.FailureKind;
import com.phillippitts.adaptiveencoder.service.analysis.ComplexityAnalyzer;
import com.phillippitts.adaptiveencoder.service.classify.ContentClassifier;
import com.phillippitts.adaptiveencoder.service.crop.CropDetector;
import com.phillippitts.adaptiveencoder.service.encode.EncodeJob;
import com.phillippitts.adaptiveencoder.service.encode.FilterGraph;
import com.phillippitts.adaptiveencoder.service.encode.PassPlanner;
import com.phillippitts.adaptiveencoder.service.encode.StreamMap;
import com.phillippitts.adaptiveencoder.service.metrics.EncodingMetrics;
import com.phillippitts.adaptiveencoder.service.orchestration.event.EncodingCompletedEvent;
import com.phillippitts.adaptiveencoder.service.orchestration.event.EncodingFailedEvent;
import com.phillippitts.adaptiveencoder.service.probe.MediaProber;
import com.phillippitts.adaptiveencoder.service.profile.ContentTypeRefiner;
import com.phillippitts.adaptiveencoder.service.profile.ParameterAdapter;
import com.phillippitts.adaptiveencoder.service.profile.ProfileRecommender;
import com.phillippitts.adaptiveencoder.service.profile.ProfileStore;
import com.phillippitts.adaptiveencoder.service.progress.ProgressFormat;
import com.phillippitts.adaptiveencoder.service.progress.ProgressTarget;
import com.phillippitts.adaptiveencoder.service.progress.UpdateInterval;
import com.phillippitts.adaptiveencoder.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Single entry point that decides how an input should be encoded and drives the passes.
 *
 * <p>Flow: probe, complexity analysis, content resolution (explicit profile or automatic
 * classification), parameter adaptation, crop detection, filter graph and pass plan, then
 * {@link PassOrchestrator}. Probe and pass failures are fatal; classification, crop and analysis
 * problems degrade inside their components and never reach this class.
 *
 * <p>Each call opens its own {@link RunContext}; concurrent calls share no mutable state.
 */
@Service
public class AdaptiveEncodingService {

    private static final Logger LOG = LogManager.getLogger(AdaptiveEncodingService.class);

    private final MediaProber prober;
    private final ComplexityAnalyzer analyzer;
    private final ContentClassifier classifier;
    private final ProfileStore profiles;
    private final ProfileRecommender recommender;
    private final CropDetector cropDetector;
    private final PassOrchestrator orchestrator;
    private final ApplicationEventPublisher publisher;
    private final EncodingMetrics metrics;
    private final EncoderBinariesProperties binaries;
    private final WorkspaceProperties workspace;
    private final AnalysisProperties analysis;
    private final EncodeProperties encode;

    public AdaptiveEncodingService(MediaProber prober,
                                   ComplexityAnalyzer analyzer,
                                   ContentClassifier classifier,
                                   ProfileStore profiles,
                                   ProfileRecommender recommender,
                                   CropDetector cropDetector,
                                   PassOrchestrator orchestrator,
                                   ApplicationEventPublisher publisher,
                                   EncodingMetrics metrics,
                                   EncoderBinariesProperties binaries,
                                   WorkspaceProperties workspace,
                                   AnalysisProperties analysis,
                                   EncodeProperties encode) {
        this.prober = Objects.requireNonNull(prober, "prober must not be null");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.profiles = Objects.requireNonNull(profiles, "profiles must not be null");
        this.recommender = Objects.requireNonNull(recommender, "recommender must not be null");
        this.cropDetector = Objects.requireNonNull(cropDetector, "cropDetector must not be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.binaries = Objects.requireNonNull(binaries, "binaries must not be null");
        this.workspace = Objects.requireNonNull(workspace, "workspace must not be null");
        this.analysis = Objects.requireNonNull(analysis, "analysis must not be null");
        this.encode = Objects.requireNonNull(encode, "encode must not be null");
    }

    /**
     * Decides the encoding for one input and runs it to completion.
     *
     * @param request input, profile (or auto), mode, overrides and optional output path
     * @return run summary with output path, final parameters and exit status
     * @throws com.phillippitts.adaptiveencoder.exception.ProbeFailureException if the input cannot be probed
     * @throws com.phillippitts.adaptiveencoder.exception.UnknownProfileException if the named profile does not exist
     * @throws com.phillippitts.adaptiveencoder.exception.PassFailureException if a pass fails
     */
    public EncodeResult decideAndEncode(EncodeRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        EncodingMode mode = request.mode() != null ? request.mode() : encode.defaultMode();
        String modeTag = mode.name().toLowerCase(Locale.ROOT);

        try (RunContext ctx = RunContext.open(workspace.tempRoot(), request.input())) {
            try {
                EncodeResult result = run(ctx, request, mode);
                metrics.recordRunLatency(modeTag, result.elapsedMillis());
                metrics.incrementSuccess(modeTag);
                publisher.publishEvent(new EncodingCompletedEvent(result, Instant.now()));
                return result;
            } catch (EncoderException e) {
                onFailure(ctx, request.input(), modeTag, e.getKind(), e);
                throw e;
            } catch (RuntimeException e) {
                onFailure(ctx, request.input(), modeTag, FailureKind.INTERNAL, e);
                throw e;
            }
        }
    }

    private EncodeResult run(RunContext ctx, EncodeRequest request, EncodingMode mode) {
        Path input = request.input();
        EncodeOverrides overrides = request.overrides();
        String fileName = input.getFileName().toString();
        LOG.info("Starting {} run for {} (profile={})", mode, fileName,
                request.isAuto() ? EncodeRequest.AUTO : request.profile());

        MediaProbe probe = prober.probe(input);
        boolean hdr = probe.isHdr();
        LOG.info("Source: {}x{}, {}, {} fps, {}{}", probe.width(), probe.height(),
                ProgressFormat.duration((long) probe.durationSeconds()), String.format(Locale.ROOT, "%.3f", probe.fps()),
                probe.codecName(), hdr ? ", HDR10" : "");

        // Explicit profiles are resolved first so an unknown name fails before any analysis work.
        EncodingProfile named = request.isAuto() ? null : profiles.get(request.profile());
        boolean analyze = named == null || complexityRequested(overrides);
        ComplexityScore score = analyze ? analyzer.analyze(input, probe) : ComplexityScore.neutral();
        if (score.analyzed()) {
            metrics.recordComplexity(score.value());
        }

        EncodingProfile profile;
        Classification classification;
        AdaptedParameters params;
        if (named == null) {
            classification = classifier.classify(input, probe, score, overrides.forceOracle());
            ContentType type = ContentTypeRefiner.refine(classification.type(), score);
            profile = recommender.recommend(probe, type, fileName);
            params = ParameterAdapter.adapt(profile, score.value(), type, hdr);
            LOG.info("Auto-selected profile {} for {} ({}%, {})", profile.name(), classification.type(),
                    classification.confidence(), classification.source());
        } else if (analyze) {
            profile = named;
            ContentType type = ContentTypeRefiner.refine(profile.contentType(), score);
            classification = Classification.of(type, 100, ClassificationSource.PROFILE);
            params = ParameterAdapter.adapt(profile, score.value(), type, hdr);
            if (type != profile.contentType()) {
                LOG.info("Content type refined from {} to {} (complexity {})", profile.contentType(), type,
                        score.value());
            }
        } else {
            profile = named;
            classification = Classification.of(profile.contentType(), 100, ClassificationSource.PROFILE);
            params = ParameterAdapter.base(profile, hdr);
            LOG.info("Complexity analysis disabled; using base profile {}", profile.name());
        }
        metrics.recordClassification(classification.type().label(),
                classification.source().name().toLowerCase(Locale.ROOT));
        LOG.info("Final parameters: CRF {}, bitrate {}k (complexity {})", params.crfArgument(),
                params.bitrateKbps(), score.value());

        CropRegion crop = cropDetector.detect(input, probe, overrides.manualCrop()).orElse(null);
        metrics.recordCropDecision(overrides.manualCrop() != null ? "manual" : crop != null ? "detected" : "none");

        Path output = request.output() != null ? request.output() : OutputPaths.next(input, null);
        FilterGraph graph = FilterGraph.build(encode.hardwareAccel(), profile.pixelFormat(), overrides.denoise(), crop,
                overrides.scale());
        EncodeJob job = new EncodeJob(binaries.ffmpegPath(), input, output, encode.videoCodec(),
                encode.hardwareAccel(), encode.maxMuxingQueueSize(), overrides.title(), graph,
                profile.pixelFormat(), profile.codecProfile(), params.encoderParams(),
                StreamMap.arguments(probe.audioStreamCount(), probe.subtitleStreamCount()));
        PassPlan plan = PassPlanner.plan(mode, params, profile.preset(), encode.analysisPreset(),
                mode.isTwoPass() ? ctx.statsFile() : null);
        ProgressTarget progress = new ProgressTarget(mode.name(), probe.durationSeconds(),
                probe.estimatedTotalFrames(), UpdateInterval.seconds(probe.width(), probe.height(), score.value(), mode));

        int exit = orchestrator.execute(ctx, plan, job, progress);

        long inputBytes = sizeOf(input);
        long outputBytes = sizeOf(output);
        long elapsed = TimeUtils.elapsedMillis(ctx.startNanos());
        EncodeResult result = new EncodeResult(ctx.runId(), output, params, exit, profile.name(), classification,
                score.value(), crop, mode, plan.passes().size(), inputBytes, outputBytes, elapsed);
        LOG.info("Encoded {} -> {}: {} -> {} in {}", fileName, output.getFileName(),
                ProgressFormat.fileSize(inputBytes), ProgressFormat.fileSize(outputBytes),
                ProgressFormat.duration(elapsed / 1000));
        return result;
    }

    private boolean complexityRequested(EncodeOverrides overrides) {
        return overrides.complexityAnalysis() != null
                ? overrides.complexityAnalysis()
                : analysis.complexityEnabled();
    }

    private void onFailure(RunContext ctx, Path input, String modeTag, FailureKind kind, RuntimeException e) {
        LOG.error("Run {} failed ({}): {}", ctx.runId(), kind, e.getMessage());
        metrics.incrementFailure(modeTag, kind.name().toLowerCase(Locale.ROOT));
        publisher.publishEvent(new EncodingFailedEvent(ctx.runId(), input, kind, e.getMessage(), Instant.now()));
    }

    private static long sizeOf(Path file) {
        try {
            return Files.exists(file) ? Files.size(file) : 0L;
        } catch (IOException e) {
            LOG.warn("Could not read size of {}: {}", file, e.toString());
            return 0L;
        }
    }
}
