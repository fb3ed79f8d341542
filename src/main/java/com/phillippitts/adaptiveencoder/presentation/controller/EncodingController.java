package com.phillippitts.adaptiveencoder.presentation.controller;

import com.phillippitts.adaptiveencoder.domain.BatchResult;
import com.phillippitts.adaptiveencoder.domain.EncodeResult;
import com.phillippitts.adaptiveencoder.domain.EncodingProfile;
import com.phillippitts.adaptiveencoder.service.orchestration.AdaptiveEncodingService;
import com.phillippitts.adaptiveencoder.service.orchestration.BatchEncodingService;
import com.phillippitts.adaptiveencoder.service.orchestration.EncodeRequest;
import com.phillippitts.adaptiveencoder.service.profile.ProfileStore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;

/**
 * HTTP surface for {@code decideAndEncode}, batch encoding and the profile catalog.
 *
 * <p>Requests block until the run finishes. Failures are mapped by
 * {@link com.phillippitts.adaptiveencoder.presentation.exception.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api")
class EncodingController {

    private static final Logger LOG = LogManager.getLogger(EncodingController.class);

    private final AdaptiveEncodingService encodingService;
    private final BatchEncodingService batchService;
    private final ProfileStore profiles;

    EncodingController(AdaptiveEncodingService encodingService, BatchEncodingService batchService,
                       ProfileStore profiles) {
        this.encodingService = encodingService;
        this.batchService = batchService;
        this.profiles = profiles;
    }

    @PostMapping("/encodings")
    ResponseEntity<EncodeResponse> encode(@Valid @RequestBody SingleEncodeRequest body) {
        EncodeRequestBody options = body.optionsOrDefault();
        EncodeRequest request = new EncodeRequest(Path.of(body.input()), options.profile(),
                options.encodingMode(), options.overrides(),
                body.output() == null || body.output().isBlank() ? null : Path.of(body.output()));
        LOG.info("Encode requested for {}", request.input().getFileName());
        return ResponseEntity.ok(EncodeResponse.from(encodingService.decideAndEncode(request)));
    }

    @PostMapping("/encodings/batch")
    ResponseEntity<BatchResponse> encodeBatch(@Valid @RequestBody BatchEncodeRequest body) {
        EncodeRequestBody options = body.optionsOrDefault();
        List<Path> inputs = body.inputs().stream().map(Path::of).toList();
        Path outputDir = body.outputDirectory() == null || body.outputDirectory().isBlank()
                ? null : Path.of(body.outputDirectory());
        BatchResult result = batchService.encodeBatch(inputs, options.profile(), options.encodingMode(),
                options.overrides(), outputDir);
        return ResponseEntity.ok(BatchResponse.from(result));
    }

    @GetMapping("/profiles")
    List<ProfileSummary> listProfiles() {
        return profiles.listProfiles().stream().map(ProfileSummary::from).toList();
    }

    record SingleEncodeRequest(@NotBlank String input, String output, EncodeRequestBody options) {
        EncodeRequestBody optionsOrDefault() {
            return options == null ? new EncodeRequestBody(null, null, null, null, null, null, null, null) : options;
        }
    }

    record BatchEncodeRequest(@NotEmpty List<@NotBlank String> inputs, String outputDirectory,
                              EncodeRequestBody options) {
        EncodeRequestBody optionsOrDefault() {
            return options == null ? new EncodeRequestBody(null, null, null, null, null, null, null, null) : options;
        }
    }

    record EncodeResponse(String runId, String outputPath, String profile, String contentType,
                          int confidence, String classificationSource, int complexityScore, String crf,
                          int bitrateKbps, String encoderParams, String crop, String mode, int passes,
                          int exitStatus, long inputBytes, long outputBytes, double compressionRatio,
                          long elapsedMillis) {

        static EncodeResponse from(EncodeResult r) {
            return new EncodeResponse(r.runId(), r.outputPath().toString(), r.profileName(),
                    r.classification().type().label(), r.classification().confidence(),
                    r.classification().source().name(), r.complexityScore(), r.finalParameters().crfArgument(),
                    r.finalParameters().bitrateKbps(), r.finalParameters().encoderParams().toArgument(),
                    r.crop() == null ? null : r.crop().toString(), r.mode().name(), r.passCount(),
                    r.exitStatus(), r.inputBytes(), r.outputBytes(), r.compressionRatio(), r.elapsedMillis());
        }
    }

    record BatchItemResponse(String input, EncodeResponse result, String failureKind, String failureMessage) {}

    record BatchResponse(long succeeded, long failed, List<BatchItemResponse> items) {

        static BatchResponse from(BatchResult result) {
            List<BatchItemResponse> items = result.items().stream()
                    .map(i -> new BatchItemResponse(i.input().toString(),
                            i.succeeded() ? EncodeResponse.from(i.result()) : null,
                            i.failureKind(), i.failureMessage()))
                    .toList();
            return new BatchResponse(result.succeeded(), result.failed(), items);
        }
    }

    record ProfileSummary(String name, String title, String contentType, String preset, double crf) {

        static ProfileSummary from(EncodingProfile p) {
            return new ProfileSummary(p.name(), p.title(), p.contentType().label(), p.preset(), p.baseCrf());
        }
    }
}
