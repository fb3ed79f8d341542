package com.phillippitts.adaptiveencoder.service.orchestration;

import com.phillippitts.adaptiveencoder.domain.BatchResult;
import com.phillippitts.adaptiveencoder.domain.EncodeOverrides;
import com.phillippitts.adaptiveencoder.domain.EncodeResult;
import com.phillippitts.adaptiveencoder.domain.EncodingMode;
import com.phillippitts.adaptiveencoder.exception.EncoderException;
import com.phillippitts.adaptiveencoder.exception.FailureKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Encodes many inputs, each as an independent {@link AdaptiveEncodingService} run.
 *
 * <p>Inputs may be files or directories; directories are scanned recursively for video files.
 * Runs are submitted to the {@code batchExecutor}. A failed file is recorded in the
 * {@link BatchResult} and never stops the rest of the batch.
 */
@Service
public class BatchEncodingService {

    private static final Logger LOG = LogManager.getLogger(BatchEncodingService.class);

    static final Set<String> VIDEO_EXTENSIONS = Set.of("mkv", "mp4", "mov", "m4v");

    private final AdaptiveEncodingService encoder;
    private final Executor executor;

    public BatchEncodingService(AdaptiveEncodingService encoder, @Qualifier("batchExecutor") Executor executor) {
        this.encoder = Objects.requireNonNull(encoder, "encoder must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /**
     * @param inputs files or directories
     * @param profile profile name or {@value EncodeRequest#AUTO}
     * @param mode encoding mode, or null for the configured default
     * @param overrides overrides applied to every file (a manual crop applies to all of them)
     * @param outputDirectory directory for all outputs, or null to write next to each input
     * @return per-file outcomes in input order
     */
    public BatchResult encodeBatch(List<Path> inputs, String profile, EncodingMode mode, EncodeOverrides overrides,
                                   Path outputDirectory) {
        List<Path> files = expand(inputs);
        LOG.info("Batch of {} file(s) (profile={}, mode={})", files.size(), profile, mode);

        List<CompletableFuture<BatchResult.Item>> futures = new ArrayList<>(files.size());
        for (Path file : files) {
            EncodeRequest request = new EncodeRequest(file, profile, mode, overrides,
                    OutputPaths.next(file, outputDirectory));
            futures.add(submit(request));
        }

        List<BatchResult.Item> items = futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
        BatchResult result = new BatchResult(items);
        LOG.info("Batch finished: {} succeeded, {} failed", result.succeeded(), result.failed());
        return result;
    }

    private CompletableFuture<BatchResult.Item> submit(EncodeRequest request) {
        Path input = request.input();
        try {
            return CompletableFuture.supplyAsync(() -> encode(request), executor);
        } catch (RejectedExecutionException e) {
            LOG.warn("Batch queue full; skipping {}", input.getFileName());
            return CompletableFuture.completedFuture(
                    BatchResult.Item.failure(input, FailureKind.INTERNAL.name(), "Batch queue full"));
        }
    }

    private BatchResult.Item encode(EncodeRequest request) {
        Path input = request.input();
        try {
            EncodeResult result = encoder.decideAndEncode(request);
            return BatchResult.Item.success(input, result);
        } catch (EncoderException e) {
            LOG.warn("Batch item {} failed ({}): {}", input.getFileName(), e.getKind(), e.getMessage());
            return BatchResult.Item.failure(input, e.getKind().name(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Batch item {} failed: {}", input.getFileName(), e.toString());
            return BatchResult.Item.failure(input, FailureKind.INTERNAL.name(), e.getMessage());
        }
    }

    /**
     * Flattens directories into their video files (sorted, de-duplicated); plain files pass through.
     */
    static List<Path> expand(List<Path> inputs) {
        Set<Path> files = new LinkedHashSet<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                try (Stream<Path> walk = Files.walk(input)) {
                    walk.filter(Files::isRegularFile)
                            .filter(BatchEncodingService::isVideo)
                            .sorted()
                            .forEach(files::add);
                } catch (IOException e) {
                    LOG.warn("Could not scan {}: {}", input, e.toString());
                }
            } else {
                files.add(input);
            }
        }
        return List.copyOf(files);
    }

    static boolean isVideo(Path file) {
        return VIDEO_EXTENSIONS.contains(OutputPaths.extension(file).toLowerCase(Locale.ROOT));
    }
}
