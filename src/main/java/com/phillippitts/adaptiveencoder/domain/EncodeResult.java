package com.phillippitts.adaptiveencoder.domain;

import java.nio.file.Path;

/**
 * Outcome of a successful {@code decideAndEncode} run.
 *
 * @param runId identifier of the run
 * @param outputPath encoded file
 * @param finalParameters rate-control values used by the passes
 * @param exitStatus exit status of the last pass (0 on success)
 * @param profileName profile the run was encoded with
 * @param classification resolved content label
 * @param complexityScore complexity score the parameters were adapted with
 * @param crop applied crop, or null when uncropped
 * @param mode encoding mode
 * @param passCount number of passes executed
 * @param inputBytes size of the input file
 * @param outputBytes size of the output file
 * @param elapsedMillis wall-clock duration of the run
 */
public record EncodeResult(
        String runId,
        Path outputPath,
        AdaptedParameters finalParameters,
        int exitStatus,
        String profileName,
        Classification classification,
        int complexityScore,
        CropRegion crop,
        EncodingMode mode,
        int passCount,
        long inputBytes,
        long outputBytes,
        long elapsedMillis
) {
    /**
     * Input size divided by output size, or 0 when the output is empty.
     */
    public double compressionRatio() {
        if (outputBytes <= 0) {
            return 0;
        }
        return (double) inputBytes / outputBytes;
    }
}
