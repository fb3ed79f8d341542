package com.phillippitts.adaptiveencoder.service.encode;

import com.phillippitts.adaptiveencoder.domain.EncoderParams;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Everything the command builder needs that is shared by all passes of a run.
 *
 * @param ffmpegPath encoder binary
 * @param input source file
 * @param output destination file
 * @param videoCodec encoder library
 * @param hardwareAccel decode on the GPU
 * @param maxMuxingQueueSize muxer queue size
 * @param title container title, or null
 * @param filterGraph video filter chain
 * @param pixelFormat output pixel format
 * @param codecProfile codec profile
 * @param encoderParams adapted encoder-library parameters
 * @param streamMap pass-through arguments for non-video streams
 */
public record EncodeJob(
        String ffmpegPath,
        Path input,
        Path output,
        String videoCodec,
        boolean hardwareAccel,
        int maxMuxingQueueSize,
        String title,
        FilterGraph filterGraph,
        String pixelFormat,
        String codecProfile,
        EncoderParams encoderParams,
        List<String> streamMap
) {
    public EncodeJob {
        Objects.requireNonNull(ffmpegPath, "ffmpegPath");
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(filterGraph, "filterGraph");
        Objects.requireNonNull(encoderParams, "encoderParams");
        streamMap = List.copyOf(streamMap);
    }
}
