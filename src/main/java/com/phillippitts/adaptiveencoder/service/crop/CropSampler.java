package com.phillippitts.adaptiveencoder.service.crop;

import com.phillippitts.adaptiveencoder.domain.CropRegion;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs black-border detection over one window of the source.
 */
public interface CropSampler {

    /**
     * @param input source file
     * @param startSeconds window start
     * @param lengthSeconds window length
     * @param limit black-level limit
     * @return every rectangle reported in the window, in order (possibly empty)
     * @throws com.phillippitts.adaptiveencoder.exception.CropDetectionException if the sample cannot run
     */
    List<CropRegion> sample(Path input, double startSeconds, int lengthSeconds, int limit);
}
