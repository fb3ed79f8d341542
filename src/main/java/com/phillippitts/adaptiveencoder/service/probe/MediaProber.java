package com.phillippitts.adaptiveencoder.service.probe;

import com.phillippitts.adaptiveencoder.domain.MediaProbe;

import java.nio.file.Path;

/**
 * Typed boundary around the external media prober.
 */
public interface MediaProber {

    /**
     * Probes an input file.
     *
     * @param input file to probe
     * @return technical description of the first video stream and its container
     * @throws com.phillippitts.adaptiveencoder.exception.ProbeFailureException if the input is
     *         unreadable or has no video stream
     */
    MediaProbe probe(Path input);
}
