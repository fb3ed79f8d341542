package com.phillippitts.adaptiveencoder.service.encode;

import java.io.IOException;
import java.util.List;

/**
 * Starts encoder passes. The orchestrator only needs the exit status and the progress feed.
 */
public interface VideoEncoder {

    /**
     * @param command full pass command line
     * @param label short name for threads and logs
     * @return handle on the running pass
     * @throws IOException if the encoder cannot be started
     */
    RunningPass start(List<String> command, String label) throws IOException;
}
