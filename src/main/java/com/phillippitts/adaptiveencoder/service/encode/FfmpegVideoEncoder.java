package com.phillippitts.adaptiveencoder.service.encode;

import com.phillippitts.adaptiveencoder.config.properties.ProgressProperties;
import com.phillippitts.adaptiveencoder.service.process.ProcessFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * {@link VideoEncoder} that launches ffmpeg through the {@link ProcessFactory}.
 */
@Component
public class FfmpegVideoEncoder implements VideoEncoder {

    private static final Logger LOG = LogManager.getLogger(FfmpegVideoEncoder.class);

    private final ProcessFactory processFactory;
    private final ProgressProperties progress;

    public FfmpegVideoEncoder(ProcessFactory processFactory, ProgressProperties progress) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.progress = Objects.requireNonNull(progress, "progress");
    }

    @Override
    public RunningPass start(List<String> command, String label) throws IOException {
        LOG.info("Starting {}", label);
        LOG.debug("Command: {}", String.join(" ", command));
        Process process = processFactory.start(command, null);
        return RunningPass.attach(process, progress.diagnosticTailLines(), label);
    }
}
