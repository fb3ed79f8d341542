package com.phillippitts.adaptiveencoder.service.process;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Production {@link ProcessFactory} backed by {@link ProcessBuilder}.
 */
@Component
public final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        // stdout carries data (JSON, raw frames, progress); stderr carries diagnostics
        pb.redirectErrorStream(false);
        pb.redirectInput(ProcessBuilder.Redirect.PIPE);
        return pb.start();
    }
}
