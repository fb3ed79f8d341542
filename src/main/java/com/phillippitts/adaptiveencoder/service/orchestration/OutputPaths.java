package com.phillippitts.adaptiveencoder.service.orchestration;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Default output naming: {@code <name>_<id>.<ext>}, so repeated runs never overwrite each other.
 */
final class OutputPaths {

    static final String DEFAULT_EXTENSION = "mkv";

    private OutputPaths() {}

    /**
     * @param input source file
     * @param directory output directory, or null for the input's directory
     * @return fresh output path
     */
    static Path next(Path input, Path directory) {
        String fileName = input.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        String ext = dot > 0 && dot < fileName.length() - 1 ? fileName.substring(dot + 1) : DEFAULT_EXTENSION;
        Path dir = directory != null ? directory : input.toAbsolutePath().getParent();
        String name = base + "_" + UUID.randomUUID().toString().substring(0, 8) + "." + ext;
        return dir == null ? Path.of(name) : dir.resolve(name);
    }

    static String extension(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(dot + 1) : "";
    }
}
