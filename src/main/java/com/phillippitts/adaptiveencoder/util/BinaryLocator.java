package com.phillippitts.adaptiveencoder.util;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves a configured binary, either a path or a bare name looked up on {@code PATH}.
 *
 * @since 1.0
 */
public final class BinaryLocator {

    private BinaryLocator() {
        // Utility class - prevent instantiation
    }

    /**
     * @param configured configured value such as {@code /usr/bin/ffmpeg} or {@code ffmpeg}
     * @return the executable file, or empty when it cannot be found or is not executable
     */
    public static Optional<Path> resolve(String configured) {
        return resolve(configured, System.getenv("PATH"));
    }

    // Package-private for tests
    static Optional<Path> resolve(String configured, String searchPath) {
        if (configured == null || configured.isBlank()) {
            return Optional.empty();
        }
        Path path = Path.of(configured);
        if (path.isAbsolute() || path.getNameCount() > 1) {
            return isExecutable(path) ? Optional.of(path) : Optional.empty();
        }
        if (searchPath == null || searchPath.isBlank()) {
            return Optional.empty();
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Path.of(dir).resolve(configured);
            if (isExecutable(candidate)) {
                return Optional.of(candidate);
            }
            Path windows = Path.of(dir).resolve(configured + ".exe");
            if (isExecutable(windows)) {
                return Optional.of(windows);
            }
        }
        return Optional.empty();
    }

    private static boolean isExecutable(Path path) {
        return Files.isRegularFile(path) && Files.isExecutable(path);
    }
}
