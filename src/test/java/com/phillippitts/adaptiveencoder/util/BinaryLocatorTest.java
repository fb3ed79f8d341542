package com.phillippitts.adaptiveencoder.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class BinaryLocatorTest {

    @TempDir
    Path tmp;

    private Path executable(Path dir, String name) throws IOException {
        Files.createDirectories(dir);
        Path file = Files.writeString(dir.resolve(name), "#!/bin/sh\n");
        assertThat(file.toFile().setExecutable(true)).isTrue();
        return file;
    }

    @Test
    void absoluteExecutablePathResolvesToItself() throws IOException {
        Path ffmpeg = executable(tmp, "ffmpeg");

        assertThat(BinaryLocator.resolve(ffmpeg.toString(), "")).contains(ffmpeg);
    }

    @Test
    void absoluteNonExecutableIsRejected() throws IOException {
        Path plain = Files.writeString(tmp.resolve("ffprobe"), "data");
        assertThat(plain.toFile().setExecutable(false)).isTrue();

        assertThat(BinaryLocator.resolve(plain.toString(), "")).isEmpty();
    }

    @Test
    void bareNameIsSearchedOnPathInOrder() throws IOException {
        Path first = tmp.resolve("first");
        Path second = tmp.resolve("second");
        Files.createDirectories(first);
        Path expected = executable(second, "ffprobe");
        String searchPath = first + File.pathSeparator + File.pathSeparator + second;

        assertThat(BinaryLocator.resolve("ffprobe", searchPath)).contains(expected);
    }

    @Test
    void missingBinaryOrBlankInputResolvesEmpty() {
        assertThat(BinaryLocator.resolve("ffmpeg", tmp.toString())).isEmpty();
        assertThat(BinaryLocator.resolve("ffmpeg", null)).isEmpty();
        assertThat(BinaryLocator.resolve("  ", tmp.toString())).isEmpty();
        assertThat(BinaryLocator.resolve(null, tmp.toString())).isEmpty();
    }
}
