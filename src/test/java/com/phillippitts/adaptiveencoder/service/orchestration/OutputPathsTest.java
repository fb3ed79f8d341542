package com.phillippitts.adaptiveencoder.service.orchestration;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class OutputPathsTest {

    @Test
    void keepsBaseNameAndExtensionWithRandomSuffix() {
        Path out = OutputPaths.next(Path.of("/media/in/Movie.2019.mp4"), null);

        assertThat(out.getParent()).isEqualTo(Path.of("/media/in"));
        assertThat(out.getFileName().toString()).matches("Movie\\.2019_[0-9a-f]{8}\\.mp4");
    }

    @Test
    void missingExtensionFallsBackToMkv() {
        Path out = OutputPaths.next(Path.of("/media/in/rawcapture"), Path.of("/media/out"));

        assertThat(out.getParent()).isEqualTo(Path.of("/media/out"));
        assertThat(out.getFileName().toString()).matches("rawcapture_[0-9a-f]{8}\\.mkv");
    }

    @Test
    void hiddenFileKeepsWholeNameAsBase() {
        Path out = OutputPaths.next(Path.of("/media/.hidden"), null);

        assertThat(out.getFileName().toString()).matches("\\.hidden_[0-9a-f]{8}\\.mkv");
    }

    @Test
    void successiveNamesDiffer() {
        Path input = Path.of("/media/in/movie.mkv");

        assertThat(OutputPaths.next(input, null)).isNotEqualTo(OutputPaths.next(input, null));
    }

    @Test
    void extensionIsTextAfterLastDot() {
        assertThat(OutputPaths.extension(Path.of("a.b.MKV"))).isEqualTo("MKV");
        assertThat(OutputPaths.extension(Path.of("noext"))).isEmpty();
        assertThat(OutputPaths.extension(Path.of(".hidden"))).isEmpty();
    }
}
