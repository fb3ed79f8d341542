package com.phillippitts.adaptiveencoder.service.encode;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StreamMapTest {

    @Test
    void copiesEveryAudioAndSubtitleStream() {
        assertThat(StreamMap.arguments(2, 1)).containsExactly(
                "-map", "0:a:0", "-c:a:0", "copy",
                "-map", "0:a:1", "-c:a:1", "copy",
                "-map", "0:s:0", "-c:s:0", "copy",
                "-map_chapters", "0", "-map_metadata", "0");
    }

    @Test
    void chaptersAndMetadataAlwaysCarried() {
        assertThat(StreamMap.arguments(0, 0)).containsExactly("-map_chapters", "0", "-map_metadata", "0");
    }
}
