package com.phillippitts.adaptiveencoder.service.encode;

import java.util.ArrayList;
import java.util.List;

/**
 * Arguments that carry every audio and subtitle stream, chapters and container metadata through
 * unmodified.
 */
public final class StreamMap {

    private StreamMap() {}

    public static List<String> arguments(int audioStreams, int subtitleStreams) {
        List<String> args = new ArrayList<>();
        for (int i = 0; i < audioStreams; i++) {
            args.addAll(List.of("-map", "0:a:" + i, "-c:a:" + i, "copy"));
        }
        for (int i = 0; i < subtitleStreams; i++) {
            args.addAll(List.of("-map", "0:s:" + i, "-c:s:" + i, "copy"));
        }
        args.addAll(List.of("-map_chapters", "0", "-map_metadata", "0"));
        return List.copyOf(args);
    }
}
