package com.phillippitts.adaptiveencoder.service.process;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Thread-safe ring of the most recent lines of a diagnostic stream.
 */
public final class TailBuffer {

    private final int maxLines;
    private final Deque<String> lines;

    public TailBuffer(int maxLines) {
        if (maxLines <= 0) {
            throw new IllegalArgumentException("maxLines must be positive");
        }
        this.maxLines = maxLines;
        this.lines = new ArrayDeque<>(maxLines);
    }

    public synchronized void add(String line) {
        if (lines.size() == maxLines) {
            lines.removeFirst();
        }
        lines.addLast(line);
    }

    /**
     * Buffered lines joined with newlines, oldest first.
     */
    public synchronized String text() {
        return String.join("\n", lines);
    }

    public synchronized boolean isEmpty() {
        return lines.isEmpty();
    }
}
