package com.phillippitts.adaptiveencoder.service.encode;

import com.phillippitts.adaptiveencoder.service.process.ProcessTermination;
import com.phillippitts.adaptiveencoder.service.process.StreamGobblers;
import com.phillippitts.adaptiveencoder.service.process.TailBuffer;
import com.phillippitts.adaptiveencoder.util.ProcessTimeouts;

import java.io.InputStream;
import java.util.Objects;

/**
 * Handle on a started encoder pass: its progress feed, the tail of its diagnostics, and its exit.
 */
public final class RunningPass {

    private final Process process;
    private final TailBuffer diagnostics;
    private final Thread diagnosticsGobbler;

    RunningPass(Process process, TailBuffer diagnostics, Thread diagnosticsGobbler) {
        this.process = Objects.requireNonNull(process, "process");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.diagnosticsGobbler = diagnosticsGobbler;
    }

    /**
     * Starts draining the process's diagnostic stream into a tail buffer.
     */
    public static RunningPass attach(Process process, int tailLines, String name) {
        TailBuffer tail = new TailBuffer(tailLines);
        Thread gobbler = StreamGobblers.lines(process.getErrorStream(), tail::add, name + "-err");
        return new RunningPass(process, tail, gobbler);
    }

    /**
     * Line-oriented {@code key=value} progress feed.
     */
    public InputStream progressStream() {
        return process.getInputStream();
    }

    public TailBuffer diagnostics() {
        return diagnostics;
    }

    /**
     * Waits for exit and for the diagnostic stream to drain.
     *
     * @return exit code
     */
    public int waitFor() throws InterruptedException {
        int exit = process.waitFor();
        StreamGobblers.joinQuietly(diagnosticsGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
        return exit;
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public void destroy() {
        ProcessTermination.destroy(process);
    }
}
