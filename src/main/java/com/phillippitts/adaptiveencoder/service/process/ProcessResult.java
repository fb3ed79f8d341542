package com.phillippitts.adaptiveencoder.service.process;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Captured outcome of a short-lived subprocess.
 *
 * @param exitCode process exit code, or -1 when the process timed out
 * @param stdout raw stdout bytes (capped)
 * @param stderr stderr text (capped)
 * @param durationMs wall-clock duration
 * @param timedOut whether the process was killed after exceeding its timeout
 */
public record ProcessResult(int exitCode, byte[] stdout, String stderr, long durationMs, boolean timedOut) {

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }

    public String stdoutText() {
        return new String(stdout, StandardCharsets.UTF_8);
    }

    public List<String> stderrLines() {
        return stderr.isEmpty() ? List.of() : Arrays.asList(stderr.split("\\R"));
    }

    /**
     * Last {@code maxLines} lines of stderr, joined with newlines.
     */
    public String stderrTail(int maxLines) {
        List<String> lines = stderrLines();
        int from = Math.max(0, lines.size() - maxLines);
        return String.join("\n", lines.subList(from, lines.size()));
    }
}
