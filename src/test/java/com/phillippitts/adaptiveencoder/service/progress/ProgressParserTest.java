package com.phillippitts.adaptiveencoder.service.progress;

import com.phillippitts.adaptiveencoder.domain.ProgressSample;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressParserTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private static Optional<ProgressSample> feed(ProgressParser parser, String block) {
        Optional<ProgressSample> last = Optional.empty();
        for (String line : block.split("\n")) {
            Optional<ProgressSample> s = parser.accept(line, NOW);
            if (s.isPresent()) {
                last = s;
            }
        }
        return last;
    }

    @Test
    void blockBecomesSampleOnProgressLine() {
        ProgressParser parser = new ProgressParser();

        Optional<ProgressSample> sample = feed(parser, """
                frame=240
                fps=48.00
                stream_0_0_q=28.0
                total_size=1048576
                out_time_us=10000000
                out_time=00:00:10.000000
                speed=2.00x
                progress=continue""");

        assertThat(sample).isPresent();
        ProgressSample s = sample.get();
        assertThat(s.frameIndex()).isEqualTo(240);
        assertThat(s.fps()).isEqualTo(48.0);
        assertThat(s.totalSizeBytes()).isEqualTo(1_048_576);
        assertThat(s.outputTimeMicros()).isEqualTo(10_000_000);
        assertThat(s.speed()).isEqualTo(2.0);
        assertThat(s.finished()).isFalse();
        assertThat(s.wallClock()).isEqualTo(NOW);
    }

    @Test
    void noSampleUntilBlockCloses() {
        ProgressParser parser = new ProgressParser();

        assertThat(parser.accept("frame=10", NOW)).isEmpty();
        assertThat(parser.accept("garbage", NOW)).isEmpty();
        assertThat(parser.accept("=x", NOW)).isEmpty();
        assertThat(parser.accept(null, NOW)).isEmpty();
    }

    @Test
    void unavailableValuesKeepPreviousReadings() {
        ProgressParser parser = new ProgressParser();
        feed(parser, "frame=100\nout_time_us=4000000\nspeed=1.5x\nprogress=continue");

        ProgressSample s = feed(parser, "frame=N/A\nout_time_us=N/A\nspeed=N/A\nprogress=continue").orElseThrow();

        assertThat(s.frameIndex()).isEqualTo(100);
        assertThat(s.outputTimeMicros()).isEqualTo(4_000_000);
        assertThat(s.speed()).isZero();
    }

    @Test
    void negativeOutputTimeIsClampedAndEndIsFinished() {
        ProgressParser parser = new ProgressParser();

        ProgressSample s = feed(parser, "out_time_us=-9223372036854775807\nprogress=end").orElseThrow();

        assertThat(s.outputTimeMicros()).isZero();
        assertThat(s.finished()).isTrue();
    }
}
