package com.phillippitts.adaptiveencoder.service.classify;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TitleExtractorTest {

    @Test
    void extractsMovieWithYearAndStripsReleaseTags() {
        TitleInfo info = TitleExtractor.extract("The.Matrix.1999.2160p.UHD.BluRay.x265.mkv");

        assertThat(info.title()).isEqualTo("The Matrix");
        assertThat(info.year()).isEqualTo(1999);
        assertThat(info.series()).isFalse();
        assertThat(info.confidence()).isEqualTo(TitleExtractor.YEAR_INSIDE_CONFIDENCE);
    }

    @Test
    void detectsSeasonEpisodeMarker() {
        TitleInfo info = TitleExtractor.extract("Arcane.S01E03.1080p.WEBRip.mkv");

        assertThat(info.title()).isEqualTo("Arcane");
        assertThat(info.year()).isNull();
        assertThat(info.series()).isTrue();
        assertThat(info.confidence()).isEqualTo(TitleExtractor.SERIES_CONFIDENCE);
    }

    @Test
    void yearAtEndOfName() {
        TitleInfo info = TitleExtractor.extract("Dune.2160p.2021.mkv");

        assertThat(info.title()).isEqualTo("Dune");
        assertThat(info.year()).isEqualTo(2021);
        assertThat(info.confidence()).isEqualTo(TitleExtractor.YEAR_END_CONFIDENCE);
    }

    @Test
    void genericNameUsesFirstToken() {
        TitleInfo info = TitleExtractor.extract("/media/in/holiday_video.mp4");

        assertThat(info.title()).isEqualTo("holiday video");
        assertThat(info.year()).isNull();
        assertThat(info.confidence()).isEqualTo(TitleExtractor.GENERIC_CONFIDENCE);
    }

    @Test
    void nullNameYieldsEmptyTitle() {
        TitleInfo info = TitleExtractor.extract(null);

        assertThat(info.title()).isEmpty();
    }
}
