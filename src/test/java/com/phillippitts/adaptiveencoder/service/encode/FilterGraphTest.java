package com.phillippitts.adaptiveencoder.service.encode;

import com.phillippitts.adaptiveencoder.domain.CropRegion;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FilterGraphTest {

    private static final CropRegion CROP = new CropRegion(1920, 800, 0, 140);
    private static final String TEN_BIT = "yuv420p10le";

    @Test
    void emptyWhenNothingRequested() {
        FilterGraph graph = FilterGraph.build(false, TEN_BIT, false, null, " ");

        assertThat(graph.isEmpty()).isTrue();
        assertThat(graph.toString()).isEqualTo("(none)");
    }

    @Test
    void singleStageWritesOutputLabel() {
        assertThat(FilterGraph.build(false, TEN_BIT, false, CROP, null).render()).isEqualTo("[0:v]crop=1920:800:0:140[v]");
    }

    @Test
    void stagesRunDenoiseThenCropThenScale() {
        FilterGraph graph = FilterGraph.build(false, TEN_BIT, true, CROP, "1280:-2");

        assertThat(graph.render()).isEqualTo("[0:v]hqdn3d=1:1:2:2[denoised];"
                + "[denoised]crop=1920:800:0:140[cropped];"
                + "[cropped]scale=1280:-2[v]");
    }

    @Test
    void hardwareFramesAreDownloadedFirst() {
        assertThat(FilterGraph.build(true, TEN_BIT, true, null, null).render())
                .isEqualTo("[0:v]hwdownload,format=p010le,hqdn3d=1:1:2:2[v]");
        assertThat(FilterGraph.build(true, TEN_BIT, false, null, null).render())
                .isEqualTo("[0:v]hwdownload,format=p010le[v]");
    }

    @Test
    void eightBitOutputDownloadsNv12() {
        assertThat(FilterGraph.build(true, "yuv420p", false, null, null).render())
                .isEqualTo("[0:v]hwdownload,format=nv12[v]");
    }

    @Test
    void downloadFormatFollowsOutputBitDepth() {
        assertThat(FilterGraph.downloadFormat("yuv420p10le")).isEqualTo("p010le");
        assertThat(FilterGraph.downloadFormat("yuv420p12le")).isEqualTo("p010le");
        assertThat(FilterGraph.downloadFormat("p010le")).isEqualTo("p010le");
        assertThat(FilterGraph.downloadFormat("yuv420p")).isEqualTo("nv12");
        assertThat(FilterGraph.downloadFormat("nv12")).isEqualTo("nv12");
        assertThat(FilterGraph.downloadFormat(null)).isEqualTo("nv12");
    }
}
