package com.phillippitts.adaptiveencoder.service.encode;

import com.phillippitts.adaptiveencoder.domain.CropRegion;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Linear video filter chain: optional denoise, then crop, then scale.
 *
 * <p>Rendered as a filter graph from {@code [0:v]} to the {@code [v]} output label, e.g.
 * {@code [0:v]hqdn3d=1:1:2:2[denoised];[denoised]crop=1920:800:0:140[v]}.
 *
 * @param stages named filter stages in order
 */
public record FilterGraph(List<Stage> stages) {

    public static final String OUTPUT_LABEL = "[v]";

    static final String DENOISE = "hqdn3d=1:1:2:2";
    static final String HW_DOWNLOAD = "hwdownload,format=";
    static final String DOWNLOAD_8BIT = "nv12";
    static final String DOWNLOAD_HIGH_DEPTH = "p010le";

    public FilterGraph {
        stages = List.copyOf(stages);
    }

    /**
     * Builds the chain. Each stage is inserted only when requested. With GPU decoding, frames are
     * downloaded before the first CPU filter in a format deep enough for the output pixel format.
     *
     * @param hardwareAccel frames arrive as GPU surfaces
     * @param pixelFormat output pixel format, e.g. {@code yuv420p10le}
     * @param denoise insert the denoise stage
     * @param crop crop to apply, or null
     * @param scale scale argument such as {@code 1920:-2}, or null/blank
     * @return filter graph, possibly empty
     */
    public static FilterGraph build(boolean hardwareAccel, String pixelFormat, boolean denoise, CropRegion crop,
                                    String scale) {
        List<Stage> stages = new ArrayList<>();
        String download = HW_DOWNLOAD + downloadFormat(pixelFormat);
        if (denoise) {
            stages.add(new Stage("denoised", hardwareAccel ? download + "," + DENOISE : DENOISE));
        } else if (hardwareAccel) {
            stages.add(new Stage("downloaded", download));
        }
        if (crop != null) {
            stages.add(new Stage("cropped", crop.toFilter()));
        }
        if (scale != null && !scale.isBlank()) {
            stages.add(new Stage("scaled", "scale=" + scale.trim()));
        }
        return new FilterGraph(stages);
    }

    /**
     * Surface format for {@code hwdownload}: {@value #DOWNLOAD_HIGH_DEPTH} when the output carries more
     * than 8 bits per sample, else {@value #DOWNLOAD_8BIT}.
     */
    static String downloadFormat(String pixelFormat) {
        String fmt = pixelFormat == null ? "" : pixelFormat.toLowerCase(Locale.ROOT);
        boolean highDepth = !fmt.startsWith("nv") && fmt.matches(".*(10|12|14|16)(le|be)?$");
        return highDepth ? DOWNLOAD_HIGH_DEPTH : DOWNLOAD_8BIT;
    }

    public boolean isEmpty() {
        return stages.isEmpty();
    }

    /**
     * Renders the graph; the last stage writes to {@link #OUTPUT_LABEL}.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        String input = "[0:v]";
        for (int i = 0; i < stages.size(); i++) {
            Stage s = stages.get(i);
            String output = i == stages.size() - 1 ? OUTPUT_LABEL : "[" + s.label() + "]";
            if (i > 0) {
                sb.append(';');
            }
            sb.append(input).append(s.filter()).append(output);
            input = output;
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return isEmpty() ? "(none)" : render();
    }

    /**
     * @param label intermediate pad label
     * @param filter filter expression
     */
    public record Stage(String label, String filter) {}
}
