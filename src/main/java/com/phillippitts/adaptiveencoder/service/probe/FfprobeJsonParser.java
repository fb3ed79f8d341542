package com.phillippitts.adaptiveencoder.service.probe;

import com.phillippitts.adaptiveencoder.domain.MediaProbe;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Locale;

/**
 * Parses ffprobe {@code -of json} output into a {@link MediaProbe}.
 */
final class FfprobeJsonParser {

    private FfprobeJsonParser() {}

    /**
     * Container-level facts extracted from one ffprobe document.
     */
    record StreamInfo(
            int width,
            int height,
            double durationSeconds,
            double fps,
            String codecName,
            long bitrateBps,
            String colorPrimaries,
            String colorTransfer,
            String colorSpace,
            long frameCount,
            int audioStreams,
            int subtitleStreams
    ) {}

    /**
     * Parses {@code -show_format -show_streams} output.
     *
     * @param json ffprobe JSON document
     * @return stream info, or null if the document has no video stream with valid dimensions
     * @throws JSONException if the document is not valid JSON
     */
    static StreamInfo parse(String json) {
        JSONObject root = new JSONObject(json);
        JSONArray streams = root.optJSONArray("streams");
        JSONObject format = root.optJSONObject("format");
        if (streams == null) {
            return null;
        }

        JSONObject video = null;
        int audio = 0;
        int subtitles = 0;
        for (int i = 0; i < streams.length(); i++) {
            JSONObject s = streams.optJSONObject(i);
            if (s == null) {
                continue;
            }
            String type = s.optString("codec_type", "");
            switch (type) {
                case "video" -> {
                    // Cover art is exposed as a video stream with attached_pic=1
                    boolean attachedPic = s.optJSONObject("disposition") != null
                            && s.getJSONObject("disposition").optInt("attached_pic", 0) == 1;
                    if (video == null && !attachedPic) {
                        video = s;
                    }
                }
                case "audio" -> audio++;
                case "subtitle" -> subtitles++;
                default -> { }
            }
        }
        if (video == null || video.optInt("width", 0) <= 0 || video.optInt("height", 0) <= 0) {
            return null;
        }

        double duration = parseDouble(format == null ? null : format.optString("duration", null));
        if (duration <= 0) {
            duration = parseDouble(video.optString("duration", null));
        }
        long bitrate = parseLong(format == null ? null : format.optString("bit_rate", null));
        if (bitrate <= 0) {
            bitrate = parseLong(video.optString("bit_rate", null));
        }
        double fps = parseRate(video.optString("avg_frame_rate", null));
        if (fps <= 0) {
            fps = parseRate(video.optString("r_frame_rate", null));
        }

        return new StreamInfo(
                video.optInt("width"),
                video.optInt("height"),
                Math.max(0, duration),
                fps,
                video.optString("codec_name", ""),
                Math.max(0, bitrate),
                video.optString("color_primaries", ""),
                video.optString("color_transfer", ""),
                video.optString("color_space", ""),
                Math.max(0, parseLong(video.optString("nb_frames", null))),
                audio,
                subtitles);
    }

    /**
     * Parses the first integer of {@code -show_entries stream=nb_read_packets -of csv=p=0} output.
     *
     * @return packet count, or 0 when absent or not numeric
     */
    static long parseCount(String csv) {
        if (csv == null) {
            return 0;
        }
        for (String line : csv.split("\\R")) {
            String t = line.trim().replace(",", "");
            if (!t.isEmpty()) {
                return Math.max(0, parseLong(t));
            }
        }
        return 0;
    }

    /**
     * Collapses {@code -show_entries frame=pict_type -of csv=p=0} output into a string like {@code "IPBB"}.
     */
    static String parseFrameTypes(String csv) {
        if (csv == null || csv.isBlank()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (String line : csv.split("\\R")) {
            String t = line.trim().replace(",", "").toUpperCase(Locale.ROOT);
            if (t.length() == 1 && "IPB".indexOf(t.charAt(0)) >= 0) {
                sb.append(t.charAt(0));
            } else if (!t.isEmpty()) {
                // Unknown picture type ("?" or "S") still counts toward the window size
                sb.append('?');
            }
        }
        return sb.toString();
    }

    /**
     * Parses rational rates such as {@code "24000/1001"}.
     */
    static double parseRate(String rate) {
        if (rate == null || rate.isBlank()) {
            return 0;
        }
        int slash = rate.indexOf('/');
        if (slash < 0) {
            return parseDouble(rate);
        }
        double num = parseDouble(rate.substring(0, slash));
        double den = parseDouble(rate.substring(slash + 1));
        return den == 0 ? 0 : num / den;
    }

    private static double parseDouble(String value) {
        if (value == null || value.isBlank() || "N/A".equals(value)) {
            return 0;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static long parseLong(String value) {
        if (value == null || value.isBlank() || "N/A".equals(value)) {
            return 0;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return (long) parseDouble(value);
        }
    }
}
