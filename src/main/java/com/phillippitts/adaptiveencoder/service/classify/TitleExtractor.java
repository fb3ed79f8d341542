package com.phillippitts.adaptiveencoder.service.classify;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers a searchable title from release-style file names such as
 * {@code The.Matrix.1999.2160p.UHD.BluRay.x265.mkv} or {@code Arcane.S01E03.1080p.mkv}.
 */
public final class TitleExtractor {

    private static final Pattern SERIES = Pattern.compile("^(.+)[. ]S(\\d{1,2})E(\\d{1,2})", Pattern.CASE_INSENSITIVE);
    private static final Pattern YEAR_INSIDE = Pattern.compile("^(.+)[. ](\\d{4})[. ]");
    private static final Pattern YEAR_END = Pattern.compile("^(.+)[. ](\\d{4})$");
    private static final Pattern FIRST_TOKEN = Pattern.compile("^([^. ]+)");
    private static final Pattern RELEASE_TAGS = Pattern.compile(
            "\\b(2160p|4K|UHD|1080p|720p|480p|BluRay|BDRip|WEBRip|HDTV|x264|x265|HEVC)\\b",
            Pattern.CASE_INSENSITIVE);

    static final int SERIES_CONFIDENCE = 85;
    static final int YEAR_INSIDE_CONFIDENCE = 80;
    static final int YEAR_END_CONFIDENCE = 75;
    static final int GENERIC_CONFIDENCE = 40;
    static final int FALLBACK_CONFIDENCE = 30;

    private TitleExtractor() {}

    /**
     * Extracts title, year and series marker from a file name (extension optional).
     */
    public static TitleInfo extract(String fileName) {
        String base = stripExtension(fileName == null ? "" : fileName);

        Matcher m = SERIES.matcher(base);
        if (m.find()) {
            return new TitleInfo(clean(m.group(1)), null, true, SERIES_CONFIDENCE);
        }
        m = YEAR_INSIDE.matcher(base);
        if (m.find()) {
            return new TitleInfo(clean(m.group(1)), Integer.parseInt(m.group(2)), false, YEAR_INSIDE_CONFIDENCE);
        }
        m = YEAR_END.matcher(base);
        if (m.find()) {
            return new TitleInfo(clean(m.group(1)), Integer.parseInt(m.group(2)), false, YEAR_END_CONFIDENCE);
        }
        m = FIRST_TOKEN.matcher(base);
        if (m.find()) {
            return new TitleInfo(clean(m.group(1)), null, false, GENERIC_CONFIDENCE);
        }
        String[] words = normalize(base).split(" ");
        return new TitleInfo(clean(words.length > 0 ? words[0] : ""), null, false, FALLBACK_CONFIDENCE);
    }

    private static String clean(String raw) {
        String title = normalize(raw);
        return RELEASE_TAGS.matcher(title).replaceAll("").replaceAll("\\s+", " ").trim();
    }

    private static String normalize(String raw) {
        return raw.replaceAll("[._\\-]", " ").replaceAll("\\s+", " ").trim();
    }

    private static String stripExtension(String name) {
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        String base = slash >= 0 ? name.substring(slash + 1) : name;
        int dot = base.lastIndexOf('.');
        return dot > 0 ? base.substring(0, dot) : base;
    }
}
