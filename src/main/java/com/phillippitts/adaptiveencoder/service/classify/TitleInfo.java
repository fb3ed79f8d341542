package com.phillippitts.adaptiveencoder.service.classify;

/**
 * Title metadata recovered from a file name.
 *
 * @param title cleaned title (release tags removed), possibly empty
 * @param year release year, or null when none was found
 * @param series whether the name carries a season/episode marker
 * @param confidence extraction confidence in percent
 */
public record TitleInfo(String title, Integer year, boolean series, int confidence) {

    public TitleInfo {
        title = title == null ? "" : title;
    }
}
