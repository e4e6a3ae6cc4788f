package com.paxkun.tracker.service.scanlator;

import java.time.LocalDateTime;

/**
 * A chapter as extracted from a scanlator page, before it is persisted.
 *
 * @param number      normalized chapter number ("42", "42.5")
 * @param title       raw chapter label from the page
 * @param url         absolute chapter URL
 * @param publishedAt site-reported publication time, or extraction time when unknown
 */
public record ScannedChapter(String number, String title, String url, LocalDateTime publishedAt) {

    /**
     * Numeric value used for ordering; non-numeric chapter numbers sort as 0.
     */
    public double numericValue() {
        try {
            return Double.parseDouble(number);
        } catch (NumberFormatException | NullPointerException e) {
            return 0d;
        }
    }
}
