package com.paxkun.tracker.service.scanlator;

import java.util.List;

/**
 * Capabilities every scanlator site plugin provides.
 * <p>
 * Implementations are bound to a single browser page and must not propagate transient
 * failures (navigation timeouts, missing selectors): those degrade to an empty result and
 * are logged at error level. Against unchanged remote content, repeated calls return
 * equivalent, equally ordered results.
 */
public interface ScanlatorPlugin {

    /**
     * Best-effort title search on the site.
     *
     * @param title title to look for
     * @return matching candidates, empty on failure
     */
    List<SearchResult> search(String title);

    /**
     * Extracts every chapter listed on a work's detail page.
     *
     * @param workUrl site-specific URL of the work
     * @return chapters ordered oldest to newest, empty on failure
     */
    List<ScannedChapter> extractChapters(String workUrl);

    /**
     * Normalizes raw chapter text ("Chapter 42.5", "Cap. 7") to its number.
     *
     * @return the number as a string, {@code "0"} when none could be found
     */
    String parseChapterNumber(String rawText);
}
