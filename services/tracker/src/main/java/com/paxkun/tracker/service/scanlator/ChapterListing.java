package com.paxkun.tracker.service.scanlator;

import lombok.Builder;

/**
 * CSS selectors describing where a site lists its chapters.
 *
 * @param containerSelector element whose presence means the listing has rendered
 * @param entrySelector     one element per chapter
 * @param linkSelector      chapter anchor inside an entry; null when the entry is the anchor
 * @param titleSelector     chapter label inside an entry; null to use the anchor text
 * @param dateSelector      date label inside an entry; null to search the entry text for a date
 * @param expandSelector    control clicked once before reading, e.g. an "All" tab; optional
 * @param loadMoreSelector  incremental "load more" control clicked until it disappears; optional
 */
@Builder
public record ChapterListing(
        String containerSelector,
        String entrySelector,
        String linkSelector,
        String titleSelector,
        String dateSelector,
        String expandSelector,
        String loadMoreSelector) {
}
