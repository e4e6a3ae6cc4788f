package com.paxkun.tracker.service.scanlator;

/**
 * A search hit on a scanlator site.
 *
 * @param title    title as shown by the site
 * @param url      absolute URL of the work's page
 * @param coverUrl cover image URL, empty when the site shows none
 */
public record SearchResult(String title, String url, String coverUrl) {
}
