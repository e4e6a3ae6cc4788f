package com.paxkun.tracker.service.scanlator.sites;

import com.paxkun.tracker.service.browser.BrowserPage;
import com.paxkun.tracker.service.scanlator.AbstractScanlator;
import com.paxkun.tracker.service.scanlator.ChapterExtractor;
import com.paxkun.tracker.service.scanlator.ChapterListing;
import com.paxkun.tracker.service.scanlator.ScanlatorRegistration;
import com.paxkun.tracker.service.scanlator.SearchResult;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Raven Scans (ravenscans.org), a MangaReader-theme WordPress site.
 */
public class RavenScans extends AbstractScanlator {

    public static final String IDENTIFIER = "RavenScans";
    public static final String DISPLAY_NAME = "Raven Scans";
    public static final String BASE_URL = "https://ravenscans.org";

    private static final ChapterListing LISTING = ChapterListing.builder()
            .containerSelector(".chbox")
            .entrySelector(".chbox")
            .linkSelector(".eph-num a")
            .titleSelector(".chapternum")
            .dateSelector(".chapterdate")
            .build();

    public RavenScans(BrowserPage page, ChapterExtractor extractor) {
        super(page, extractor, DISPLAY_NAME);
    }

    public static ScanlatorRegistration registration(ChapterExtractor extractor) {
        return new ScanlatorRegistration(IDENTIFIER, DISPLAY_NAME, BASE_URL,
                page -> new RavenScans(page, extractor));
    }

    @Override
    protected String searchUrl(String title) {
        return BASE_URL + "/?s=" + URLEncoder.encode(title, StandardCharsets.UTF_8);
    }

    @Override
    protected String searchResultSelector() {
        return ".listupd";
    }

    @Override
    protected List<SearchResult> parseSearchResults(Document document) {
        List<SearchResult> results = new ArrayList<>();
        for (Element item : document.select(".listupd .bsx a[href]")) {
            String url = item.absUrl("href");
            Element label = item.selectFirst(".tt");
            String title = label != null ? label.text().trim() : item.attr("title").trim();
            if (url.isEmpty() || title.isEmpty()) {
                continue;
            }
            Element img = item.selectFirst("img");
            String cover = img == null ? "" : img.absUrl("src");
            results.add(new SearchResult(title, url, cover));
        }
        return results;
    }

    @Override
    protected ChapterListing chapterListing() {
        return LISTING;
    }
}
