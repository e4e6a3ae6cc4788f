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
 * Madara Scans (madarascans.com).
 * <p>
 * Uses the Madara WordPress theme, which renders the first chapters only and appends the rest
 * each time "Show more" is clicked.
 */
public class MadaraScans extends AbstractScanlator {

    public static final String IDENTIFIER = "MadaraScans";
    public static final String DISPLAY_NAME = "Madara Scans";
    public static final String BASE_URL = "https://madarascans.com";

    private static final ChapterListing LISTING = ChapterListing.builder()
            .containerSelector("li.wp-manga-chapter")
            .entrySelector("li.wp-manga-chapter")
            .linkSelector("a[href]")
            .dateSelector(".chapter-release-date")
            .loadMoreSelector(".chapter-readmore")
            .build();

    public MadaraScans(BrowserPage page, ChapterExtractor extractor) {
        super(page, extractor, DISPLAY_NAME);
    }

    public static ScanlatorRegistration registration(ChapterExtractor extractor) {
        return new ScanlatorRegistration(IDENTIFIER, DISPLAY_NAME, BASE_URL,
                page -> new MadaraScans(page, extractor));
    }

    @Override
    protected String searchUrl(String title) {
        return BASE_URL + "/?s=" + URLEncoder.encode(title, StandardCharsets.UTF_8) + "&post_type=wp-manga";
    }

    @Override
    protected String searchResultSelector() {
        return ".c-tabs-item__content, .search-wrap";
    }

    @Override
    protected List<SearchResult> parseSearchResults(Document document) {
        List<SearchResult> results = new ArrayList<>();
        for (Element item : document.select(".c-tabs-item__content")) {
            Element link = item.selectFirst(".post-title a[href]");
            if (link == null) {
                continue;
            }
            String url = link.absUrl("href");
            String title = link.text().trim();
            if (url.isEmpty() || title.isEmpty()) {
                continue;
            }
            Element img = item.selectFirst("img");
            String cover = "";
            if (img != null) {
                cover = img.hasAttr("data-src") ? img.absUrl("data-src") : img.absUrl("src");
            }
            results.add(new SearchResult(title, url, cover));
        }
        return results;
    }

    @Override
    protected ChapterListing chapterListing() {
        return LISTING;
    }
}
