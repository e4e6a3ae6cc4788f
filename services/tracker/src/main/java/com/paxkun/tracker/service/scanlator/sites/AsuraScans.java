package com.paxkun.tracker.service.scanlator.sites;

import com.paxkun.tracker.service.browser.BrowserPage;
import com.paxkun.tracker.service.scanlator.AbstractScanlator;
import com.paxkun.tracker.service.scanlator.ChapterExtractor;
import com.paxkun.tracker.service.scanlator.ChapterListing;
import com.paxkun.tracker.service.scanlator.ChapterNumberParser;
import com.paxkun.tracker.service.scanlator.ScanlatorRegistration;
import com.paxkun.tracker.service.scanlator.SearchResult;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Asura Scans (asuracomic.net).
 * <p>
 * The series page opens on a filtered chapter tab; the "All" tab is clicked first. Dates are not
 * in their own element and are picked out of each entry's text.
 */
public class AsuraScans extends AbstractScanlator {

    public static final String IDENTIFIER = "AsuraScans";
    public static final String DISPLAY_NAME = "Asura Scans";
    public static final String BASE_URL = "https://asuracomic.net";

    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Set<String> GENRE_TAGS = Set.of("MANHWA", "MANGA", "MANHUA", "WEBTOON");

    private static final ChapterListing LISTING = ChapterListing.builder()
            .containerSelector("a[href*='/chapter/']")
            .entrySelector("a[href*='/chapter/']")
            .titleSelector("h3")
            .expandSelector("[role=tab][id$=trigger-all]")
            .build();

    public AsuraScans(BrowserPage page, ChapterExtractor extractor) {
        super(page, extractor, DISPLAY_NAME);
    }

    public static ScanlatorRegistration registration(ChapterExtractor extractor) {
        return new ScanlatorRegistration(IDENTIFIER, DISPLAY_NAME, BASE_URL,
                page -> new AsuraScans(page, extractor));
    }

    /**
     * Asura labels its opening chapter "First Chapter". Labels carrying a number keep it.
     */
    @Override
    public String parseChapterNumber(String rawText) {
        if (rawText != null
                && rawText.toLowerCase(Locale.ROOT).contains("first")
                && !DIGIT.matcher(rawText).find()) {
            return "1";
        }
        return ChapterNumberParser.parse(rawText);
    }

    @Override
    protected String searchUrl(String title) {
        return BASE_URL + "/series?name=" + URLEncoder.encode(title, StandardCharsets.UTF_8);
    }

    @Override
    protected String searchResultSelector() {
        return ".grid";
    }

    @Override
    protected List<SearchResult> parseSearchResults(Document document) {
        List<SearchResult> results = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Element item : document.select(".grid a[href*='series/']")) {
            String url = item.absUrl("href");
            if (url.isEmpty() || !seen.add(url)) {
                continue;
            }
            String title = titleOf(item);
            if (title.isEmpty()) {
                continue;
            }
            Element img = item.selectFirst("img");
            String cover = img == null ? "" : img.absUrl("src");
            results.add(new SearchResult(title, url, cover));
        }
        return results;
    }

    private String titleOf(Element item) {
        for (Element candidate : item.select("h3, span")) {
            String text = candidate.text().trim();
            if (text.length() > 2 && !GENRE_TAGS.contains(text.toUpperCase(Locale.ROOT))) {
                return text;
            }
        }
        return "";
    }

    @Override
    protected ChapterListing chapterListing() {
        return LISTING;
    }
}
