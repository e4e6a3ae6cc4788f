package com.paxkun.tracker.service.scanlator;

import com.paxkun.tracker.service.browser.BrowserPage;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;

import java.util.List;

/**
 * Base for HTML-driven scanlator plugins. Subclasses describe their pages with selectors;
 * navigation, error handling and normalization live here and in {@link ChapterExtractor}.
 */
@Slf4j
public abstract class AbstractScanlator implements ScanlatorPlugin {

    protected final BrowserPage page;
    protected final ChapterExtractor extractor;
    private final String displayName;

    protected AbstractScanlator(BrowserPage page, ChapterExtractor extractor, String displayName) {
        this.page = page;
        this.extractor = extractor;
        this.displayName = displayName;
    }

    @Override
    public List<SearchResult> search(String title) {
        if (title == null || title.isBlank()) {
            return List.of();
        }

        log.info("[{}] 🔍 Searching for: {}", displayName, title);
        try {
            if (!extractor.open(page, searchUrl(title.trim()), searchResultSelector(), displayName)) {
                log.warn("[{}] ⚠️ No search results rendered for '{}'", displayName, title);
                return List.of();
            }
            List<SearchResult> results = parseSearchResults(extractor.snapshot(page));
            log.info("[{}] Found {} results for '{}'", displayName, results.size(), title);
            return results;
        } catch (RuntimeException e) {
            log.error("[{}] ❌ Error searching for '{}': {}", displayName, title, e.getMessage(), e);
            return List.of();
        }
    }

    @Override
    public List<ScannedChapter> extractChapters(String workUrl) {
        return extractor.extract(page, workUrl, chapterListing(), this::parseChapterNumber, displayName);
    }

    @Override
    public String parseChapterNumber(String rawText) {
        return ChapterNumberParser.parse(rawText);
    }

    protected abstract String searchUrl(String title);

    /**
     * Selector whose presence means search results have rendered.
     */
    protected abstract String searchResultSelector();

    protected abstract List<SearchResult> parseSearchResults(Document document);

    protected abstract ChapterListing chapterListing();
}
