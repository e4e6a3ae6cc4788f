package com.paxkun.tracker.service.scanlator;

import com.paxkun.tracker.service.browser.BrowserPage;
import com.paxkun.tracker.service.browser.NavigationException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Chapter extraction shared by all scanlator plugins.
 * <p>
 * Navigates to the work page, waits for the listing, reveals paginated entries with a bounded
 * "load more" loop, pulls the DOM once and parses it with Jsoup. Entries come back sorted by
 * (numeric chapter value, publication date) whatever the order on the page.
 * <p>
 * Author: Pax
 */
@Slf4j
public class ChapterExtractor {

    static final Comparator<ScannedChapter> OLDEST_FIRST = Comparator
            .comparingDouble(ScannedChapter::numericValue)
            .thenComparing(ScannedChapter::publishedAt, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final ExtractionSettings settings;
    private final ChapterDateParser dateParser;

    public ChapterExtractor(ExtractionSettings settings, ChapterDateParser dateParser) {
        this.settings = settings;
        this.dateParser = dateParser;
    }

    /**
     * Runs the full protocol against one work page.
     *
     * @param numberParser the plugin's chapter number normalization
     * @param sourceName   used as log prefix
     * @return chapters oldest first; empty on navigation or extraction failure
     */
    public List<ScannedChapter> extract(BrowserPage page,
                                        String workUrl,
                                        ChapterListing listing,
                                        UnaryOperator<String> numberParser,
                                        String sourceName) {
        log.info("[{}] Extracting chapters from: {}", sourceName, workUrl);

        try {
            if (!open(page, workUrl, listing.containerSelector(), sourceName)) {
                log.error("[{}] ❌ Chapter list did not appear on {}", sourceName, workUrl);
                return List.of();
            }

            if (listing.expandSelector() != null && page.isVisible(listing.expandSelector())) {
                log.debug("[{}] Clicking expand control '{}'", sourceName, listing.expandSelector());
                page.click(listing.expandSelector());
                pause(settings.settleDelay());
            }

            int clicks = revealAll(page, listing.loadMoreSelector(), sourceName);
            if (clicks > 0) {
                log.debug("[{}] Revealed more chapters with {} clicks", sourceName, clicks);
            }

            Document document = snapshot(page);
            List<ScannedChapter> chapters = parseEntries(document, listing, numberParser, sourceName);
            chapters.sort(OLDEST_FIRST);

            log.info("[{}] Extracted {} chapters", sourceName, chapters.size());
            return chapters;
        } catch (NavigationException e) {
            log.error("[{}] ❌ {}", sourceName, e.getMessage());
            return List.of();
        } catch (RuntimeException e) {
            log.error("[{}] ❌ Error extracting chapters from {}: {}", sourceName, workUrl, e.getMessage(), e);
            return List.of();
        }
    }

    /**
     * Navigates and waits for {@code readySelector}.
     *
     * @return false when navigation failed or the selector never appeared
     */
    public boolean open(BrowserPage page, String url, String readySelector, String sourceName) {
        log.debug("[{}] Navigating to: {}", sourceName, url);
        try {
            page.navigate(url, settings.navigationTimeout());
        } catch (NavigationException e) {
            log.error("[{}] ❌ {}", sourceName, e.getMessage());
            return false;
        }
        return page.waitForSelector(readySelector, settings.selectorTimeout());
    }

    /**
     * Single batch read of the page's current DOM.
     */
    public Document snapshot(BrowserPage page) {
        return Jsoup.parse(page.pageSource(), page.currentUrl());
    }

    /**
     * Clicks the "load more" control while it stays visible, at most
     * {@link ExtractionSettings#maxRevealClicks()} times.
     *
     * @return number of clicks performed
     */
    int revealAll(BrowserPage page, String loadMoreSelector, String sourceName) {
        if (loadMoreSelector == null) {
            return 0;
        }

        int clicks = 0;
        while (page.isVisible(loadMoreSelector)) {
            if (clicks >= settings.maxRevealClicks()) {
                log.warn("[{}] ⚠️ 'Load more' still visible after {} clicks, extracting what is loaded",
                        sourceName, clicks);
                break;
            }
            if (!page.click(loadMoreSelector)) {
                break;
            }
            clicks++;
            if (!pause(settings.settleDelay())) {
                break;
            }
        }
        return clicks;
    }

    private List<ScannedChapter> parseEntries(Document document,
                                              ChapterListing listing,
                                              UnaryOperator<String> numberParser,
                                              String sourceName) {
        Elements entries = document.select(listing.entrySelector());
        log.debug("[{}] Raw chapter entries on page: {}", sourceName, entries.size());

        List<ScannedChapter> chapters = new ArrayList<>();
        Set<String> seenUrls = new HashSet<>();
        int index = -1;
        for (Element entry : entries) {
            index++;
            try {
                Element link = listing.linkSelector() == null ? entry : entry.selectFirst(listing.linkSelector());
                if (link == null) {
                    continue;
                }

                String href = link.attr("href").trim();
                if (href.isEmpty()) {
                    continue;
                }
                String url = link.absUrl("href");
                if (url.isEmpty()) {
                    url = href;
                }
                if (!seenUrls.add(url)) {
                    continue;
                }

                String title = textOf(entry, listing.titleSelector());
                if (title.isEmpty()) {
                    title = link.text().trim();
                }
                String dateText = textOf(entry, listing.dateSelector());
                if (dateText.isEmpty()) {
                    dateText = dateParser.findDateText(entry.text());
                }

                String number = numberParser.apply(title);
                LocalDateTime publishedAt = dateParser.parse(dateText);
                chapters.add(new ScannedChapter(number, title, url, publishedAt));
            } catch (RuntimeException e) {
                log.warn("[{}] ⚠️ Failed to parse chapter entry at index {}: {}", sourceName, index, e.getMessage());
            }
        }
        return chapters;
    }

    private String textOf(Element entry, String selector) {
        if (selector == null) {
            return "";
        }
        Element element = entry.selectFirst(selector);
        return element == null ? "" : element.text().trim();
    }

    private boolean pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
