package com.paxkun.tracker.service;

import com.paxkun.tracker.service.browser.BrowserEngine;
import com.paxkun.tracker.service.browser.BrowserEngineFactory;
import com.paxkun.tracker.service.browser.BrowserPage;
import com.paxkun.tracker.service.scanlator.ScanlatorRegistration;
import com.paxkun.tracker.service.scanlator.ScanlatorRegistry;
import com.paxkun.tracker.service.scanlator.SearchResult;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Exposes the registered scanlator plugins: listing and on-demand title search.
 */
@Service
public class ScanlatorService {

    private static final String TAG = "SCANLATOR";

    private final ScanlatorRegistry registry;
    private final BrowserEngineFactory browserFactory;
    private final LoggerService logger;

    public ScanlatorService(ScanlatorRegistry registry, BrowserEngineFactory browserFactory, LoggerService logger) {
        this.registry = registry;
        this.browserFactory = browserFactory;
        this.logger = logger;
    }

    public List<ScanlatorRegistration> listPlugins() {
        return registry.registrations();
    }

    /**
     * Searches one scanlator site for a title with a short-lived browser.
     *
     * @throws com.paxkun.tracker.service.scanlator.PluginResolutionException for an unknown identifier
     */
    public List<SearchResult> search(String identifier, String title) {
        ScanlatorRegistration registration = registry.require(identifier);
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title must not be blank");
        }

        logger.info(TAG, "🔍 Searching " + registration.displayName() + " for " + LoggerService.sanitizeForLog(title));
        try (BrowserEngine engine = browserFactory.launch();
             BrowserPage page = engine.newPage()) {
            List<SearchResult> results = registration.create(page).search(title);
            logger.info(TAG, "Search on " + registration.displayName() + " returned " + results.size() + " result(s)");
            return results;
        }
    }
}
