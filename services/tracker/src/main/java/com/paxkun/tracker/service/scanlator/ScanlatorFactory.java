package com.paxkun.tracker.service.scanlator;

import com.paxkun.tracker.service.browser.BrowserPage;

/**
 * Builds a plugin instance bound to one browser page.
 */
@FunctionalInterface
public interface ScanlatorFactory {
    ScanlatorPlugin create(BrowserPage page);
}
