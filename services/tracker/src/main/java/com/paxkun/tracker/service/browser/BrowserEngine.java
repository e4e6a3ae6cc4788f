package com.paxkun.tracker.service.browser;

/**
 * A running browser instance. One engine is acquired per tracking job and
 * hands out one {@link BrowserPage} per scanlator mapping.
 */
public interface BrowserEngine extends AutoCloseable {

    /**
     * Opens a fresh page (tab) in this browser.
     */
    BrowserPage newPage();

    /**
     * Shuts the browser down. Never throws.
     */
    @Override
    void close();
}
