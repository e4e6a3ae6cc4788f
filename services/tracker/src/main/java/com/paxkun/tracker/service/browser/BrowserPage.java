package com.paxkun.tracker.service.browser;

import java.time.Duration;

/**
 * The browser operations a scanlator plugin is allowed to perform on a single page.
 * <p>
 * DOM data is pulled in one batch through {@link #pageSource()} and parsed locally,
 * so every other call here is either a navigation, a wait or an interaction.
 */
public interface BrowserPage extends AutoCloseable {

    /**
     * Loads the given URL.
     *
     * @throws NavigationException if the page cannot be reached within {@code timeout}
     */
    void navigate(String url, Duration timeout);

    /**
     * Waits until at least one element matches the CSS selector.
     *
     * @return false if nothing matched before the timeout
     */
    boolean waitForSelector(String cssSelector, Duration timeout);

    boolean isVisible(String cssSelector);

    /**
     * Clicks the first visible element matching the selector.
     *
     * @return false if no visible element matched
     */
    boolean click(String cssSelector);

    String pageSource();

    String currentUrl();

    @Override
    void close();
}
