package com.paxkun.tracker.service.browser;

/**
 * Raised when a page cannot be loaded (timeout, unreachable host, dead browser session).
 */
public class NavigationException extends RuntimeException {

    public NavigationException(String message) {
        super(message);
    }

    public NavigationException(String message, Throwable cause) {
        super(message, cause);
    }
}
