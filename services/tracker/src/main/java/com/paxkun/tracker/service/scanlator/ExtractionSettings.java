package com.paxkun.tracker.service.scanlator;

import java.time.Duration;

/**
 * Tunables for the chapter extraction protocol.
 *
 * @param maxRevealClicks   upper bound on "load more" clicks per page
 * @param settleDelay       pause after each reveal click
 * @param navigationTimeout page load timeout
 * @param selectorTimeout   wait-for-selector timeout
 */
public record ExtractionSettings(
        int maxRevealClicks,
        Duration settleDelay,
        Duration navigationTimeout,
        Duration selectorTimeout) {
}
