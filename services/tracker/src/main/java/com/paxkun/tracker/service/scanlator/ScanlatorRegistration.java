package com.paxkun.tracker.service.scanlator;

import com.paxkun.tracker.service.browser.BrowserPage;

import java.util.Objects;

/**
 * Registry entry for one scanlator plugin.
 *
 * @param identifier  implementation key stored on the scanlator row
 * @param displayName human-readable site name
 * @param baseUrl     site root
 * @param factory     plugin constructor
 */
public record ScanlatorRegistration(String identifier, String displayName, String baseUrl, ScanlatorFactory factory) {

    public ScanlatorRegistration {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(factory, "factory");
        displayName = displayName == null || displayName.isBlank() ? identifier : displayName;
    }

    public ScanlatorPlugin create(BrowserPage page) {
        return factory.create(page);
    }
}
