package com.paxkun.tracker.service.scanlator;

/**
 * Thrown when a scanlator's implementation key has no registered plugin.
 */
public class PluginResolutionException extends RuntimeException {

    public PluginResolutionException(String identifier) {
        super("No scanlator plugin registered for identifier '" + identifier + "'");
    }
}
