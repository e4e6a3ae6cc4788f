package com.paxkun.tracker.service.scanlator;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup table from implementation key to plugin factory.
 * <p>
 * Filled once from the plugins' own {@code registration(...)} calls and read-only afterwards,
 * so concurrent lookups need no locking. A key with no entry is not an error here; it surfaces
 * when a tracking job tries to resolve it.
 * <p>
 * Author: Pax
 */
@Slf4j
public class ScanlatorRegistry {

    private final Map<String, ScanlatorRegistration> registrations;

    public ScanlatorRegistry(Collection<ScanlatorRegistration> entries) {
        Map<String, ScanlatorRegistration> table = new LinkedHashMap<>();
        for (ScanlatorRegistration entry : entries) {
            ScanlatorRegistration previous = table.putIfAbsent(entry.identifier(), entry);
            if (previous != null) {
                throw new IllegalStateException("Duplicate scanlator identifier: " + entry.identifier());
            }
            log.info("Registered scanlator plugin: {} ({})", entry.identifier(), entry.displayName());
        }
        this.registrations = Collections.unmodifiableMap(table);
        log.info("Scanlator registry ready with {} plugin(s)", registrations.size());
    }

    /**
     * Exact, case-sensitive lookup.
     */
    public Optional<ScanlatorRegistration> resolve(String identifier) {
        if (identifier == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(registrations.get(identifier));
    }

    public ScanlatorRegistration require(String identifier) {
        return resolve(identifier).orElseThrow(() -> new PluginResolutionException(identifier));
    }

    public List<ScanlatorRegistration> registrations() {
        return List.copyOf(registrations.values());
    }
}
