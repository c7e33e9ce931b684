package com.codeact.core.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, insertion-ordered catalog of resources keyed by name.
 * Shared read-only between all tasks.
 */
public final class ResourceCatalog {

    private final Map<String, CatalogEntry> entries;

    public ResourceCatalog(Collection<CatalogEntry> entries) {
        var byName = new LinkedHashMap<String, CatalogEntry>();
        for (CatalogEntry entry : entries) {
            if (byName.putIfAbsent(entry.name(), entry) != null) {
                throw new IllegalArgumentException("Duplicate catalog entry: " + entry.name());
            }
        }
        this.entries = byName;
    }

    public static ResourceCatalog empty() {
        return new ResourceCatalog(List.of());
    }

    public Optional<CatalogEntry> find(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    /** Entries in catalog order. */
    public List<CatalogEntry> entries() {
        return List.copyOf(entries.values());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Catalog restricted to entries that may be used commercially.
     */
    public ResourceCatalog withoutNonCommercial() {
        return new ResourceCatalog(entries.values().stream()
                .filter(entry -> !entry.nonCommercial())
                .toList());
    }
}
