package com.codeact.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Ranked subset of the catalog chosen for one task.
 *
 * @param fallback true when the subset is the catalog prefix rather than a model ranking
 */
public record ResourceSelection(
    List<CatalogEntry> entries,
    boolean fallback
) implements Serializable {

    public ResourceSelection {
        entries = List.copyOf(entries);
    }

    /**
     * The first {@code limit} entries in catalog order.
     */
    public static ResourceSelection fallback(ResourceCatalog catalog, int limit) {
        List<CatalogEntry> all = catalog.entries();
        return new ResourceSelection(all.subList(0, Math.min(Math.max(limit, 0), all.size())), true);
    }

    public List<String> names() {
        return entries.stream().map(CatalogEntry::name).toList();
    }
}
