package com.codeact.core.resources;

import com.codeact.core.model.CatalogEntry;
import com.codeact.core.model.ResourceCatalog;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads a {@link ResourceCatalog} from a JSON document of the form
 * <pre>
 * { "entries": [ { "name": "...", "description": "...", "category": "tool", "nonCommercial": false } ] }
 * </pre>
 */
@Component
public class CatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

    private final ResourceLoader resourceLoader;
    private final JsonMapper mapper = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .addModule(new ParameterNamesModule())
            .build();

    public CatalogLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    /**
     * @param location a Spring resource location such as {@code classpath:catalog/default-catalog.json}
     */
    public ResourceCatalog load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new CatalogLoadException("Catalog not found at " + location, null);
        }
        try (InputStream in = resource.getInputStream()) {
            return load(in, location);
        } catch (IOException e) {
            throw new CatalogLoadException("Could not read catalog at " + location, e);
        }
    }

    ResourceCatalog load(InputStream in, String description) {
        try {
            CatalogDocument document = mapper.readValue(in, CatalogDocument.class);
            List<CatalogEntry> entries = document.entries() == null ? List.of() : document.entries();
            for (CatalogEntry entry : entries) {
                if (entry.name() == null || entry.name().isBlank() || entry.category() == null) {
                    throw new CatalogLoadException("Catalog entry without name or category in " + description, null);
                }
            }
            var catalog = new ResourceCatalog(entries);
            log.info("Loaded {} catalog entries from {}", catalog.size(), description);
            return catalog;
        } catch (IOException e) {
            throw new CatalogLoadException("Malformed catalog in " + description + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new CatalogLoadException("Invalid catalog in " + description + ": " + e.getMessage(), e);
        }
    }

    record CatalogDocument(List<CatalogEntry> entries) {}
}
