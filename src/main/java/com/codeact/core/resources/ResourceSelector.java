package com.codeact.core.resources;

import com.codeact.core.cancellation.CancellationToken;
import com.codeact.core.cancellation.TaskCancelledException;
import com.codeact.core.llm.LlmService;
import com.codeact.core.model.CatalogEntry;
import com.codeact.core.model.ResourceCatalog;
import com.codeact.core.model.ResourceSelection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * Picks the catalog entries relevant to a task with a single structured model call.
 * <p>
 * Names the model invents are dropped, duplicates collapse and the list is capped.
 * Any failure other than cancellation degrades to the first entries of the catalog,
 * so selection never fails a task.
 */
@Service
public class ResourceSelector {

    private static final Logger log = LoggerFactory.getLogger(ResourceSelector.class);

    private static final String SYSTEM_PROMPT = """
            You select resources for an autonomous agent that solves tasks by writing and running code.
            You are given a task and a catalog of tools, datasets, libraries and knowledge entries.
            Return the names of the entries that are most likely to help with the task,
            most relevant first. Only use names that appear in the catalog, copied exactly.
            Return an empty list when nothing in the catalog is relevant.
            """;

    private final LlmService llmService;

    public ResourceSelector(LlmService llmService) {
        this.llmService = llmService;
    }

    public ResourceSelection select(String task, ResourceCatalog catalog, int limit, CancellationToken token) {
        if (catalog.isEmpty() || limit <= 0) {
            return new ResourceSelection(List.of(), false);
        }
        try {
            ResourceChoice choice = llmService.structuredCall(
                    SYSTEM_PROMPT, buildUserPrompt(task, catalog, limit), ResourceChoice.class, token);
            List<CatalogEntry> ranked = resolve(choice, catalog, limit);
            if (ranked.isEmpty()) {
                log.warn("Resource selection returned no known catalog names, using the first {} entries", limit);
                return ResourceSelection.fallback(catalog, limit);
            }
            log.info("Selected {} of {} catalog entries", ranked.size(), catalog.size());
            return new ResourceSelection(ranked, false);
        } catch (TaskCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Resource selection failed ({}), using the first {} entries", e.getMessage(), limit);
            return ResourceSelection.fallback(catalog, limit);
        }
    }

    static List<CatalogEntry> resolve(ResourceChoice choice, ResourceCatalog catalog, int limit) {
        if (choice == null || choice.names() == null) {
            return List.of();
        }
        var seen = new LinkedHashSet<String>();
        var ranked = new ArrayList<CatalogEntry>();
        for (String name : choice.names()) {
            if (ranked.size() >= limit) {
                break;
            }
            if (name == null) {
                continue;
            }
            String trimmed = name.strip();
            if (seen.add(trimmed)) {
                catalog.find(trimmed).ifPresent(ranked::add);
            }
        }
        return ranked;
    }

    private static String buildUserPrompt(String task, ResourceCatalog catalog, int limit) {
        var sb = new StringBuilder();
        sb.append("Task:\n").append(task).append("\n\n");
        sb.append("Select at most ").append(limit).append(" entries.\n\n");
        sb.append("Catalog:\n");
        for (CatalogEntry entry : catalog.entries()) {
            sb.append("- ").append(entry.name())
              .append(" [").append(entry.category().name().toLowerCase(Locale.ROOT)).append("]: ")
              .append(entry.description() == null ? "" : entry.description())
              .append('\n');
        }
        return sb.toString();
    }
}
