package com.codeact.core.prompt;

import com.codeact.core.model.CatalogEntry;
import com.codeact.core.model.PromptPayload;
import com.codeact.core.model.ResourceCategory;
import com.codeact.core.model.ResourceSelection;
import com.codeact.core.model.RuntimeKind;
import com.codeact.core.model.Turn;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Builds the prompt for each generation from the task's selected resources and the
 * conversation so far. Pure: identical inputs give byte-identical payloads, with
 * resources ordered by category and then by name regardless of selection rank.
 */
@Component
public class PromptAssembler {

    static final String INSTRUCTIONS = """
            You are an autonomous research assistant that solves tasks by writing and running code.
            Work in small steps. In every reply, think first and then do exactly one of the following:

            1. Run code, by writing one block of the form
               <execute runtime="RUNTIME">
               ...code...
               </execute>
               The result is returned to you in an <observation> message.
            2. Give the final answer, by writing
               <solution>
               ...answer...
               </solution>

            Put your reasoning in a <think>...</think> block before the action or solution.
            Never put an <execute> block and a <solution> block in the same reply.
            Only the first <execute> block of a reply is run.

            Runtimes:
            %s
            Files you write persist in the working directory for the rest of the task.
            """;

    private static final Map<RuntimeKind, String> RUNTIME_DESCRIPTIONS = Map.of(
            RuntimeKind.GENERAL_PURPOSE, "Python 3 script",
            RuntimeKind.STATISTICAL, "R script run with Rscript",
            RuntimeKind.SHELL, "bash script");

    private static final Comparator<CatalogEntry> PROMPT_ORDER = Comparator
            .comparing(CatalogEntry::category)
            .thenComparing(CatalogEntry::name);

    public PromptPayload assemble(ResourceSelection selection, List<Turn> history) {
        return new PromptPayload(systemPrompt(selection), history);
    }

    String systemPrompt(ResourceSelection selection) {
        var sb = new StringBuilder(String.format(INSTRUCTIONS, runtimeList()));
        if (selection.entries().isEmpty()) {
            sb.append("\nNo additional resources were selected for this task.\n");
            return sb.toString();
        }
        Map<ResourceCategory, List<CatalogEntry>> byCategory = selection.entries().stream()
                .sorted(PROMPT_ORDER)
                .collect(Collectors.groupingBy(CatalogEntry::category, TreeMap::new, Collectors.toList()));
        sb.append("\nThe following resources are available for this task.\n");
        byCategory.forEach((category, entries) -> {
            sb.append("\n## ").append(category.heading()).append('\n');
            for (CatalogEntry entry : entries) {
                sb.append("- ").append(entry.name());
                if (entry.description() != null && !entry.description().isBlank()) {
                    sb.append(": ").append(entry.description().strip());
                }
                sb.append('\n');
            }
        });
        return sb.toString();
    }

    private static String runtimeList() {
        var sb = new StringBuilder();
        for (RuntimeKind kind : RuntimeKind.values()) {
            sb.append("- ").append(kind.tag()).append(": ").append(RUNTIME_DESCRIPTIONS.get(kind)).append('\n');
        }
        return sb.toString();
    }
}
