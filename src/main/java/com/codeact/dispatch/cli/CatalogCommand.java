package com.codeact.dispatch.cli;

import com.codeact.core.model.CatalogEntry;
import com.codeact.core.model.ResourceCatalog;
import com.codeact.core.model.ResourceCategory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * CLI command: codeact catalog
 * <p>
 * Lists the loaded resource catalog grouped by category.
 */
@Command(name = "catalog", mixinStandardHelpOptions = true, description = "List the resource catalog",
        exitCodeOnInvalidInput = CodeActCommand.EXIT_USAGE)
@Component
public class CatalogCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = {"--category", "-c"}, description = "Only this category: tool, dataset, library, knowledge")
    private String category;

    private final ResourceCatalog catalog;

    public CatalogCommand(ResourceCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public Integer call() {
        List<ResourceCategory> categories = category == null
                ? Arrays.asList(ResourceCategory.values())
                : List.of(parseCategory(category));

        ConsoleOutput.printBanner();
        if (catalog.isEmpty()) {
            ConsoleOutput.info("The catalog is empty.");
            return CodeActCommand.EXIT_DONE;
        }
        for (ResourceCategory c : categories) {
            List<CatalogEntry> entries = catalog.entries().stream()
                    .filter(e -> e.category() == c)
                    .toList();
            if (entries.isEmpty()) {
                continue;
            }
            ConsoleOutput.info(c.heading() + " (" + entries.size() + ")");
            entries.forEach(ConsoleOutput::catalogEntry);
        }
        return CodeActCommand.EXIT_DONE;
    }

    private ResourceCategory parseCategory(String raw) {
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (ResourceCategory c : ResourceCategory.values()) {
            if (c.name().equals(normalized) || c.heading().toUpperCase(Locale.ROOT).equals(normalized)) {
                return c;
            }
        }
        throw new ParameterException(spec.commandLine(), "Unknown category: " + raw
                + ". Valid categories: tool, dataset, library, knowledge");
    }
}
