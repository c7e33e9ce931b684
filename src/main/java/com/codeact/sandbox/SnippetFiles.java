package com.codeact.sandbox;

import com.codeact.core.model.ExecutionRequest;
import com.codeact.core.model.RuntimeKind;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Writes snippet sources under {@code <workDir>/.codeact/}.
 */
final class SnippetFiles {

    static final String SNIPPET_DIR = ".codeact";

    private static final AtomicInteger COUNTER = new AtomicInteger(0);

    private SnippetFiles() {}

    /**
     * @return path of the written script, relative to {@code workDir}
     * @throws SnippetSetupException if the script cannot be written
     */
    static Path write(Path workDir, ExecutionRequest request) {
        String fileName = "snippet-" + COUNTER.incrementAndGet() + request.runtime().scriptExtension();
        Path relative = Path.of(SNIPPET_DIR, fileName);
        Path script = workDir.resolve(relative);
        try {
            Files.createDirectories(script.getParent());
            Files.writeString(script, request.source(), StandardCharsets.UTF_8);
            return relative;
        } catch (IOException e) {
            throw new SnippetSetupException(request.runtime(),
                    "Could not write the snippet to " + script + ": " + describe(e), e);
        }
    }

    /**
     * Creates a per-call scratch directory for snippets run without a pinned directory.
     */
    static Path scratchDirectory(RuntimeKind runtime) {
        try {
            return ScratchDirectories.create(null, "codeact-exec-");
        } catch (UncheckedIOException e) {
            throw new SnippetSetupException(runtime,
                    "Could not create a scratch directory: " + describe(e.getCause()), e);
        }
    }

    private static String describe(IOException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + " " + e.getMessage();
    }
}
