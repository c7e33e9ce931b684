package com.codeact.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Request to run one snippet.
 *
 * @param workingDirectory directory to run in, or {@code null} for a fresh scratch directory
 */
public record ExecutionRequest(
    RuntimeKind runtime,
    String source,
    Duration timeout,
    Path workingDirectory
) {

    public ExecutionRequest {
        Objects.requireNonNull(runtime, "runtime");
        Objects.requireNonNull(source, "source");
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public static ExecutionRequest of(Action action, Duration timeout, Path workingDirectory) {
        return new ExecutionRequest(action.runtime(), action.source(), timeout, workingDirectory);
    }
}
