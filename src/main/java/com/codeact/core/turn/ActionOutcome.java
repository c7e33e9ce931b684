package com.codeact.core.turn;

import com.codeact.core.model.ExecutionResult;

import java.util.Optional;

/**
 * Result of running one action.
 *
 * @param result      the execution result, or {@code null} when the runtime could not be launched
 * @param observation text fed back to the model
 */
public record ActionOutcome(
    ExecutionResult result,
    String observation
) {

    public Optional<ExecutionResult> resultIfLaunched() {
        return Optional.ofNullable(result);
    }

    public boolean launched() {
        return result != null;
    }
}
