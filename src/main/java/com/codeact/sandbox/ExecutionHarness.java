package com.codeact.sandbox;

import com.codeact.core.cancellation.CancellationToken;
import com.codeact.core.model.ExecutionRequest;
import com.codeact.core.model.ExecutionResult;

/**
 * Runs a code snippet in an isolated runtime with a hard time limit.
 * Implementations: {@link LocalProcessExecutionHarness} (default),
 * {@link DockerExecutionHarness}.
 * <p>
 * Failures of the code itself (non-zero exit, an exception inside the snippet, a hang)
 * are reported in the {@link ExecutionResult}; they never escape as exceptions.
 */
public interface ExecutionHarness {

    /**
     * Runs the snippet and blocks until it exits, times out or the token is cancelled.
     *
     * @throws RuntimeLaunchException if the runtime itself cannot be started
     */
    ExecutionResult execute(ExecutionRequest request, CancellationToken token);
}
