package com.codeact.core.engine;

import com.codeact.core.model.Transcript;

import java.util.concurrent.CompletableFuture;

/**
 * Handle for a task submitted to run in the background.
 */
public record RunningTask(
    String taskId,
    CompletableFuture<Transcript> result
) {}
