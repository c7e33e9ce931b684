package com.codeact.core.cancellation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the cancellation token of every running task so graph nodes can
 * look it up by task id and callers can cancel a task from outside the run.
 */
@Component
public class ActiveTaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActiveTaskRegistry.class);

    private final ConcurrentHashMap<String, CancellationToken> tokens = new ConcurrentHashMap<>();

    public CancellationToken register(String taskId) {
        var token = new CancellationToken();
        if (tokens.putIfAbsent(taskId, token) != null) {
            throw new IllegalStateException("Task " + taskId + " is already running");
        }
        return token;
    }

    public void unregister(String taskId) {
        tokens.remove(taskId);
    }

    /**
     * Token for a running task, or the never-cancelled token for unknown ids.
     */
    public CancellationToken tokenFor(String taskId) {
        CancellationToken token = tokens.get(taskId);
        return token != null ? token : CancellationToken.none();
    }

    /**
     * @return true if a running task with that id was signalled
     */
    public boolean cancel(String taskId) {
        CancellationToken token = tokens.get(taskId);
        if (token == null) {
            return false;
        }
        log.info("Cancelling task {}", taskId);
        token.cancel();
        return true;
    }

    public Set<String> activeTaskIds() {
        return Set.copyOf(tokens.keySet());
    }
}
