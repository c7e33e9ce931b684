package com.codeact.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a task runs.
 *
 * @param eventType e.g. "task.started", "action.executed", "task.aborted"
 * @param taskId    the task this event belongs to
 * @param payload   event-specific data
 * @param timestamp when the event occurred
 */
public record AgentEvent(
    String eventType,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static AgentEvent of(String eventType, String taskId, Map<String, Object> payload) {
        return new AgentEvent(eventType, taskId, payload, Instant.now());
    }
}
