package com.codeact.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for task events.
 * <p>
 * Supports per-task subscriptions and global subscriptions. A subscriber that throws
 * is logged and skipped; it never affects the publishing task.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-task subscribers keyed by taskId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<AgentEvent>>> taskSubscribers =
            new ConcurrentHashMap<>();

    /** Subscribers that receive events from every task. */
    private final CopyOnWriteArrayList<Consumer<AgentEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    /**
     * Delivers an event to the subscribers of its task, then to the global subscribers.
     *
     * @param event the event to publish
     */
    public void publish(AgentEvent event) {
        log.debug("Publishing event: {} for task {}", event.eventType(), event.taskId());

        List<Consumer<AgentEvent>> subs = taskSubscribers.get(event.taskId());
        if (subs != null) {
            for (Consumer<AgentEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<AgentEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to the events of one task. The entry for the task is dropped once its
     * last subscriber unsubscribes.
     *
     * @param taskId   the task to follow
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String taskId, Consumer<AgentEvent> consumer) {
        taskSubscribers.computeIfAbsent(taskId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> taskSubscribers.computeIfPresent(taskId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    /**
     * Subscribe to events from all tasks.
     *
     * @param consumer callback invoked for each event regardless of task
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<AgentEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<AgentEvent> subscriber, AgentEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}", event.eventType(), e.getMessage(), e);
        }
    }
}
