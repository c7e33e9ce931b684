package com.codeact.core.cancellation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared by everything working on one task.
 * <p>
 * Blocking collaborators register a callback with {@link #onCancel(Runnable)} to tear
 * down what they are waiting on (a child process, a container, an in-flight model call).
 */
public class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("The shared no-op token cannot be cancelled");
        }
    };

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);
    private final CopyOnWriteArrayList<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * A token that is never cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            latch.countDown();
            for (Runnable listener : listeners) {
                runSafely(listener);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new TaskCancelledException("Task was cancelled");
        }
    }

    /**
     * Registers a callback run once on cancellation, or immediately if already cancelled.
     *
     * @return handle that removes the callback
     */
    public Registration onCancel(Runnable listener) {
        listeners.add(listener);
        if (isCancelled() && listeners.remove(listener)) {
            runSafely(listener);
        }
        return () -> listeners.remove(listener);
    }

    /**
     * Sleeps for up to {@code duration}, returning early when cancelled.
     *
     * @return true if the token was cancelled before the duration elapsed
     */
    public boolean awaitCancellation(Duration duration) {
        try {
            return latch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskCancelledException("Interrupted while waiting");
        }
    }

    private void runSafely(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Handle for removing a cancellation callback.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        void remove();

        @Override
        default void close() {
            remove();
        }
    }
}
