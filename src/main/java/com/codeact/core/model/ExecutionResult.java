package com.codeact.core.model;

import java.io.Serializable;

/**
 * Outcome of one snippet execution.
 * <p>
 * A non-zero exit with {@code killed == false} means the code failed on its own;
 * {@code killed == true} means the harness terminated it (timeout or cancellation)
 * and {@link #exitStatus()} is {@link #KILLED_EXIT_STATUS}.
 */
public record ExecutionResult(
    String stdout,
    String stderr,
    int exitStatus,
    long durationMs,
    boolean timedOut,
    boolean killed,
    boolean outputTruncated
) implements Serializable {

    /** 128 + SIGKILL. */
    public static final int KILLED_EXIT_STATUS = 137;

    public boolean succeeded() {
        return exitStatus == 0 && !killed;
    }
}
