package com.codeact.core.cancellation;

/**
 * Thrown when work is abandoned because its task was cancelled.
 */
public class TaskCancelledException extends RuntimeException {

    public TaskCancelledException(String message) {
        super(message);
    }
}
