package com.codeact.core.llm;

/**
 * Thrown when the model provider fails a call.
 * <p>
 * Transient failures are retried inside {@link LlmService}; one that escapes it has
 * exhausted its retries or was never retryable (bad credentials, exhausted quota).
 */
public class LlmProviderException extends RuntimeException {

    private final ProviderErrorKind kind;
    private final boolean transientFailure;

    public LlmProviderException(ProviderErrorKind kind, boolean transientFailure, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.transientFailure = transientFailure;
    }

    public ProviderErrorKind kind() {
        return kind;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
