package com.codeact.core.llm;

/**
 * Coarse classification of a failed model call.
 */
public enum ProviderErrorKind {
    AUTHENTICATION,
    RATE_LIMIT,
    QUOTA,
    NETWORK,
    TIMEOUT,
    UNKNOWN
}
