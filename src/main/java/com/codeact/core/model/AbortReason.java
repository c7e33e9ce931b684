package com.codeact.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a task stopped without a final answer.
 */
public enum AbortReason {
    ITERATION_LIMIT("iteration_limit"),
    PROVIDER_FATAL("provider_fatal"),
    PARSE_EXHAUSTED("parse_exhausted"),
    CANCELLED("cancelled");

    private final String code;

    AbortReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
