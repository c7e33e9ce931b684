package com.codeact.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Author of a {@link Turn} in the task conversation.
 */
public enum TurnRole {
    USER("user"),
    ASSISTANT("assistant"),
    OBSERVATION("observation"),
    SYSTEM("system");

    private final String wireName;

    TurnRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
