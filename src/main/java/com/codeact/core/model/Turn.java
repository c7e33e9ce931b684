package com.codeact.core.model;

import java.io.Serializable;

/**
 * One entry in the append-only conversation of a task.
 * The index is unique and increasing within a task.
 */
public record Turn(
    TurnRole role,
    String content,
    int index
) implements Serializable {

    public static Turn user(String content, int index) {
        return new Turn(TurnRole.USER, content, index);
    }

    public static Turn assistant(String content, int index) {
        return new Turn(TurnRole.ASSISTANT, content, index);
    }

    public static Turn observation(String content, int index) {
        return new Turn(TurnRole.OBSERVATION, content, index);
    }
}
