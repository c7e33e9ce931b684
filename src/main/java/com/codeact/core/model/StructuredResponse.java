package com.codeact.core.model;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed model output. Exactly one of {@link #action()} or {@link #finalAnswer()}
 * is present, selected by {@link #kind()}; malformed output never reaches this type.
 */
public record StructuredResponse(
    Kind kind,
    String reasoning,
    Action action,
    String finalAnswer,
    int ignoredActions
) implements Serializable {

    public enum Kind {
        ACTION,
        FINAL_ANSWER
    }

    public StructuredResponse {
        Objects.requireNonNull(kind, "kind");
        reasoning = reasoning == null ? "" : reasoning;
        if (kind == Kind.ACTION && (action == null || finalAnswer != null)) {
            throw new IllegalArgumentException("An action response carries an action and no final answer");
        }
        if (kind == Kind.FINAL_ANSWER && (finalAnswer == null || action != null)) {
            throw new IllegalArgumentException("A final-answer response carries a final answer and no action");
        }
    }

    public static StructuredResponse action(String reasoning, Action action, int ignoredActions) {
        return new StructuredResponse(Kind.ACTION, reasoning, action, null, ignoredActions);
    }

    public static StructuredResponse finalAnswer(String reasoning, String answer) {
        return new StructuredResponse(Kind.FINAL_ANSWER, reasoning, null, answer, 0);
    }

    public boolean isAction() {
        return kind == Kind.ACTION;
    }

    public Optional<Action> actionIfPresent() {
        return Optional.ofNullable(action);
    }

    public Optional<String> finalAnswerIfPresent() {
        return Optional.ofNullable(finalAnswer);
    }
}
