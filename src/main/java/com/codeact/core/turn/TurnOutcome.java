package com.codeact.core.turn;

import java.util.Optional;

/**
 * A full generate-then-execute step.
 *
 * @param action present only when the reply parsed into an action
 */
public record TurnOutcome(
    Generation generation,
    ActionOutcome action
) {

    public Optional<ActionOutcome> actionIfExecuted() {
        return Optional.ofNullable(action);
    }

    /**
     * Observation to append after this turn: the execution report, the parse error, or nothing
     * for a final answer.
     */
    public Optional<String> observation() {
        if (action != null) {
            return Optional.of(action.observation());
        }
        if (!generation.isParsed()) {
            return Optional.of(ObservationFormatter.parseFailure(generation.parseError()));
        }
        return Optional.empty();
    }
}
