package com.codeact.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Record of a finished task run.
 * <p>
 * {@code finalAnswer} is set only for {@link TerminalStatus#DONE}; {@code abortReason}
 * and {@code partialAnswer} only for {@link TerminalStatus#ABORTED}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Transcript(
    String taskId,
    String task,
    TerminalStatus status,
    String finalAnswer,
    AbortReason abortReason,
    String abortDetail,
    String partialAnswer,
    int iterations,
    int critiqueRounds,
    List<String> selectedResources,
    boolean selectionFallback,
    List<Turn> turns,
    Instant startedAt,
    Instant finishedAt
) {

    public Transcript {
        selectedResources = List.copyOf(selectedResources);
        turns = List.copyOf(turns);
    }

    public boolean isDone() {
        return status == TerminalStatus.DONE;
    }
}
