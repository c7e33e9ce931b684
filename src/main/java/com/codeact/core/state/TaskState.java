package com.codeact.core.state;

import com.codeact.core.model.AbortReason;
import com.codeact.core.model.Action;
import com.codeact.core.model.AgentPhase;
import com.codeact.core.model.CatalogEntry;
import com.codeact.core.model.CritiqueVerdict;
import com.codeact.core.model.ResourceSelection;
import com.codeact.core.model.Turn;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for one task run.
 * <p>
 * The conversation uses an appender channel: nodes return the new turns only.
 * Every other field is a scalar overwritten by the node that owns it.
 */
public class TaskState extends AgentState {

    public static final String TASK_ID = "taskId";
    public static final String TASK = "task";
    public static final String WORKING_DIRECTORY = "workingDirectory";
    public static final String PHASE = "phase";
    public static final String ITERATION = "iteration";
    public static final String PARSE_FAILURES = "parseFailures";
    public static final String CRITIQUE_ROUNDS = "critiqueRounds";
    public static final String TURNS = "turns";
    public static final String SELECTED_RESOURCES = "selectedResources";
    public static final String SELECTION_FALLBACK = "selectionFallback";
    public static final String PENDING_ACTION = "pendingAction";
    public static final String IGNORED_ACTIONS = "ignoredActions";
    public static final String PROPOSED_ANSWER = "proposedAnswer";
    public static final String LAST_REASONING = "lastReasoning";
    public static final String FINAL_ANSWER = "finalAnswer";
    public static final String PARTIAL_ANSWER = "partialAnswer";
    public static final String ABORT_REASON = "abortReason";
    public static final String ABORT_DETAIL = "abortDetail";
    public static final String LAST_VERDICT = "lastVerdict";

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Task identity ────────────────────────────────────────────
        Map.entry(TASK_ID,            Channels.base(() -> "")),
        Map.entry(TASK,               Channels.base(() -> "")),
        Map.entry(WORKING_DIRECTORY,  Channels.base(() -> "")),

        // ── Loop control ─────────────────────────────────────────────
        Map.entry(PHASE,              Channels.base(() -> AgentPhase.GENERATE.name())),
        Map.entry(ITERATION,          Channels.base(() -> 0)),
        Map.entry(PARSE_FAILURES,     Channels.base(() -> 0)),
        Map.entry(CRITIQUE_ROUNDS,    Channels.base(() -> 0)),

        // ── Resources ────────────────────────────────────────────────
        Map.entry(SELECTED_RESOURCES, Channels.base((Supplier<List<CatalogEntry>>) List::of)),
        Map.entry(SELECTION_FALLBACK, Channels.base(() -> false)),

        // ── Latest step ──────────────────────────────────────────────
        Map.entry(PENDING_ACTION,     Channels.base((Reducer<Action>) null)),
        Map.entry(IGNORED_ACTIONS,    Channels.base(() -> 0)),
        Map.entry(PROPOSED_ANSWER,    Channels.base(() -> "")),
        Map.entry(LAST_REASONING,     Channels.base(() -> "")),
        Map.entry(LAST_VERDICT,       Channels.base((Reducer<CritiqueVerdict>) null)),

        // ── Outcome ──────────────────────────────────────────────────
        Map.entry(FINAL_ANSWER,       Channels.base(() -> "")),
        Map.entry(PARTIAL_ANSWER,     Channels.base(() -> "")),
        Map.entry(ABORT_REASON,       Channels.base(() -> "")),
        Map.entry(ABORT_DETAIL,       Channels.base(() -> "")),

        // ── Conversation (append-only) ───────────────────────────────
        Map.entry(TURNS,              Channels.appender(ArrayList::new))
    );

    public TaskState(Map<String, Object> initData) {
        super(initData);
    }

    public String taskId() {
        return this.<String>value(TASK_ID).orElse("");
    }

    public String task() {
        return this.<String>value(TASK).orElse("");
    }

    public String workingDirectory() {
        return this.<String>value(WORKING_DIRECTORY).orElse("");
    }

    public AgentPhase phase() {
        return AgentPhase.valueOf(this.<String>value(PHASE).orElse(AgentPhase.GENERATE.name()));
    }

    public int iteration() {
        return this.<Integer>value(ITERATION).orElse(0);
    }

    public int parseFailures() {
        return this.<Integer>value(PARSE_FAILURES).orElse(0);
    }

    public int critiqueRounds() {
        return this.<Integer>value(CRITIQUE_ROUNDS).orElse(0);
    }

    /**
     * Conversation in index order.
     */
    public List<Turn> turns() {
        List<?> raw = this.<List<?>>value(TURNS).orElse(List.of());
        return raw.stream()
                .filter(Turn.class::isInstance)
                .map(Turn.class::cast)
                .sorted(Comparator.comparingInt(Turn::index))
                .toList();
    }

    /**
     * Index the next appended turn must use.
     */
    public int nextTurnIndex() {
        return turns().stream().mapToInt(Turn::index).max().orElse(-1) + 1;
    }

    public List<CatalogEntry> selectedResources() {
        return this.<List<CatalogEntry>>value(SELECTED_RESOURCES).orElse(List.of());
    }

    public boolean selectionFallback() {
        return this.<Boolean>value(SELECTION_FALLBACK).orElse(false);
    }

    public ResourceSelection selection() {
        return new ResourceSelection(selectedResources(), selectionFallback());
    }

    public Optional<Action> pendingAction() {
        return value(PENDING_ACTION);
    }

    public int ignoredActions() {
        return this.<Integer>value(IGNORED_ACTIONS).orElse(0);
    }

    public String proposedAnswer() {
        return this.<String>value(PROPOSED_ANSWER).orElse("");
    }

    public String lastReasoning() {
        return this.<String>value(LAST_REASONING).orElse("");
    }

    public Optional<CritiqueVerdict> lastVerdict() {
        return value(LAST_VERDICT);
    }

    public String finalAnswer() {
        return this.<String>value(FINAL_ANSWER).orElse("");
    }

    public String partialAnswer() {
        return this.<String>value(PARTIAL_ANSWER).orElse("");
    }

    public Optional<AbortReason> abortReason() {
        String raw = this.<String>value(ABORT_REASON).orElse("");
        return raw.isEmpty() ? Optional.empty() : Optional.of(AbortReason.valueOf(raw));
    }

    public String abortDetail() {
        return this.<String>value(ABORT_DETAIL).orElse("");
    }
}
