package com.codeact.core.nodes;

import com.codeact.core.cancellation.ActiveTaskRegistry;
import com.codeact.core.cancellation.TaskCancelledException;
import com.codeact.core.engine.AgentRunConfig;
import com.codeact.core.events.AgentEvent;
import com.codeact.core.events.EventBus;
import com.codeact.core.llm.LlmProviderException;
import com.codeact.core.logging.MdcContext;
import com.codeact.core.metrics.AgentMetrics;
import com.codeact.core.model.AbortReason;
import com.codeact.core.model.AgentPhase;
import com.codeact.core.model.PromptPayload;
import com.codeact.core.model.StructuredResponse;
import com.codeact.core.model.Turn;
import com.codeact.core.prompt.PromptAssembler;
import com.codeact.core.state.TaskState;
import com.codeact.core.turn.Generation;
import com.codeact.core.turn.ObservationFormatter;
import com.codeact.core.turn.TurnController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Asks the model for the next step and decides where the loop goes next.
 * <p>
 * Every visit counts one iteration. An unparseable reply is answered with an error
 * observation until the consecutive-failure budget is spent. A final answer goes to
 * critique while critique rounds remain, otherwise straight to done.
 */
@Component
public class GenerateNode {

    private static final Logger log = LoggerFactory.getLogger(GenerateNode.class);

    private final PromptAssembler assembler;
    private final TurnController turnController;
    private final ActiveTaskRegistry registry;
    private final EventBus eventBus;
    private final AgentMetrics metrics;

    public GenerateNode(PromptAssembler assembler, TurnController turnController, ActiveTaskRegistry registry,
                        EventBus eventBus, AgentMetrics metrics) {
        this.assembler = assembler;
        this.turnController = turnController;
        this.registry = registry;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(TaskState state, AgentRunConfig config) {
        String taskId = state.taskId();
        int iteration = state.iteration() + 1;
        MdcContext.setStep(taskId, AgentPhase.GENERATE.name(), iteration);

        PromptPayload payload = assembler.assemble(state.selection(), state.turns());
        Generation generation;
        try {
            generation = turnController.generate(payload, registry.tokenFor(taskId));
        } catch (TaskCancelledException e) {
            log.info("Task {} cancelled during generation {}", taskId, iteration);
            return withIteration(AbortOutputs.cancelled(), iteration);
        } catch (LlmProviderException e) {
            log.error("Task {} aborted: model provider failed ({})", taskId, e.kind());
            return withIteration(AbortOutputs.abort(AbortReason.PROVIDER_FATAL,
                    e.kind() + ": " + e.getMessage()), iteration);
        }

        int index = state.nextTurnIndex();
        Turn reply = Turn.assistant(generation.raw(), index);
        var out = new HashMap<String, Object>();
        out.put(TaskState.ITERATION, iteration);

        if (!generation.isParsed()) {
            int failures = state.parseFailures() + 1;
            metrics.recordParseFailure();
            publish(taskId, iteration, "unparseable");
            if (failures > config.parseRetryBudget()) {
                log.warn("Task {}: {} consecutive unparseable replies, giving up", taskId, failures);
                out.putAll(AbortOutputs.abort(AbortReason.PARSE_EXHAUSTED,
                        failures + " consecutive unparseable replies; last error: " + generation.parseError()));
                out.put(TaskState.PARSE_FAILURES, failures);
                out.put(TaskState.TURNS, List.of(reply));
                return out;
            }
            out.put(TaskState.PARSE_FAILURES, failures);
            out.put(TaskState.TURNS, List.of(reply,
                    Turn.observation(ObservationFormatter.parseFailure(generation.parseError()), index + 1)));
            out.put(TaskState.PHASE, AgentPhase.GENERATE.name());
            return out;
        }

        StructuredResponse response = generation.response();
        out.put(TaskState.PARSE_FAILURES, 0);
        out.put(TaskState.TURNS, List.of(reply));
        if (!response.reasoning().isBlank()) {
            out.put(TaskState.LAST_REASONING, response.reasoning());
        }
        if (response.isAction()) {
            out.put(TaskState.PENDING_ACTION, response.action());
            out.put(TaskState.IGNORED_ACTIONS, response.ignoredActions());
            out.put(TaskState.PHASE, AgentPhase.EXECUTE.name());
            publish(taskId, iteration, "action");
        } else {
            out.put(TaskState.PROPOSED_ANSWER, response.finalAnswer());
            boolean review = config.critiqueEnabled() && state.critiqueRounds() < config.maxCritiqueRounds();
            out.put(TaskState.PHASE, review ? AgentPhase.CRITIQUE.name() : AgentPhase.DONE.name());
            publish(taskId, iteration, "final_answer");
        }
        return out;
    }

    private void publish(String taskId, int iteration, String kind) {
        eventBus.publish(AgentEvent.of("turn.generated", taskId, Map.of("iteration", iteration, "kind", kind)));
    }

    private static Map<String, Object> withIteration(Map<String, Object> out, int iteration) {
        out.put(TaskState.ITERATION, iteration);
        return out;
    }
}
