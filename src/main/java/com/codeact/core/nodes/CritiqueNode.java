package com.codeact.core.nodes;

import com.codeact.core.cancellation.ActiveTaskRegistry;
import com.codeact.core.cancellation.TaskCancelledException;
import com.codeact.core.critic.CritiqueService;
import com.codeact.core.engine.AgentRunConfig;
import com.codeact.core.events.AgentEvent;
import com.codeact.core.events.EventBus;
import com.codeact.core.llm.LlmProviderException;
import com.codeact.core.logging.MdcContext;
import com.codeact.core.metrics.AgentMetrics;
import com.codeact.core.model.AbortReason;
import com.codeact.core.model.AgentPhase;
import com.codeact.core.model.CritiqueVerdict;
import com.codeact.core.model.Turn;
import com.codeact.core.state.TaskState;
import com.codeact.core.turn.ObservationFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Has the critic review the proposed final answer. A rejection is appended as an
 * observation and sends the loop back to generation.
 */
@Component
public class CritiqueNode {

    private static final Logger log = LoggerFactory.getLogger(CritiqueNode.class);

    private final CritiqueService critiqueService;
    private final ActiveTaskRegistry registry;
    private final EventBus eventBus;
    private final AgentMetrics metrics;

    public CritiqueNode(CritiqueService critiqueService, ActiveTaskRegistry registry,
                        EventBus eventBus, AgentMetrics metrics) {
        this.critiqueService = critiqueService;
        this.registry = registry;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(TaskState state, AgentRunConfig config) {
        String taskId = state.taskId();
        MdcContext.setStep(taskId, AgentPhase.CRITIQUE.name(), state.iteration());
        CritiqueVerdict verdict;
        try {
            verdict = critiqueService.critique(state.task(), state.proposedAnswer(), state.turns(),
                    registry.tokenFor(taskId));
        } catch (TaskCancelledException e) {
            return AbortOutputs.cancelled();
        } catch (LlmProviderException e) {
            log.error("Task {} aborted: critic call failed ({})", taskId, e.kind());
            return AbortOutputs.abort(AbortReason.PROVIDER_FATAL, "critique " + e.kind() + ": " + e.getMessage());
        }

        metrics.recordCritique(verdict.accepted());
        int round = state.critiqueRounds() + (verdict.accepted() ? 0 : 1);
        eventBus.publish(AgentEvent.of("critique.completed", taskId,
                Map.of("accepted", verdict.accepted(), "round", round)));

        if (verdict.accepted()) {
            return Map.of(
                    TaskState.LAST_VERDICT, verdict,
                    TaskState.PHASE, AgentPhase.DONE.name());
        }
        log.info("Task {}: critic rejected the answer (round {}/{})", taskId, round, config.maxCritiqueRounds());
        return Map.of(
                TaskState.LAST_VERDICT, verdict,
                TaskState.CRITIQUE_ROUNDS, round,
                TaskState.TURNS, List.of(Turn.observation(ObservationFormatter.critique(verdict.feedback()),
                        state.nextTurnIndex())),
                TaskState.PHASE, AgentPhase.GENERATE.name());
    }
}
