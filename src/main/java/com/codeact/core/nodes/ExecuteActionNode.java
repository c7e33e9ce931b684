package com.codeact.core.nodes;

import com.codeact.core.cancellation.ActiveTaskRegistry;
import com.codeact.core.cancellation.CancellationToken;
import com.codeact.core.cancellation.TaskCancelledException;
import com.codeact.core.engine.AgentRunConfig;
import com.codeact.core.events.AgentEvent;
import com.codeact.core.events.EventBus;
import com.codeact.core.logging.MdcContext;
import com.codeact.core.metrics.AgentMetrics;
import com.codeact.core.model.Action;
import com.codeact.core.model.AgentPhase;
import com.codeact.core.model.ExecutionResult;
import com.codeact.core.model.Turn;
import com.codeact.core.state.TaskState;
import com.codeact.core.turn.ActionOutcome;
import com.codeact.core.turn.ObservationFormatter;
import com.codeact.core.turn.TurnController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the pending action and appends its observation. Always returns to generation
 * unless the task was cancelled while the snippet ran. An unexpected harness failure is
 * reported to the model as an observation rather than ending the task.
 */
@Component
public class ExecuteActionNode {

    private static final Logger log = LoggerFactory.getLogger(ExecuteActionNode.class);

    private final TurnController turnController;
    private final ActiveTaskRegistry registry;
    private final EventBus eventBus;
    private final AgentMetrics metrics;

    public ExecuteActionNode(TurnController turnController, ActiveTaskRegistry registry,
                             EventBus eventBus, AgentMetrics metrics) {
        this.turnController = turnController;
        this.registry = registry;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(TaskState state, AgentRunConfig config) {
        String taskId = state.taskId();
        MdcContext.setStep(taskId, AgentPhase.EXECUTE.name(), state.iteration());
        Action action = state.pendingAction()
                .orElseThrow(() -> new IllegalStateException("No pending action for task " + taskId));
        CancellationToken token = registry.tokenFor(taskId);
        if (token.isCancelled()) {
            return AbortOutputs.cancelled();
        }

        Path workDir = state.workingDirectory().isBlank() ? null : Path.of(state.workingDirectory());
        ActionOutcome outcome;
        try {
            outcome = turnController.execute(action, state.ignoredActions(), config.executionTimeout(), token, workDir);
        } catch (TaskCancelledException e) {
            log.info("Task {} cancelled before the snippet started", taskId);
            return AbortOutputs.cancelled();
        } catch (RuntimeException e) {
            log.error("Unexpected failure running {} snippet for task {}", action.runtime().tag(), taskId, e);
            outcome = new ActionOutcome(null, ObservationFormatter.executionError(
                    e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
        }

        Turn observation = Turn.observation(outcome.observation(), state.nextTurnIndex());
        record(taskId, action, outcome);

        if (token.isCancelled()) {
            log.info("Task {} cancelled while running a {} snippet", taskId, action.runtime().tag());
            Map<String, Object> out = AbortOutputs.cancelled();
            out.put(TaskState.TURNS, List.of(observation));
            return out;
        }
        var out = new HashMap<String, Object>();
        out.put(TaskState.TURNS, List.of(observation));
        out.put(TaskState.PHASE, AgentPhase.GENERATE.name());
        return out;
    }

    private void record(String taskId, Action action, ActionOutcome outcome) {
        String runtime = action.runtime().tag();
        var payload = new HashMap<String, Object>();
        payload.put("runtime", runtime);
        if (outcome.launched()) {
            ExecutionResult result = outcome.result();
            metrics.recordExecution(runtime, result.durationMs(), result.timedOut());
            payload.put("exitStatus", result.exitStatus());
            payload.put("timedOut", result.timedOut());
            payload.put("durationMs", result.durationMs());
        } else {
            metrics.recordLaunchFailure(runtime);
            payload.put("launched", false);
        }
        eventBus.publish(AgentEvent.of("action.executed", taskId, payload));
    }
}
