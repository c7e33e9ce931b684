package com.codeact.core.nodes;

import com.codeact.core.engine.AgentRunConfig;
import com.codeact.core.model.AbortReason;
import com.codeact.core.model.AgentPhase;
import com.codeact.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Terminal node for a task that stopped without a final answer.
 * <p>
 * Reaching this node without a recorded reason means the iteration ceiling stopped
 * the loop. The best partial answer is the last proposed final answer, or failing
 * that the last reasoning.
 */
@Component
public class AbortTaskNode {

    private static final Logger log = LoggerFactory.getLogger(AbortTaskNode.class);

    public Map<String, Object> apply(TaskState state, AgentRunConfig config) {
        AbortReason reason = state.abortReason().orElse(AbortReason.ITERATION_LIMIT);
        String detail = !state.abortDetail().isBlank()
                ? state.abortDetail()
                : "iteration ceiling of " + config.maxIterations() + " reached";
        String partial = !state.proposedAnswer().isBlank() ? state.proposedAnswer() : state.lastReasoning();
        log.warn("Task {} aborted ({}) after {} iteration(s): {}", state.taskId(), reason.code(),
                state.iteration(), detail);
        return Map.of(
                TaskState.ABORT_REASON, reason.name(),
                TaskState.ABORT_DETAIL, detail,
                TaskState.PARTIAL_ANSWER, partial,
                TaskState.PHASE, AgentPhase.ABORTED.name());
    }
}
