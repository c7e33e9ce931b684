package com.codeact.core.nodes;

import com.codeact.core.model.AgentPhase;
import com.codeact.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Terminal node for a task that produced a final answer.
 */
@Component
public class FinishTaskNode {

    private static final Logger log = LoggerFactory.getLogger(FinishTaskNode.class);

    public Map<String, Object> apply(TaskState state) {
        log.info("Task {} done after {} iteration(s)", state.taskId(), state.iteration());
        return Map.of(
                TaskState.FINAL_ANSWER, state.proposedAnswer(),
                TaskState.PHASE, AgentPhase.DONE.name());
    }
}
