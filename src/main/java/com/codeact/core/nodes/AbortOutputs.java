package com.codeact.core.nodes;

import com.codeact.core.model.AbortReason;
import com.codeact.core.model.AgentPhase;
import com.codeact.core.state.TaskState;

import java.util.HashMap;
import java.util.Map;

/**
 * State updates that send the graph to the abort node.
 */
final class AbortOutputs {

    private AbortOutputs() {}

    static Map<String, Object> abort(AbortReason reason, String detail) {
        var out = new HashMap<String, Object>();
        out.put(TaskState.PHASE, AgentPhase.ABORTED.name());
        out.put(TaskState.ABORT_REASON, reason.name());
        out.put(TaskState.ABORT_DETAIL, detail == null ? "" : detail);
        return out;
    }

    static Map<String, Object> cancelled() {
        return abort(AbortReason.CANCELLED, "Task was cancelled");
    }
}
