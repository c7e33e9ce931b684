package com.codeact.core.logging;

import org.slf4j.MDC;

/**
 * Manages the agent's MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String TASK_ID = "taskId";
    public static final String PHASE = "phase";
    public static final String ITERATION = "iteration";

    private MdcContext() {}

    /**
     * Tags log lines with the task only, before any graph step runs.
     */
    public static void setTask(String taskId) {
        MDC.put(TASK_ID, taskId);
    }

    /**
     * Tags log lines with the task, the graph phase and the current iteration.
     *
     * @param taskId    the running task
     * @param phase     name of the graph phase, for example {@code GENERATE}
     * @param iteration generations counted so far
     */
    public static void setStep(String taskId, String phase, int iteration) {
        MDC.put(TASK_ID, taskId);
        MDC.put(PHASE, phase);
        MDC.put(ITERATION, String.valueOf(iteration));
    }

    /**
     * Removes only the keys set here; other MDC entries are left alone.
     */
    public static void clear() {
        MDC.remove(TASK_ID);
        MDC.remove(PHASE);
        MDC.remove(ITERATION);
    }
}
