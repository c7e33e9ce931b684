package com.codeact.core.engine;

import com.codeact.core.cancellation.ActiveTaskRegistry;
import com.codeact.core.events.AgentEvent;
import com.codeact.core.events.EventBus;
import com.codeact.core.graph.AgentGraph;
import com.codeact.core.logging.MdcContext;
import com.codeact.core.metrics.AgentMetrics;
import com.codeact.core.model.AbortReason;
import com.codeact.core.model.AgentPhase;
import com.codeact.core.model.CatalogEntry;
import com.codeact.core.model.TerminalStatus;
import com.codeact.core.model.Transcript;
import com.codeact.core.model.Turn;
import com.codeact.core.state.TaskState;
import com.codeact.sandbox.ScratchDirectories;
import jakarta.annotation.PreDestroy;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs tasks through the agent graph.
 * <p>
 * Each run gets a task id, a cancellation token registered under that id, and (unless
 * disabled) a working directory shared by all of its snippets and removed afterwards.
 * The final graph state is turned into a {@link Transcript}.
 */
@Service
public class AgentEngine {

    private static final Logger log = LoggerFactory.getLogger(AgentEngine.class);
    private static final AtomicInteger TASK_COUNTER = new AtomicInteger(0);

    private final AgentGraph agentGraph;
    private final ActiveTaskRegistry registry;
    private final EventBus eventBus;
    private final AgentMetrics metrics;
    private final Path workspaceRoot;
    private final ExecutorService taskExecutor;

    public AgentEngine(AgentGraph agentGraph, ActiveTaskRegistry registry, EventBus eventBus,
                       AgentMetrics metrics, AgentProperties properties) {
        this.agentGraph = agentGraph;
        this.registry = registry;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.workspaceRoot = properties.getWorkspaceRoot() == null || properties.getWorkspaceRoot().isBlank()
                ? null
                : Path.of(properties.getWorkspaceRoot());
        var threadCounter = new AtomicInteger();
        this.taskExecutor = Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrentTasks()), r -> {
            Thread t = new Thread(r, "agent-task-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void shutdown() {
        taskExecutor.shutdownNow();
    }

    public Transcript run(String task) {
        return run(task, agentGraph.defaultConfig());
    }

    /**
     * Runs a task to completion on the calling thread.
     */
    public Transcript run(String task, AgentRunConfig config) {
        String taskId = generateTaskId();
        registry.register(taskId);
        return execute(taskId, task, config);
    }

    /**
     * Starts a task on the engine's worker pool. The task can be cancelled through
     * {@link #cancel(String)} as soon as this method returns.
     */
    public RunningTask submit(String task, AgentRunConfig config) {
        String taskId = generateTaskId();
        registry.register(taskId);
        try {
            return new RunningTask(taskId,
                    CompletableFuture.supplyAsync(() -> execute(taskId, task, config), taskExecutor));
        } catch (RuntimeException e) {
            registry.unregister(taskId);
            throw e;
        }
    }

    /**
     * @return true if a running task with that id was signalled
     */
    public boolean cancel(String taskId) {
        return registry.cancel(taskId);
    }

    private Transcript execute(String taskId, String task, AgentRunConfig config) {
        Instant startedAt = Instant.now();
        MdcContext.setTask(taskId);
        Path workDir = null;
        try {
            if (config.pinWorkingDirectory()) {
                workDir = ScratchDirectories.create(workspaceRoot, taskId + "-");
            }
            log.info("Starting task {} (maxIterations={}, critique={}): {}",
                    taskId, config.maxIterations(), config.critiqueEnabled(), task);
            eventBus.publish(AgentEvent.of("task.started", taskId, Map.of("task", task)));

            var stateMap = new HashMap<String, Object>();
            stateMap.put(TaskState.TASK_ID, taskId);
            stateMap.put(TaskState.TASK, task);
            stateMap.put(TaskState.PHASE, AgentPhase.GENERATE.name());
            stateMap.put(TaskState.TURNS, List.of(Turn.user(task, 0)));
            if (workDir != null) {
                stateMap.put(TaskState.WORKING_DIRECTORY, workDir.toString());
            }

            var runnableConfig = RunnableConfig.builder()
                    .threadId(taskId)
                    .build();
            TaskState finalState = agentGraph.getCompiledGraph(config)
                    .invoke(Map.copyOf(stateMap), runnableConfig)
                    .orElseThrow(() -> new IllegalStateException("Graph execution returned empty state for task " + taskId));

            Transcript transcript = toTranscript(finalState, startedAt, Instant.now());
            record(transcript);
            return transcript;
        } finally {
            registry.unregister(taskId);
            ScratchDirectories.delete(workDir);
            MdcContext.clear();
        }
    }

    static Transcript toTranscript(TaskState state, Instant startedAt, Instant finishedAt) {
        boolean done = state.phase() == AgentPhase.DONE;
        AbortReason reason = done ? null : state.abortReason().orElse(AbortReason.ITERATION_LIMIT);
        return new Transcript(
                state.taskId(),
                state.task(),
                done ? TerminalStatus.DONE : TerminalStatus.ABORTED,
                done ? state.finalAnswer() : null,
                reason,
                done ? null : state.abortDetail(),
                done ? null : state.partialAnswer(),
                state.iteration(),
                state.critiqueRounds(),
                state.selectedResources().stream().map(CatalogEntry::name).toList(),
                state.selectionFallback(),
                state.turns(),
                startedAt,
                finishedAt);
    }

    private void record(Transcript transcript) {
        long durationMs = Duration.between(transcript.startedAt(), transcript.finishedAt()).toMillis();
        String reason = transcript.abortReason() == null ? "none" : transcript.abortReason().code();
        metrics.recordTaskResult(transcript.status().name(), reason);
        metrics.recordIterations(transcript.iterations());
        metrics.recordTaskDuration(durationMs);

        var payload = new HashMap<String, Object>();
        payload.put("iterations", transcript.iterations());
        payload.put("durationMs", durationMs);
        if (transcript.isDone()) {
            eventBus.publish(AgentEvent.of("task.completed", transcript.taskId(), payload));
            log.info("Task {} completed in {} iteration(s)", transcript.taskId(), transcript.iterations());
        } else {
            payload.put("reason", reason);
            eventBus.publish(AgentEvent.of("task.aborted", transcript.taskId(), payload));
            log.info("Task {} aborted ({}) after {} iteration(s)", transcript.taskId(), reason, transcript.iterations());
        }
    }

    /**
     * Generates a task id in the format TASK-YYYY-NNNN.
     */
    public String generateTaskId() {
        int count = TASK_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("TASK-%d-%04d", year, count);
    }
}
