package com.codeact.core.nodes;

import com.codeact.core.cancellation.ActiveTaskRegistry;
import com.codeact.core.engine.AgentProperties;
import com.codeact.core.engine.AgentRunConfig;
import com.codeact.core.events.EventBus;
import com.codeact.core.llm.LlmService;
import com.codeact.core.metrics.AgentMetrics;
import com.codeact.core.model.AbortReason;
import com.codeact.core.model.Action;
import com.codeact.core.model.AgentPhase;
import com.codeact.core.model.ExecutionResult;
import com.codeact.core.model.RuntimeKind;
import com.codeact.core.model.Turn;
import com.codeact.core.prompt.PromptAssembler;
import com.codeact.core.state.TaskState;
import com.codeact.core.turn.ResponseParser;
import com.codeact.core.turn.TurnController;
import com.codeact.sandbox.ExecutionHarness;
import com.codeact.sandbox.ExecutionProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the graph nodes, applied directly to hand-built states.
 */
class NodesTest {

    private LlmService llm;
    private ExecutionHarness harness;
    private ActiveTaskRegistry registry;
    private AgentMetrics metrics;
    private EventBus eventBus;
    private AgentRunConfig config;

    @BeforeEach
    void setUp() {
        llm = mock(LlmService.class);
        harness = mock(ExecutionHarness.class);
        registry = new ActiveTaskRegistry();
        metrics = new AgentMetrics(new SimpleMeterRegistry());
        eventBus = new EventBus();
        config = AgentRunConfig.from(new AgentProperties(), new ExecutionProperties());
    }

    private static TaskState state(Map<String, Object> values) {
        var data = new HashMap<String, Object>(values);
        data.putIfAbsent(TaskState.TASK_ID, "TASK-2026-0001");
        data.putIfAbsent(TaskState.TASK, "Say hello");
        data.putIfAbsent(TaskState.TURNS, List.of(Turn.user("Say hello", 0)));
        return new TaskState(data);
    }

    @SuppressWarnings("unchecked")
    private static List<Turn> turns(Map<String, Object> out) {
        return (List<Turn>) out.get(TaskState.TURNS);
    }

    @Nested
    @DisplayName("GenerateNode")
    class GenerateNodeTests {

        private GenerateNode node;

        @BeforeEach
        void setUp() {
            node = new GenerateNode(new PromptAssembler(), new TurnController(llm, new ResponseParser(), harness),
                    registry, eventBus, metrics);
        }

        @Test
        @DisplayName("an action reply is staged for execution")
        void actionReply() {
            when(llm.complete(any(), any())).thenReturn("<execute runtime=\"r\">1 + 1</execute>");

            var out = node.apply(state(Map.of(TaskState.ITERATION, 2)), config);

            assertEquals(3, out.get(TaskState.ITERATION));
            assertEquals(AgentPhase.EXECUTE.name(), out.get(TaskState.PHASE));
            assertEquals(new Action(RuntimeKind.STATISTICAL, "1 + 1"), out.get(TaskState.PENDING_ACTION));
            assertEquals(1, turns(out).get(0).index());
        }

        @Test
        @DisplayName("an unparseable reply appends the reply and an error observation")
        void unparseableReply() {
            when(llm.complete(any(), any())).thenReturn("hmm");

            var out = node.apply(state(Map.of()), config);

            assertEquals(AgentPhase.GENERATE.name(), out.get(TaskState.PHASE));
            assertEquals(1, out.get(TaskState.PARSE_FAILURES));
            assertEquals(2, turns(out).size());
            assertTrue(turns(out).get(1).content().startsWith("Your response could not be parsed"));
        }

        @Test
        @DisplayName("a final answer skips critique when it is disabled")
        void finalAnswerWithoutCritique() {
            when(llm.complete(any(), any())).thenReturn("<solution>hello</solution>");

            var out = node.apply(state(Map.of()), config);

            assertEquals(AgentPhase.DONE.name(), out.get(TaskState.PHASE));
            assertEquals("hello", out.get(TaskState.PROPOSED_ANSWER));
        }

        @Test
        @DisplayName("a final answer goes to critique when it is enabled")
        void finalAnswerWithCritique() {
            when(llm.complete(any(), any())).thenReturn("<solution>hello</solution>");

            var out = node.apply(state(Map.of()), config.withCritiqueEnabled(true));

            assertEquals(AgentPhase.CRITIQUE.name(), out.get(TaskState.PHASE));
        }
    }

    @Nested
    @DisplayName("ExecuteActionNode")
    class ExecuteActionNodeTests {

        @Test
        @DisplayName("appends the observation and returns to generation")
        void appendsObservation() {
            when(harness.execute(any(), any())).thenReturn(new ExecutionResult("2\n", "", 0, 8, false, false, false));
            var node = new ExecuteActionNode(new TurnController(llm, new ResponseParser(), harness),
                    registry, eventBus, metrics);

            var out = node.apply(state(Map.of(
                    TaskState.PENDING_ACTION, new Action(RuntimeKind.GENERAL_PURPOSE, "print(1 + 1)"),
                    TaskState.TURNS, List.of(Turn.user("Add", 0), Turn.assistant("...", 1)))), config);

            assertEquals(AgentPhase.GENERATE.name(), out.get(TaskState.PHASE));
            Turn observation = turns(out).get(0);
            assertEquals(2, observation.index());
            assertTrue(observation.content().startsWith("Exit status: 0"));
        }

        @Test
        @DisplayName("a cancelled task does not run the snippet")
        void cancelledTask() {
            registry.register("TASK-2026-0001").cancel();
            var node = new ExecuteActionNode(new TurnController(llm, new ResponseParser(), harness),
                    registry, eventBus, metrics);

            var out = node.apply(state(Map.of(
                    TaskState.PENDING_ACTION, new Action(RuntimeKind.SHELL, "ls"))), config);

            assertEquals(AgentPhase.ABORTED.name(), out.get(TaskState.PHASE));
            assertEquals(AbortReason.CANCELLED.name(), out.get(TaskState.ABORT_REASON));
            verifyNoInteractions(harness);
        }
    }

    @Nested
    @DisplayName("Terminal nodes")
    class TerminalNodes {

        @Test
        @DisplayName("FinishTaskNode publishes the proposed answer as final")
        void finish() {
            var out = new FinishTaskNode().apply(state(Map.of(TaskState.PROPOSED_ANSWER, "42")));

            assertEquals("42", out.get(TaskState.FINAL_ANSWER));
            assertEquals(AgentPhase.DONE.name(), out.get(TaskState.PHASE));
        }

        @Test
        @DisplayName("AbortTaskNode defaults to the iteration limit and keeps the best partial answer")
        void abortDefaults() {
            var out = new AbortTaskNode().apply(state(Map.of(
                    TaskState.LAST_REASONING, "halfway there",
                    TaskState.ITERATION, 300)), config);

            assertEquals(AbortReason.ITERATION_LIMIT.name(), out.get(TaskState.ABORT_REASON));
            assertEquals("halfway there", out.get(TaskState.PARTIAL_ANSWER));
            assertTrue(((String) out.get(TaskState.ABORT_DETAIL)).contains("300"));
        }

        @Test
        @DisplayName("AbortTaskNode keeps a recorded reason and prefers a proposed answer")
        void abortKeepsReason() {
            var out = new AbortTaskNode().apply(state(Map.of(
                    TaskState.ABORT_REASON, AbortReason.PROVIDER_FATAL.name(),
                    TaskState.ABORT_DETAIL, "QUOTA: out of credit",
                    TaskState.PROPOSED_ANSWER, "draft",
                    TaskState.LAST_REASONING, "thinking")), config);

            assertEquals(AbortReason.PROVIDER_FATAL.name(), out.get(TaskState.ABORT_REASON));
            assertEquals("QUOTA: out of credit", out.get(TaskState.ABORT_DETAIL));
            assertEquals("draft", out.get(TaskState.PARTIAL_ANSWER));
        }
    }
}
