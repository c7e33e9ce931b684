package com.codeact.core.graph;

import com.codeact.core.engine.AgentProperties;
import com.codeact.core.engine.AgentRunConfig;
import com.codeact.core.model.AgentPhase;
import com.codeact.core.nodes.AbortTaskNode;
import com.codeact.core.nodes.CritiqueNode;
import com.codeact.core.nodes.ExecuteActionNode;
import com.codeact.core.nodes.FinishTaskNode;
import com.codeact.core.nodes.GenerateNode;
import com.codeact.core.nodes.SelectResourcesNode;
import com.codeact.core.state.TaskState;
import com.codeact.sandbox.ExecutionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * Tests for the LangGraph4j topology and its routing functions.
 */
class AgentGraphTest {

    private AgentGraph agentGraph;
    private AgentRunConfig config;

    @BeforeEach
    void setUp() {
        var properties = new AgentProperties();
        properties.setMaxIterations(5);
        config = AgentRunConfig.from(properties, new ExecutionProperties());
        agentGraph = new AgentGraph(
                mock(SelectResourcesNode.class),
                mock(GenerateNode.class),
                mock(ExecuteActionNode.class),
                mock(CritiqueNode.class),
                mock(FinishTaskNode.class),
                mock(AbortTaskNode.class),
                config);
    }

    private static TaskState state(AgentPhase phase, int iteration) {
        return new TaskState(Map.of(
                TaskState.PHASE, phase.name(),
                TaskState.ITERATION, iteration));
    }

    @Test
    @DisplayName("Graph compiles without errors")
    void graphCompiles() {
        assertNotNull(agentGraph.getCompiledGraph());
    }

    @Test
    @DisplayName("compiled graphs are cached per run configuration")
    void graphsCachedPerConfig() {
        assertSame(agentGraph.getCompiledGraph(), agentGraph.getCompiledGraph(config));
        var other = config.withMaxIterations(9);
        assertSame(agentGraph.getCompiledGraph(other), agentGraph.getCompiledGraph(other));
        assertNotSame(agentGraph.getCompiledGraph(), agentGraph.getCompiledGraph(other));
    }

    @Nested
    @DisplayName("After generate")
    class AfterGenerate {

        @Test
        @DisplayName("follows the phase chosen by the node")
        void followsPhase() {
            assertEquals(AgentGraph.EXECUTE, agentGraph.routeAfterGenerate(state(AgentPhase.EXECUTE, 1), config));
            assertEquals(AgentGraph.CRITIQUE, agentGraph.routeAfterGenerate(state(AgentPhase.CRITIQUE, 1), config));
            assertEquals(AgentGraph.DONE, agentGraph.routeAfterGenerate(state(AgentPhase.DONE, 1), config));
            assertEquals(AgentGraph.ABORT, agentGraph.routeAfterGenerate(state(AgentPhase.ABORTED, 1), config));
        }

        @Test
        @DisplayName("an unparseable reply retries generation while iterations remain")
        void retriesGeneration() {
            assertEquals(AgentGraph.GENERATE, agentGraph.routeAfterGenerate(state(AgentPhase.GENERATE, 4), config));
            assertEquals(AgentGraph.ABORT, agentGraph.routeAfterGenerate(state(AgentPhase.GENERATE, 5), config));
        }

        @Test
        @DisplayName("a final answer on the last iteration still completes")
        void answerOnLastIteration() {
            assertEquals(AgentGraph.DONE, agentGraph.routeAfterGenerate(state(AgentPhase.DONE, 5), config));
        }
    }

    @Nested
    @DisplayName("After execute and critique")
    class AfterExecuteAndCritique {

        @Test
        @DisplayName("execution returns to generation until the iteration ceiling")
        void afterExecute() {
            assertEquals(AgentGraph.GENERATE, agentGraph.routeAfterExecute(state(AgentPhase.GENERATE, 1), config));
            assertEquals(AgentGraph.ABORT, agentGraph.routeAfterExecute(state(AgentPhase.GENERATE, 5), config));
            assertEquals(AgentGraph.ABORT, agentGraph.routeAfterExecute(state(AgentPhase.ABORTED, 1), config));
        }

        @Test
        @DisplayName("a rejection returns to generation, an acceptance completes")
        void afterCritique() {
            assertEquals(AgentGraph.GENERATE, agentGraph.routeAfterCritique(state(AgentPhase.GENERATE, 2), config));
            assertEquals(AgentGraph.DONE, agentGraph.routeAfterCritique(state(AgentPhase.DONE, 5), config));
            assertEquals(AgentGraph.ABORT, agentGraph.routeAfterCritique(state(AgentPhase.GENERATE, 5), config));
            assertEquals(AgentGraph.ABORT, agentGraph.routeAfterCritique(state(AgentPhase.ABORTED, 2), config));
        }

        @Test
        @DisplayName("a cancelled selection goes straight to abort")
        void afterSelection() {
            assertEquals(AgentGraph.ABORT, agentGraph.routeAfterSelection(state(AgentPhase.ABORTED, 0)));
            assertEquals(AgentGraph.GENERATE, agentGraph.routeAfterSelection(state(AgentPhase.GENERATE, 0)));
        }
    }
}
