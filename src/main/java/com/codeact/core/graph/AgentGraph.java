package com.codeact.core.graph;

import com.codeact.core.engine.AgentRunConfig;
import com.codeact.core.model.AgentPhase;
import com.codeact.core.nodes.AbortTaskNode;
import com.codeact.core.nodes.CritiqueNode;
import com.codeact.core.nodes.ExecuteActionNode;
import com.codeact.core.nodes.FinishTaskNode;
import com.codeact.core.nodes.GenerateNode;
import com.codeact.core.nodes.SelectResourcesNode;
import com.codeact.core.state.TaskState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds the LangGraph4j {@link StateGraph} that drives one task.
 * <p>
 * Topology:
 * <pre>
 *   START -> select_resources -> generate -> [routeAfterGenerate]
 *              -> execute  -> [routeAfterExecute]  -> generate | abort
 *              -> critique -> [routeAfterCritique] -> generate | done | abort
 *              -> generate (unparseable reply, budget left)
 *              -> done -> END
 *              -> abort -> END
 * </pre>
 * Every route back into {@code generate} goes to {@code abort} instead once the
 * iteration ceiling is reached. Graphs are compiled per {@link AgentRunConfig} and cached.
 */
@Component
public class AgentGraph {

    private static final Logger log = LoggerFactory.getLogger(AgentGraph.class);

    static final String SELECT_RESOURCES = "select_resources";
    static final String GENERATE = "generate";
    static final String EXECUTE = "execute";
    static final String CRITIQUE = "critique";
    static final String DONE = "done";
    static final String ABORT = "abort";

    private final SelectResourcesNode selectNode;
    private final GenerateNode generateNode;
    private final ExecuteActionNode executeNode;
    private final CritiqueNode critiqueNode;
    private final FinishTaskNode finishNode;
    private final AbortTaskNode abortNode;
    private final AgentRunConfig defaultConfig;
    private final Map<AgentRunConfig, CompiledGraph<TaskState>> compiled = new ConcurrentHashMap<>();

    public AgentGraph(SelectResourcesNode selectNode,
                      GenerateNode generateNode,
                      ExecuteActionNode executeNode,
                      CritiqueNode critiqueNode,
                      FinishTaskNode finishNode,
                      AbortTaskNode abortNode,
                      AgentRunConfig defaultConfig) {
        this.selectNode = selectNode;
        this.generateNode = generateNode;
        this.executeNode = executeNode;
        this.critiqueNode = critiqueNode;
        this.finishNode = finishNode;
        this.abortNode = abortNode;
        this.defaultConfig = defaultConfig;
        getCompiledGraph();
    }

    public AgentRunConfig defaultConfig() {
        return defaultConfig;
    }

    public CompiledGraph<TaskState> getCompiledGraph() {
        return getCompiledGraph(defaultConfig);
    }

    public CompiledGraph<TaskState> getCompiledGraph(AgentRunConfig config) {
        return compiled.computeIfAbsent(config, this::compile);
    }

    private CompiledGraph<TaskState> compile(AgentRunConfig config) {
        try {
            var graph = new StateGraph<>(TaskState.SCHEMA, TaskState::new)
                    .addNode(SELECT_RESOURCES, node_async(state -> selectNode.apply(state, config)))
                    .addNode(GENERATE, node_async(state -> generateNode.apply(state, config)))
                    .addNode(EXECUTE, node_async(state -> executeNode.apply(state, config)))
                    .addNode(CRITIQUE, node_async(state -> critiqueNode.apply(state, config)))
                    .addNode(DONE, node_async(finishNode::apply))
                    .addNode(ABORT, node_async(state -> abortNode.apply(state, config)))
                    .addEdge(START, SELECT_RESOURCES)
                    .addConditionalEdges(SELECT_RESOURCES,
                            edge_async(state -> routeAfterSelection(state)),
                            Map.of(GENERATE, GENERATE, ABORT, ABORT))
                    .addConditionalEdges(GENERATE,
                            edge_async(state -> routeAfterGenerate(state, config)),
                            Map.of(EXECUTE, EXECUTE, CRITIQUE, CRITIQUE, GENERATE, GENERATE,
                                    DONE, DONE, ABORT, ABORT))
                    .addConditionalEdges(EXECUTE,
                            edge_async(state -> routeAfterExecute(state, config)),
                            Map.of(GENERATE, GENERATE, ABORT, ABORT))
                    .addConditionalEdges(CRITIQUE,
                            edge_async(state -> routeAfterCritique(state, config)),
                            Map.of(GENERATE, GENERATE, DONE, DONE, ABORT, ABORT))
                    .addEdge(DONE, END)
                    .addEdge(ABORT, END);

            var compileConfig = CompileConfig.builder()
                    .recursionLimit(config.recursionLimit())
                    .build();
            log.info("Agent graph compiled (maxIterations={}, critique={})",
                    config.maxIterations(), config.critiqueEnabled());
            return graph.compile(compileConfig);
        } catch (GraphStateException e) {
            throw new IllegalStateException("Agent graph definition is invalid: " + e.getMessage(), e);
        }
    }

    String routeAfterSelection(TaskState state) {
        return state.phase() == AgentPhase.ABORTED ? ABORT : GENERATE;
    }

    String routeAfterGenerate(TaskState state, AgentRunConfig config) {
        return switch (state.phase()) {
            case EXECUTE -> EXECUTE;
            case CRITIQUE -> CRITIQUE;
            case DONE -> DONE;
            case ABORTED -> ABORT;
            case GENERATE -> backToGenerate(state, config);
        };
    }

    String routeAfterExecute(TaskState state, AgentRunConfig config) {
        return state.phase() == AgentPhase.ABORTED ? ABORT : backToGenerate(state, config);
    }

    String routeAfterCritique(TaskState state, AgentRunConfig config) {
        return switch (state.phase()) {
            case DONE -> DONE;
            case ABORTED -> ABORT;
            default -> backToGenerate(state, config);
        };
    }

    private static String backToGenerate(TaskState state, AgentRunConfig config) {
        return state.iteration() >= config.maxIterations() ? ABORT : GENERATE;
    }
}
