package com.codeact.core.nodes;

import com.codeact.core.cancellation.ActiveTaskRegistry;
import com.codeact.core.cancellation.TaskCancelledException;
import com.codeact.core.engine.AgentRunConfig;
import com.codeact.core.events.AgentEvent;
import com.codeact.core.events.EventBus;
import com.codeact.core.metrics.AgentMetrics;
import com.codeact.core.model.AgentPhase;
import com.codeact.core.model.ResourceCatalog;
import com.codeact.core.model.ResourceSelection;
import com.codeact.core.resources.ResourceSelector;
import com.codeact.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Chooses the catalog entries shown to the model for this task. Runs once, before the
 * first generation.
 */
@Component
public class SelectResourcesNode {

    private static final Logger log = LoggerFactory.getLogger(SelectResourcesNode.class);

    private final ResourceSelector selector;
    private final ResourceCatalog catalog;
    private final ActiveTaskRegistry registry;
    private final EventBus eventBus;
    private final AgentMetrics metrics;

    public SelectResourcesNode(ResourceSelector selector, ResourceCatalog catalog, ActiveTaskRegistry registry,
                               EventBus eventBus, AgentMetrics metrics) {
        this.selector = selector;
        this.catalog = catalog;
        this.registry = registry;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(TaskState state, AgentRunConfig config) {
        ResourceCatalog visible = config.commercialMode() ? catalog.withoutNonCommercial() : catalog;
        ResourceSelection selection;
        try {
            selection = config.useResourceSelector()
                    ? selector.select(state.task(), visible, config.selectorLimit(), registry.tokenFor(state.taskId()))
                    : ResourceSelection.fallback(visible, config.selectorLimit());
        } catch (TaskCancelledException e) {
            log.info("Task {} cancelled during resource selection", state.taskId());
            return AbortOutputs.cancelled();
        }

        metrics.recordSelection(selection.fallback(), selection.entries().size());
        eventBus.publish(AgentEvent.of("resources.selected", state.taskId(),
                Map.of("resources", selection.names(), "fallback", selection.fallback())));
        log.info("Task {} sees {} resource(s){}", state.taskId(), selection.entries().size(),
                selection.fallback() ? " (catalog order)" : "");

        return Map.of(
                TaskState.SELECTED_RESOURCES, selection.entries(),
                TaskState.SELECTION_FALLBACK, selection.fallback(),
                TaskState.PHASE, AgentPhase.GENERATE.name());
    }
}
