package com.codeact.core.engine;

import com.codeact.sandbox.ExecutionProperties;

import java.io.Serializable;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings for one task run, passed explicitly to the graph and its nodes.
 *
 * @param maxIterations       generations allowed before the task aborts with {@code iteration_limit}
 * @param parseRetryBudget    consecutive unparseable replies tolerated before {@code parse_exhausted}
 * @param maxCritiqueRounds   rejections after which the next final answer is accepted unreviewed
 * @param selectorLimit       cap on the number of catalog entries shown to the model
 * @param commercialMode      hide catalog entries flagged as non-commercial
 * @param executionTimeout    wall-clock limit per snippet
 * @param pinWorkingDirectory run every snippet of a task in one directory
 */
public record AgentRunConfig(
    int maxIterations,
    boolean critiqueEnabled,
    int maxCritiqueRounds,
    int parseRetryBudget,
    int selectorLimit,
    boolean useResourceSelector,
    boolean commercialMode,
    Duration executionTimeout,
    boolean pinWorkingDirectory
) implements Serializable {

    public AgentRunConfig {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1");
        }
        if (maxCritiqueRounds < 0 || parseRetryBudget < 0 || selectorLimit < 0) {
            throw new IllegalArgumentException("Critique rounds, parse retry budget and selector limit must not be negative");
        }
        Objects.requireNonNull(executionTimeout, "executionTimeout");
        if (executionTimeout.isNegative() || executionTimeout.isZero()) {
            throw new IllegalArgumentException("executionTimeout must be positive");
        }
    }

    public static AgentRunConfig from(AgentProperties agent, ExecutionProperties execution) {
        return new AgentRunConfig(
                agent.getMaxIterations(),
                agent.isCritiqueEnabled(),
                agent.getMaxCritiqueRounds(),
                agent.getParseRetryBudget(),
                agent.getSelectorLimit(),
                agent.isUseResourceSelector(),
                agent.isCommercialMode(),
                Duration.ofSeconds(execution.getTimeoutSeconds()),
                agent.isPinWorkingDirectory());
    }

    public AgentRunConfig withMaxIterations(int value) {
        return new AgentRunConfig(value, critiqueEnabled, maxCritiqueRounds, parseRetryBudget, selectorLimit,
                useResourceSelector, commercialMode, executionTimeout, pinWorkingDirectory);
    }

    public AgentRunConfig withCritiqueEnabled(boolean value) {
        return new AgentRunConfig(maxIterations, value, maxCritiqueRounds, parseRetryBudget, selectorLimit,
                useResourceSelector, commercialMode, executionTimeout, pinWorkingDirectory);
    }

    public AgentRunConfig withExecutionTimeout(Duration value) {
        return new AgentRunConfig(maxIterations, critiqueEnabled, maxCritiqueRounds, parseRetryBudget, selectorLimit,
                useResourceSelector, commercialMode, value, pinWorkingDirectory);
    }

    public AgentRunConfig withResourceSelector(boolean value) {
        return new AgentRunConfig(maxIterations, critiqueEnabled, maxCritiqueRounds, parseRetryBudget, selectorLimit,
                value, commercialMode, executionTimeout, pinWorkingDirectory);
    }

    /**
     * Graph step limit: each iteration visits at most generate, execute and critique.
     */
    public int recursionLimit() {
        return maxIterations * 3 + 10;
    }
}
