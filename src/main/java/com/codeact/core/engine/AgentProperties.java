package com.codeact.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Loop settings bound from {@code codeact.agent.*}.
 */
@Component
@ConfigurationProperties(prefix = "codeact.agent")
public class AgentProperties {

    private int maxIterations = 300;
    private boolean critiqueEnabled = false;
    private int maxCritiqueRounds = 2;
    private int parseRetryBudget = 3;
    private int selectorLimit = 25;
    private boolean useResourceSelector = true;
    private boolean commercialMode = false;
    private boolean pinWorkingDirectory = true;
    private String workspaceRoot = "";
    private int maxConcurrentTasks = 4;

    public int getMaxIterations() { return maxIterations; }
    public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
    public boolean isCritiqueEnabled() { return critiqueEnabled; }
    public void setCritiqueEnabled(boolean critiqueEnabled) { this.critiqueEnabled = critiqueEnabled; }
    public int getMaxCritiqueRounds() { return maxCritiqueRounds; }
    public void setMaxCritiqueRounds(int maxCritiqueRounds) { this.maxCritiqueRounds = maxCritiqueRounds; }
    public int getParseRetryBudget() { return parseRetryBudget; }
    public void setParseRetryBudget(int parseRetryBudget) { this.parseRetryBudget = parseRetryBudget; }
    public int getSelectorLimit() { return selectorLimit; }
    public void setSelectorLimit(int selectorLimit) { this.selectorLimit = selectorLimit; }
    public boolean isUseResourceSelector() { return useResourceSelector; }
    public void setUseResourceSelector(boolean useResourceSelector) { this.useResourceSelector = useResourceSelector; }
    public boolean isCommercialMode() { return commercialMode; }
    public void setCommercialMode(boolean commercialMode) { this.commercialMode = commercialMode; }
    public boolean isPinWorkingDirectory() { return pinWorkingDirectory; }
    public void setPinWorkingDirectory(boolean pinWorkingDirectory) { this.pinWorkingDirectory = pinWorkingDirectory; }
    public String getWorkspaceRoot() { return workspaceRoot; }
    public void setWorkspaceRoot(String workspaceRoot) { this.workspaceRoot = workspaceRoot; }
    public int getMaxConcurrentTasks() { return maxConcurrentTasks; }
    public void setMaxConcurrentTasks(int maxConcurrentTasks) { this.maxConcurrentTasks = maxConcurrentTasks; }
}
