package com.codeact.core.model;

/**
 * Kind of catalog entry. Declaration order is the section order in the system prompt.
 */
public enum ResourceCategory {
    TOOL("Tools"),
    DATASET("Datasets"),
    LIBRARY("Libraries"),
    KNOWLEDGE("Knowledge");

    private final String heading;

    ResourceCategory(String heading) {
        this.heading = heading;
    }

    public String heading() {
        return heading;
    }
}
