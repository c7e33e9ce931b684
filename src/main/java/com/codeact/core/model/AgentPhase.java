package com.codeact.core.model;

/**
 * States of the per-task control loop.
 */
public enum AgentPhase {
    GENERATE,
    EXECUTE,
    CRITIQUE,
    DONE,
    ABORTED
}
