package com.codeact.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AgentMetricsTest {

    private SimpleMeterRegistry registry;
    private AgentMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AgentMetrics(registry);
    }

    @Test
    @DisplayName("recordTaskResult counts per status and reason")
    void recordTaskResult() {
        metrics.recordTaskResult("done", "none");
        metrics.recordTaskResult("aborted", "iteration_limit");
        metrics.recordTaskResult("aborted", "iteration_limit");

        var done = registry.find("codeact.tasks.total").tag("status", "done").counter();
        var limited = registry.find("codeact.tasks.total").tag("reason", "iteration_limit").counter();
        assertNotNull(done);
        assertEquals(1.0, done.count());
        assertEquals(2.0, limited.count());
    }

    @Test
    @DisplayName("recordIterations feeds a distribution summary")
    void recordIterations() {
        metrics.recordIterations(3);
        metrics.recordIterations(5);

        var summary = registry.find("codeact.task.iterations").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(8.0, summary.totalAmount());
    }

    @Test
    @DisplayName("recordExecution times every run and counts timeouts")
    void recordExecution() {
        metrics.recordExecution("shell", 120, false);
        metrics.recordExecution("shell", 1000, true);

        var timer = registry.find("codeact.execution.duration").tag("runtime", "shell").timer();
        var timeouts = registry.find("codeact.execution.timeouts").tag("runtime", "shell").counter();
        assertEquals(2, timer.count());
        assertEquals(1.0, timeouts.count());
    }

    @Test
    @DisplayName("recordCritique tags the verdict")
    void recordCritique() {
        metrics.recordCritique(false);
        metrics.recordCritique(true);
        metrics.recordCritique(false);

        assertEquals(2.0, registry.find("codeact.critique.verdicts").tag("result", "rejected").counter().count());
        assertEquals(1.0, registry.find("codeact.critique.verdicts").tag("result", "accepted").counter().count());
    }

    @Test
    @DisplayName("recordSelection tracks fallbacks and selection size")
    void recordSelection() {
        metrics.recordSelection(true, 25);

        assertEquals(1.0, registry.find("codeact.selection.total").tag("fallback", "true").counter().count());
        assertEquals(25.0, registry.find("codeact.selection.size").summary().totalAmount());
    }

    @Test
    @DisplayName("parse and launch failures are counted")
    void failures() {
        metrics.recordParseFailure();
        metrics.recordLaunchFailure("statistical");

        assertEquals(1.0, registry.find("codeact.generation.parse_failures").counter().count());
        assertEquals(1.0, registry.find("codeact.execution.launch_failures").tag("runtime", "statistical").counter().count());
    }
}
