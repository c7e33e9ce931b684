package com.codeact.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task runs.
 */
@Service
public class AgentMetrics {

    private final MeterRegistry registry;

    public AgentMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param reason abort reason code, or "none" for completed tasks
     */
    public void recordTaskResult(String status, String reason) {
        Counter.builder("codeact.tasks.total")
                .tag("status", status)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordIterations(int iterations) {
        DistributionSummary.builder("codeact.task.iterations")
                .description("Generations per task")
                .register(registry)
                .record(iterations);
    }

    public void recordTaskDuration(long ms) {
        Timer.builder("codeact.task.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordExecution(String runtime, long ms, boolean timedOut) {
        Timer.builder("codeact.execution.duration")
                .tag("runtime", runtime)
                .register(registry)
                .record(Duration.ofMillis(ms));
        if (timedOut) {
            Counter.builder("codeact.execution.timeouts")
                    .tag("runtime", runtime)
                    .register(registry)
                    .increment();
        }
    }

    public void recordLaunchFailure(String runtime) {
        Counter.builder("codeact.execution.launch_failures")
                .tag("runtime", runtime)
                .register(registry)
                .increment();
    }

    public void recordParseFailure() {
        Counter.builder("codeact.generation.parse_failures")
                .register(registry)
                .increment();
    }

    public void recordCritique(boolean accepted) {
        Counter.builder("codeact.critique.verdicts")
                .tag("result", accepted ? "accepted" : "rejected")
                .register(registry)
                .increment();
    }

    public void recordSelection(boolean fallback, int selected) {
        Counter.builder("codeact.selection.total")
                .tag("fallback", String.valueOf(fallback))
                .register(registry)
                .increment();
        DistributionSummary.builder("codeact.selection.size")
                .register(registry)
                .record(selected);
    }
}
