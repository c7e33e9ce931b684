package com.codeact.dispatch.cli;

import com.codeact.sandbox.RuntimeHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: codeact health
 * <p>
 * Reports whether the configured execution runtimes are usable.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check the execution runtimes")
@Component
public class HealthCommand implements Callable<Integer> {

    private final RuntimeHealthIndicator runtimeHealth;

    public HealthCommand(RuntimeHealthIndicator runtimeHealth) {
        this.runtimeHealth = runtimeHealth;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        Health health = runtimeHealth.health();
        boolean down = Status.DOWN.equals(health.getStatus());
        health.getDetails().forEach((key, value) -> {
            String text = String.valueOf(value);
            String label = key + ": " + text;
            if (down || text.startsWith("missing") || text.startsWith("not configured")) {
                ConsoleOutput.error(label);
            } else {
                ConsoleOutput.success(label);
            }
        });

        System.out.println("──────────────────────────────────");
        if (Status.UP.equals(health.getStatus())) {
            ConsoleOutput.success("Overall: all runtimes available");
            return CodeActCommand.EXIT_DONE;
        }
        ConsoleOutput.error("Overall: " + health.getStatus().getCode());
        return CodeActCommand.EXIT_ABORTED;
    }
}
