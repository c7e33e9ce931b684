package com.codeact.dispatch.cli;

import com.codeact.core.engine.AgentEngine;
import com.codeact.core.engine.AgentRunConfig;
import com.codeact.core.engine.TranscriptWriter;
import com.codeact.core.events.EventBus;
import com.codeact.core.model.Transcript;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * CLI command: codeact run "&lt;task&gt;"
 * <p>
 * Runs one task through the agent loop and prints the outcome. Exits with 0 when the
 * task is done, 2 when it was aborted and 3 when the run itself failed.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a task",
        exitCodeOnInvalidInput = CodeActCommand.EXIT_USAGE,
        exitCodeOnExecutionException = CodeActCommand.EXIT_FAILURE)
@Component
public class RunCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Natural language task")
    private String task;

    @Option(names = "--critique", description = "Review final answers before accepting them")
    private Boolean critique;

    @Option(names = "--max-iterations", description = "Generations allowed before the task aborts")
    private Integer maxIterations;

    @Option(names = "--timeout-seconds", description = "Wall-clock limit per code snippet")
    private Integer timeoutSeconds;

    @Option(names = "--no-selector", description = "Skip resource selection and use the fallback subset")
    private boolean noSelector;

    @Option(names = "--transcript", description = "Write the JSON transcript to this file")
    private Path transcriptFile;

    @Option(names = {"--watch", "-w"}, description = "Print task events as they happen")
    private boolean watch;

    private final AgentEngine agentEngine;
    private final AgentRunConfig defaultRunConfig;
    private final TranscriptWriter transcriptWriter;
    private final EventBus eventBus;

    public RunCommand(AgentEngine agentEngine, AgentRunConfig defaultRunConfig,
                      TranscriptWriter transcriptWriter, EventBus eventBus) {
        this.agentEngine = agentEngine;
        this.defaultRunConfig = defaultRunConfig;
        this.transcriptWriter = transcriptWriter;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        AgentRunConfig config = runConfig();
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Working on: " + task);

        EventBus.Subscription subscription = watch ? eventBus.subscribeAll(ConsoleOutput::watchEvent) : null;
        Transcript transcript;
        try {
            transcript = agentEngine.run(task, config);
        } catch (RuntimeException e) {
            ConsoleOutput.error("Task failed: " + rootCauseMessage(e));
            return CodeActCommand.EXIT_FAILURE;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        ConsoleOutput.summary(transcript);
        if (transcriptFile != null) {
            transcriptWriter.write(transcript, transcriptFile);
            ConsoleOutput.info("Transcript written to " + transcriptFile);
        }
        return transcript.isDone() ? CodeActCommand.EXIT_DONE : CodeActCommand.EXIT_ABORTED;
    }

    AgentRunConfig runConfig() {
        if (task == null || task.isBlank()) {
            throw new ParameterException(spec.commandLine(), "Task must not be blank");
        }
        AgentRunConfig config = defaultRunConfig;
        if (critique != null) {
            config = config.withCritiqueEnabled(critique);
        }
        if (maxIterations != null) {
            if (maxIterations < 1) {
                throw new ParameterException(spec.commandLine(), "--max-iterations must be at least 1");
            }
            config = config.withMaxIterations(maxIterations);
        }
        if (timeoutSeconds != null) {
            if (timeoutSeconds < 1) {
                throw new ParameterException(spec.commandLine(), "--timeout-seconds must be at least 1");
            }
            config = config.withExecutionTimeout(Duration.ofSeconds(timeoutSeconds));
        }
        if (noSelector) {
            config = config.withResourceSelector(false);
        }
        return config;
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
