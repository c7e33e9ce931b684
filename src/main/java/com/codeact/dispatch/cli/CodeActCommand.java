package com.codeact.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command. Routes to subcommands: run, catalog, health.
 */
@Command(
        name = "codeact",
        mixinStandardHelpOptions = true,
        version = "CodeAct 0.1.0",
        description = "Autonomous agent that solves tasks by writing and running code",
        exitCodeOnInvalidInput = CodeActCommand.EXIT_USAGE,
        exitCodeOnExecutionException = CodeActCommand.EXIT_FAILURE,
        subcommands = {
                RunCommand.class,
                CatalogCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CodeActCommand implements Runnable {

    static final int EXIT_DONE = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_ABORTED = 2;
    /** The run itself failed, for example the transcript could not be written. */
    static final int EXIT_FAILURE = 3;

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
