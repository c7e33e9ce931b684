package com.codeact.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle and reports the command's exit code.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final CodeActCommand codeActCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(CodeActCommand codeActCommand, IFactory factory) {
        this.codeActCommand = codeActCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(codeActCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
