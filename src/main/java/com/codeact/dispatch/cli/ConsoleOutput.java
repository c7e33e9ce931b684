package com.codeact.dispatch.cli;

import com.codeact.core.events.AgentEvent;
import com.codeact.core.model.CatalogEntry;
import com.codeact.core.model.Transcript;
import picocli.CommandLine;

import java.time.Duration;

/**
 * ANSI-colored terminal output utilities for the CodeAct CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CODEACT v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CODEACT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void catalogEntry(CatalogEntry entry) {
        String flag = entry.nonCommercial() ? " @|fg(red) (non-commercial)|@" : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + entry.name() + "|@" + flag + ": " + entry.description()));
    }

    public static void watchEvent(AgentEvent event) {
        String prefix = switch (event.eventType()) {
            case "task.started" -> "@|fg(cyan) [TASK]|@";
            case "resources.selected" -> "@|fg(magenta) [RESOURCES]|@";
            case "turn.generated" -> "@|fg(blue) [MODEL]|@";
            case "action.executed" -> "@|fg(yellow) [EXEC]|@";
            case "critique.completed" -> "@|fg(magenta) [CRITIC]|@";
            case "task.completed" -> "@|fg(green),bold [DONE]|@";
            case "task.aborted" -> "@|fg(red),bold [ABORTED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + event.payload()));
    }

    public static void summary(Transcript transcript) {
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Task " + transcript.taskId() + "|@"));
        System.out.println("  Iterations: " + transcript.iterations()
                + (transcript.critiqueRounds() > 0 ? " (critique rounds: " + transcript.critiqueRounds() + ")" : ""));
        System.out.println("  Resources: " + (transcript.selectedResources().isEmpty()
                ? "none"
                : String.join(", ", transcript.selectedResources()))
                + (transcript.selectionFallback() ? " (fallback)" : ""));
        System.out.println("  Duration: "
                + formatDuration(Duration.between(transcript.startedAt(), transcript.finishedAt()).toMillis()));
        System.out.println();
        if (transcript.isDone()) {
            success("Final answer:");
            System.out.println(transcript.finalAnswer());
        } else {
            error("Aborted: " + transcript.abortReason().code()
                    + (transcript.abortDetail() == null || transcript.abortDetail().isBlank()
                    ? "" : " (" + transcript.abortDetail() + ")"));
            if (transcript.partialAnswer() != null && !transcript.partialAnswer().isBlank()) {
                info("Partial answer:");
                System.out.println(transcript.partialAnswer());
            }
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
