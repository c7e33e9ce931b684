package com.codeact.core.turn;

import com.codeact.core.model.ExecutionResult;
import com.codeact.core.model.RuntimeKind;

import java.time.Duration;
import java.util.Locale;

/**
 * Renders execution results and loop errors as observation text for the model.
 */
public final class ObservationFormatter {

    private ObservationFormatter() {}

    public static String execution(ExecutionResult result, Duration timeout, int ignoredActions) {
        var sb = new StringBuilder();
        sb.append("Exit status: ").append(result.exitStatus())
          .append(" (").append(String.format(Locale.ROOT, "%.2f", result.durationMs() / 1000.0)).append("s)\n");
        if (result.timedOut()) {
            sb.append("[timed out after ").append(timeout.toSeconds()).append("s; the process was killed]\n");
        } else if (result.killed()) {
            sb.append("[the process was killed before it finished]\n");
        }
        sb.append("[stdout]\n").append(result.stdout().isEmpty() ? "(empty)" : result.stdout());
        if (!result.stdout().endsWith("\n")) {
            sb.append('\n');
        }
        if (!result.stderr().isEmpty()) {
            sb.append("[stderr]\n").append(result.stderr());
            if (!result.stderr().endsWith("\n")) {
                sb.append('\n');
            }
        }
        if (result.outputTruncated()) {
            sb.append("[output was truncated]\n");
        }
        if (ignoredActions > 0) {
            sb.append("[note: ").append(ignoredActions)
              .append(ignoredActions == 1 ? " additional <execute> block was" : " additional <execute> blocks were")
              .append(" ignored; only the first one was run]\n");
        }
        return sb.toString().stripTrailing();
    }

    public static String launchFailure(RuntimeKind runtime, String detail) {
        return "The " + runtime.tag() + " runtime could not be started: " + detail
                + "\nTry a different runtime (" + RuntimeKind.knownTags() + ").";
    }

    public static String setupFailure(String detail) {
        return "The snippet could not be prepared: " + detail
                + "\nThe working directory may have been modified by an earlier snippet; "
                + "keep the .codeact directory intact and try again.";
    }

    public static String executionError(String detail) {
        return "The snippet could not be run: " + detail;
    }

    public static String parseFailure(String reason) {
        return "Your response could not be parsed: " + reason + ".\n"
                + "Reply with exactly one <execute runtime=\"...\"> block to run code, "
                + "or one <solution> block with the final answer.";
    }

    public static String critique(String feedback) {
        return "A reviewer rejected the proposed solution:\n" + feedback
                + "\nAddress the feedback and try again.";
    }
}
