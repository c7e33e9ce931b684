package com.codeact.core.turn;

import com.codeact.core.cancellation.CancellationToken;
import com.codeact.core.llm.LlmService;
import com.codeact.core.model.Action;
import com.codeact.core.model.ExecutionRequest;
import com.codeact.core.model.ExecutionResult;
import com.codeact.core.model.PromptPayload;
import com.codeact.core.model.StructuredResponse;
import com.codeact.sandbox.ExecutionHarness;
import com.codeact.sandbox.RuntimeLaunchException;
import com.codeact.sandbox.SnippetSetupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Drives one step of the loop: ask the model, parse the reply, and run the action it
 * proposes. Generation and execution are exposed separately so the graph can model
 * them as distinct states; {@link #runTurn} composes both.
 */
@Service
public class TurnController {

    private static final Logger log = LoggerFactory.getLogger(TurnController.class);

    private final LlmService llmService;
    private final ResponseParser parser;
    private final ExecutionHarness harness;

    public TurnController(LlmService llmService, ResponseParser parser, ExecutionHarness harness) {
        this.llmService = llmService;
        this.parser = parser;
        this.harness = harness;
    }

    /**
     * Asks the model for the next step. Provider errors and cancellation propagate;
     * a malformed reply does not, it is returned as a failed {@link Generation}.
     */
    public Generation generate(PromptPayload payload, CancellationToken token) {
        String raw = llmService.complete(payload, token);
        try {
            StructuredResponse response = parser.parse(raw);
            log.debug("Model replied with {}", response.kind());
            return Generation.parsed(raw, response);
        } catch (ResponseParseException e) {
            log.info("Model reply could not be parsed: {}", e.getMessage());
            return Generation.failed(raw, e.getMessage());
        }
    }

    /**
     * Runs the action. A runtime that cannot be launched becomes an observation so the
     * model can choose another runtime; so does a snippet whose files cannot be written.
     */
    public ActionOutcome execute(Action action, int ignoredActions, Duration timeout,
                                 CancellationToken token, Path workingDirectory) {
        try {
            ExecutionResult result = harness.execute(ExecutionRequest.of(action, timeout, workingDirectory), token);
            log.info("{} snippet finished: exit={} timedOut={} ({}ms)",
                    action.runtime().tag(), result.exitStatus(), result.timedOut(), result.durationMs());
            return new ActionOutcome(result, ObservationFormatter.execution(result, timeout, ignoredActions));
        } catch (SnippetSetupException e) {
            log.warn("Could not prepare {} snippet: {}", action.runtime().tag(), e.getMessage());
            return new ActionOutcome(null, ObservationFormatter.setupFailure(e.getMessage()));
        } catch (RuntimeLaunchException e) {
            return new ActionOutcome(null, ObservationFormatter.launchFailure(action.runtime(), e.getMessage()));
        }
    }

    public TurnOutcome runTurn(PromptPayload payload, Duration timeout, CancellationToken token, Path workingDirectory) {
        Generation generation = generate(payload, token);
        if (generation.isParsed() && generation.response().isAction()) {
            StructuredResponse response = generation.response();
            return new TurnOutcome(generation,
                    execute(response.action(), response.ignoredActions(), timeout, token, workingDirectory));
        }
        return new TurnOutcome(generation, null);
    }
}
