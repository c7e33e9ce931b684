package com.codeact.core.model;

import java.util.List;

/**
 * Everything sent to the model for one generation: the system prompt and the
 * conversation so far.
 */
public record PromptPayload(
    String systemPrompt,
    List<Turn> history
) {

    public PromptPayload {
        history = List.copyOf(history);
    }
}
