package com.codeact.core.turn;

import com.codeact.core.model.StructuredResponse;

import java.util.Optional;

/**
 * One model reply: the raw text and either the parsed response or the parse error.
 */
public record Generation(
    String raw,
    StructuredResponse response,
    String parseError
) {

    public static Generation parsed(String raw, StructuredResponse response) {
        return new Generation(raw, response, null);
    }

    public static Generation failed(String raw, String parseError) {
        return new Generation(raw, null, parseError);
    }

    public boolean isParsed() {
        return response != null;
    }

    public Optional<StructuredResponse> responseIfParsed() {
        return Optional.ofNullable(response);
    }
}
