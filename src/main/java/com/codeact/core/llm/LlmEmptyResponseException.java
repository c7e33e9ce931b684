package com.codeact.core.llm;

/**
 * Thrown when the LLM returns null or blank content where a structured reply was required.
 */
public class LlmEmptyResponseException extends RuntimeException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
