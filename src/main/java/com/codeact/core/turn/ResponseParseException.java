package com.codeact.core.turn;

/**
 * Thrown when model output does not follow the response block grammar.
 * The message is phrased so it can be shown back to the model.
 */
public class ResponseParseException extends RuntimeException {

    public ResponseParseException(String message) {
        super(message);
    }
}
