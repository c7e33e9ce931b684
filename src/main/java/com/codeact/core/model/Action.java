package com.codeact.core.model;

import java.io.Serializable;

/**
 * A code snippet the model asked to run in a specific runtime.
 */
public record Action(
    RuntimeKind runtime,
    String source
) implements Serializable {}
