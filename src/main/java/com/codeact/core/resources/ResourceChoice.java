package com.codeact.core.resources;

import java.util.List;

/**
 * Structured reply of the selection call: catalog names, most relevant first.
 */
public record ResourceChoice(
    List<String> names
) {}
