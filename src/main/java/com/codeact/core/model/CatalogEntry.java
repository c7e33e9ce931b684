package com.codeact.core.model;

import java.io.Serializable;

/**
 * A tool, dataset, library or knowledge item the model may be told about.
 *
 * @param nonCommercial true when the licence excludes commercial use
 */
public record CatalogEntry(
    String name,
    String description,
    ResourceCategory category,
    boolean nonCommercial
) implements Serializable {}
