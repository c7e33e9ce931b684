package com.codeact.core.resources;

/**
 * Thrown when the resource catalog cannot be read or is malformed.
 */
public class CatalogLoadException extends RuntimeException {

    public CatalogLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
