package com.codeact.sandbox;

import com.codeact.core.model.RuntimeKind;

/**
 * Thrown when the script file or scratch directory for a snippet cannot be prepared,
 * typically because an earlier snippet damaged the working directory.
 */
public class SnippetSetupException extends RuntimeLaunchException {

    public SnippetSetupException(RuntimeKind runtime, String message, Throwable cause) {
        super(runtime, message, cause);
    }
}
