package com.codeact.sandbox;

import com.codeact.core.model.RuntimeKind;

/**
 * Thrown when a runtime cannot be started at all (missing interpreter, permission
 * denied, container engine unreachable). Distinct from code that ran and failed.
 */
public class RuntimeLaunchException extends RuntimeException {

    private final RuntimeKind runtime;

    public RuntimeLaunchException(RuntimeKind runtime, String message, Throwable cause) {
        super(message, cause);
        this.runtime = runtime;
    }

    public RuntimeKind runtime() {
        return runtime;
    }
}
