package io.routeflow.core.error;

import io.routeflow.core.model.ErrorKind;

/**
 * Thrown when a script raises an error while running (bad method call, null dereference, type mismatch). URN:
 * {@code urn:routeflow:error:script-runtime}
 */
public final class ScriptRuntimeException extends ScriptException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:routeflow:error:script-runtime";

    public ScriptRuntimeException(String message, String scriptName) {
        super(message, scriptName);
    }

    public ScriptRuntimeException(String message, Throwable cause, String scriptName) {
        super(message, cause, scriptName);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SCRIPT_RUNTIME;
    }

    @Override
    public String urn() {
        return URN;
    }
}
