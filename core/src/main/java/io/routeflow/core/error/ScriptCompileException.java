package io.routeflow.core.error;

import io.routeflow.core.model.ErrorKind;

/**
 * Thrown when a script fails to compile (syntax error, unknown engine). URN:
 * {@code urn:routeflow:error:script-compile}
 */
public final class ScriptCompileException extends ScriptException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:routeflow:error:script-compile";

    public ScriptCompileException(String message, String scriptName) {
        super(message, scriptName);
    }

    public ScriptCompileException(String message, Throwable cause, String scriptName) {
        super(message, cause, scriptName);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SCRIPT_COMPILE;
    }

    @Override
    public String urn() {
        return URN;
    }
}
