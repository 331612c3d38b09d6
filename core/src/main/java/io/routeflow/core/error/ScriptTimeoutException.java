package io.routeflow.core.error;

import io.routeflow.core.model.ErrorKind;

/**
 * Thrown when a script call exceeds its wall-clock budget and is aborted. URN:
 * {@code urn:routeflow:error:script-timeout}
 */
public final class ScriptTimeoutException extends ScriptException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:routeflow:error:script-timeout";

    private final long timeoutMs;

    public ScriptTimeoutException(String message, String scriptName, long timeoutMs) {
        super(message, scriptName);
        this.timeoutMs = timeoutMs;
    }

    /** The budget that was exceeded, in milliseconds. */
    public long timeoutMs() {
        return timeoutMs;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SCRIPT_TIMEOUT;
    }

    @Override
    public String urn() {
        return URN;
    }
}
