package io.routeflow.core.error;

import io.routeflow.core.model.ErrorKind;

/**
 * Abstract parent for failures of a single sandboxed script call. Callers convert these into an
 * {@link io.routeflow.core.model.Status#ERROR} status on the affected message and carry on with the next one.
 */
public abstract class ScriptException extends PipelineException {

    private static final long serialVersionUID = 1L;

    private final String scriptName;

    protected ScriptException(String message, String scriptName) {
        super(message, Phase.EXECUTION);
        this.scriptName = scriptName;
    }

    protected ScriptException(String message, Throwable cause, String scriptName) {
        super(message, cause, Phase.EXECUTION);
        this.scriptName = scriptName;
    }

    /** Name of the rule, step or batch script that failed, or {@code null} if not known. */
    public String scriptName() {
        return scriptName;
    }

    /** The error kind recorded on the message. */
    public abstract ErrorKind kind();
}
