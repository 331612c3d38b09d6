package io.routeflow.core.error;

/**
 * Abstract base for all routeflow exceptions. Never thrown directly; use {@link ConfigurationException} or one of
 * the {@link ScriptException} subtypes.
 */
public abstract class PipelineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        CONFIGURATION,
        EXECUTION
    }

    private final Phase phase;

    protected PipelineException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected PipelineException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }

    /** Stable error type identifier, e.g. {@code urn:routeflow:error:script-timeout}. */
    public abstract String urn();
}
