package io.routeflow.core.sandbox;

/**
 * Wall-clock budget for one script call. Immutable and thread-safe.
 *
 * @param timeoutMs maximum wall-clock time in milliseconds before the call is aborted (default: 30s)
 */
public record ScriptBudget(long timeoutMs) {

    /** Default budget: 30 seconds per call. */
    public static final ScriptBudget DEFAULT = new ScriptBudget(30_000);

    public ScriptBudget {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive, got: " + timeoutMs);
        }
    }
}
