package io.routeflow.core.pipeline;

import io.routeflow.core.sandbox.EngineRegistry;
import io.routeflow.core.sandbox.ScriptBudget;
import io.routeflow.core.sandbox.ScriptSandbox;

/**
 * Process-wide pipeline settings.
 *
 * @param scriptTimeoutMs wall-clock budget of one script call (default 30000)
 * @param workerThreads   size of the payload worker pool (default 4)
 * @param serverId        identifier stamped on every connector message
 */
public record PipelineSettings(long scriptTimeoutMs, int workerThreads, String serverId) {

    public static final long DEFAULT_SCRIPT_TIMEOUT_MS = 30_000;
    public static final int DEFAULT_WORKER_THREADS = 4;
    public static final String DEFAULT_SERVER_ID = "routeflow";

    public static final PipelineSettings DEFAULTS =
            new PipelineSettings(DEFAULT_SCRIPT_TIMEOUT_MS, DEFAULT_WORKER_THREADS, DEFAULT_SERVER_ID);

    public PipelineSettings {
        if (scriptTimeoutMs <= 0) {
            throw new IllegalArgumentException("scriptTimeoutMs must be positive, got: " + scriptTimeoutMs);
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be positive, got: " + workerThreads);
        }
        serverId = serverId != null && !serverId.isBlank() ? serverId : DEFAULT_SERVER_ID;
    }

    public ScriptBudget scriptBudget() {
        return new ScriptBudget(scriptTimeoutMs);
    }

    /** Sandbox whose scripts run under {@link #scriptTimeoutMs}. */
    public ScriptSandbox openSandbox(EngineRegistry engines) {
        return new ScriptSandbox(engines, scriptBudget());
    }
}
