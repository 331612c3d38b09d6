package io.routeflow.core.spi;

import io.routeflow.core.model.ErrorKind;
import io.routeflow.core.model.Status;

/**
 * Observability hook for the filter/transformer executor.
 *
 * <p>Adapters bridge these events to metrics or tracing systems; the core has no telemetry dependency. All methods
 * receive immutable event objects. Implementations MUST be thread-safe and non-blocking. Exceptions thrown by
 * listeners are caught and logged; they do NOT affect message processing.
 */
public interface TelemetryListener {

    /** Called after a rule, step or preprocessor script returned normally. */
    void onScriptCompleted(ScriptCompletedEvent event);

    /** Called after a rule, step or preprocessor script failed to compile, threw, or timed out. */
    void onScriptFailed(ScriptFailedEvent event);

    /** Called once per connector message when the executor has set its final status. */
    void onMessageFinished(MessageFinishedEvent event);

    // --- Event records ---

    /** Event emitted when a script call completes. */
    record ScriptCompletedEvent(String channelId, int metaDataId, String scriptName, long durationMs) {}

    /** Event emitted when a script call fails. */
    record ScriptFailedEvent(
            String channelId, int metaDataId, String scriptName, ErrorKind kind, long durationMs, String detail) {}

    /** Event emitted when a connector message leaves the executor. */
    record MessageFinishedEvent(String channelId, long messageId, int metaDataId, Status status) {}
}
