package io.routeflow.core.executor;

import io.routeflow.core.error.PipelineException;
import io.routeflow.core.error.ScriptException;
import io.routeflow.core.model.ConnectorMessage;
import io.routeflow.core.model.ContentType;
import io.routeflow.core.model.ErrorKind;
import io.routeflow.core.model.ProcessingError;
import io.routeflow.core.model.ScriptStep;
import io.routeflow.core.model.StepType;
import io.routeflow.core.sandbox.ScriptSandbox;
import io.routeflow.core.spi.CompiledScript;
import io.routeflow.core.spi.TelemetryListener;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sandboxed script calls against one connector message, shared by the executors of this package. Each call runs
 * inside its own {@link MapScope} and reports to the telemetry listener.
 */
final class ScriptInvoker {

    private static final Logger LOG = LoggerFactory.getLogger(ScriptInvoker.class);

    private final ScriptSandbox sandbox;
    private final TelemetryListener telemetryListener;
    private final ErrorPayloadBuilder errorPayloads = new ErrorPayloadBuilder();

    ScriptInvoker(ScriptSandbox sandbox, TelemetryListener telemetryListener) {
        this.sandbox = Objects.requireNonNull(sandbox, "sandbox must not be null");
        this.telemetryListener = telemetryListener; // nullable
    }

    /**
     * One sandboxed script call. Map changes (and, for mapper steps, the result stored under {@code mapperKey}) are
     * committed to the message only after the script returned normally.
     */
    Object call(
            String scriptName,
            String lang,
            String source,
            String mapperKey,
            String content,
            ConnectorMessage message,
            Map<String, ?> extras) {
        long start = System.nanoTime();
        try {
            CompiledScript compiled = sandbox.compile(lang, source, scriptName);
            MapScope scope = MapScope.open(message);
            Object value = sandbox.run(compiled, scope.bindings(content, message, extras), scriptName);
            if (mapperKey != null) {
                scope.channelMap().put(mapperKey, value);
            }
            scope.commit(message);
            notifyScriptCompleted(message, scriptName, elapsedMs(start));
            return value;
        } catch (ScriptException e) {
            notifyScriptFailed(message, scriptName, e, elapsedMs(start));
            throw e;
        }
    }

    /**
     * Runs enabled transformer steps in order.
     *
     * @return the working content after the last message builder
     */
    String runSteps(List<ScriptStep> steps, String working, ConnectorMessage message, Map<String, ?> extras) {
        String content = working;
        for (ScriptStep step : steps) {
            if (!step.enabled()) {
                continue;
            }
            String mapperKey = step.type() == StepType.MAPPER ? step.name() : null;
            Object value = call(stepLabel(step), step.lang(), step.script(), mapperKey, content, message, extras);
            if (step.type() == StepType.MESSAGE_BUILDER && value != null) {
                content = FilterTransformerExecutor.asContent(value, stepLabel(step));
            }
        }
        return content;
    }

    /**
     * Logs a failure and stores its JSON payload in {@code slot}.
     *
     * @return the structured failure
     */
    ProcessingError recordFailure(
            ConnectorMessage message, ContentType slot, ErrorKind kind, String source, PipelineException e) {
        ProcessingError error = new ProcessingError(kind, source, e.getMessage());
        LOG.warn(
                "message.failed channelId={} messageId={} metaDataId={} slot={} kind={} source={} detail={}",
                message.channelId(),
                message.messageId(),
                message.metaDataId(),
                slot,
                kind,
                source,
                e.getMessage());
        message.setContent(slot, errorPayloads.build(error, e.urn(), message), ErrorPayloadBuilder.DATA_TYPE);
        return error;
    }

    static String stepLabel(ScriptStep step) {
        return "transformer step '" + step.name() + "'";
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    // --- Telemetry ---

    private void notifyScriptCompleted(ConnectorMessage message, String scriptName, long durationMs) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onScriptCompleted(new TelemetryListener.ScriptCompletedEvent(
                    message.channelId(), message.metaDataId(), scriptName, durationMs));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onScriptCompleted failed", e);
        }
    }

    private void notifyScriptFailed(ConnectorMessage message, String scriptName, ScriptException cause, long durationMs) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onScriptFailed(new TelemetryListener.ScriptFailedEvent(
                    message.channelId(), message.metaDataId(), scriptName, cause.kind(), durationMs, cause.getMessage()));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onScriptFailed failed", e);
        }
    }

    void notifyMessageFinished(ConnectorMessage message) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onMessageFinished(new TelemetryListener.MessageFinishedEvent(
                    message.channelId(), message.messageId(), message.metaDataId(), message.status()));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onMessageFinished failed", e);
        }
    }
}
