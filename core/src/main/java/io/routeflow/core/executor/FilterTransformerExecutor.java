package io.routeflow.core.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.routeflow.core.error.PipelineException;
import io.routeflow.core.error.ScriptException;
import io.routeflow.core.error.ScriptRuntimeException;
import io.routeflow.core.error.SerializationException;
import io.routeflow.core.model.ConnectorMessage;
import io.routeflow.core.model.ContentType;
import io.routeflow.core.model.ErrorKind;
import io.routeflow.core.model.ProcessingError;
import io.routeflow.core.model.RuleOperator;
import io.routeflow.core.model.ScriptRule;
import io.routeflow.core.model.ScriptStep;
import io.routeflow.core.model.Status;
import io.routeflow.core.sandbox.ScriptSandbox;
import io.routeflow.core.spi.Serializer;
import io.routeflow.core.spi.TelemetryListener;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a connector's preprocessor, filter rules and transformer steps against one connector message.
 *
 * <p>Order of work:
 *
 * <ol>
 *   <li>the preprocessor, when configured; a non-null result is stored as {@code PROCESSED_RAW} and used as input
 *   <li>conversion to XML when the inbound serializer requires it
 *   <li>filter rules, folded left in sequence order; {@code AND} skips a rule while the running result is false,
 *       {@code OR} skips it while the running result is true, and any other evaluated rule replaces the running
 *       result
 *   <li>transformer steps in sequence order, only when accepted
 *   <li>{@code TRANSFORMED} content in the outbound data type, then {@code ENCODED} content through the outbound
 *       serializer
 * </ol>
 *
 * <p>Every script sees working copies of the message maps, written back only when the script returns normally. A rule
 * must return a boolean; anything else fails the run like a throwing rule. A failing script or serializer sets
 * {@link Status#ERROR}, attaches a {@link ProcessingError} and a JSON error payload, and stops the run; changes
 * committed by earlier scripts are kept. A rejected message is {@link Status#FILTERED}, never an error.
 *
 * <p>Source connector scripts additionally see the message's {@link DestinationSet} as {@code destinationSet}.
 *
 * <p>Thread-safe; the message itself is owned by the calling worker.
 */
public final class FilterTransformerExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(FilterTransformerExecutor.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SerializerRegistry serializers;
    private final ScriptInvoker scripts;

    public FilterTransformerExecutor(ScriptSandbox sandbox) {
        this(sandbox, new SerializerRegistry(), null);
    }

    /**
     * @param sandbox           runs every script call
     * @param serializers       serializers by data type
     * @param telemetryListener optional listener for script and message events, may be null
     */
    public FilterTransformerExecutor(
            ScriptSandbox sandbox, SerializerRegistry serializers, TelemetryListener telemetryListener) {
        this.serializers = Objects.requireNonNull(serializers, "serializers must not be null");
        this.scripts = new ScriptInvoker(sandbox, telemetryListener);
    }

    /**
     * Runs the filter and transformer and records the outcome on {@code message}: its status, content slots and, on
     * failure, its processing error.
     */
    public ExecutionResult execute(FilterTransformer config, ConnectorMessage message) {
        return execute(config, message, null);
    }

    /**
     * Same as {@link #execute(FilterTransformer, ConnectorMessage)}, binding {@code destinationSet} for the scripts of
     * a source connector.
     *
     * @param destinationSet destinations still to dispatch to, may be null
     */
    public ExecutionResult execute(FilterTransformer config, ConnectorMessage message, DestinationSet destinationSet) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Map<String, ?> extras = destinationSet != null && message.isSource()
                ? Map.of("destinationSet", destinationSet)
                : Map.of();
        ExecutionResult result;
        try {
            result = run(config, message, extras);
        } catch (ScriptException e) {
            result = fail(message, e.kind(), e.scriptName(), e);
        } catch (SerializationException e) {
            result = fail(message, ErrorKind.SERIALIZATION, "serializer " + e.dataType(), e);
        }
        message.setStatus(result.status());
        scripts.notifyMessageFinished(message);
        return result;
    }

    private ExecutionResult run(FilterTransformer config, ConnectorMessage message, Map<String, ?> extras) {
        String content = message.rawData() != null ? message.rawData() : "";
        Serializer inbound = serializers.forDataType(config.inboundDataType());
        if (message.isSource()) {
            inbound.populateMetaData(content, message.sourceMap());
        }

        ScriptStep preprocessor = config.preprocessor();
        if (preprocessor != null && preprocessor.enabled()) {
            Object processed = scripts.call(
                    preprocessor.name(), preprocessor.lang(), preprocessor.script(), null, content, message, extras);
            if (processed != null) {
                content = asContent(processed, preprocessor.name());
                message.setContent(ContentType.PROCESSED_RAW, content, config.inboundDataType());
            }
        }

        String working = inbound.isSerializationRequired(true) ? inbound.toXml(content) : content;

        if (!accept(config, working, message, extras)) {
            LOG.info("filter.rejected channelId={} metaDataId={}", message.channelId(), message.metaDataId());
            return ExecutionResult.filtered();
        }

        working = scripts.runSteps(config.steps(), working, message, extras);

        message.setContent(ContentType.TRANSFORMED, working, config.outboundDataType());
        Serializer outbound = serializers.forDataType(config.outboundDataType());
        String encoded = outbound.isSerializationRequired(false) ? outbound.fromXml(working) : working;
        message.setContent(ContentType.ENCODED, encoded, config.outboundDataType());
        LOG.debug("transformer.completed channelId={} metaDataId={}", message.channelId(), message.metaDataId());
        return ExecutionResult.transformed();
    }

    private boolean accept(FilterTransformer config, String working, ConnectorMessage message, Map<String, ?> extras) {
        Boolean running = null;
        for (ScriptRule rule : config.rules()) {
            if (!rule.enabled()) {
                continue;
            }
            if (running != null) {
                if (rule.operator() == RuleOperator.AND && !running) {
                    continue;
                }
                if (rule.operator() == RuleOperator.OR && running) {
                    continue;
                }
            }
            String label = ruleLabel(rule);
            Object value = scripts.call(label, rule.lang(), rule.script(), null, working, message, extras);
            if (!(value instanceof Boolean ruleResult)) {
                throw new ScriptRuntimeException(
                        "Filter rule must return a boolean, got: "
                                + (value == null ? "null" : value.getClass().getSimpleName() + " '" + value + "'"),
                        label);
            }
            running = combine(running, rule.operator(), ruleResult);
        }
        return running == null || running;
    }

    private static boolean combine(Boolean running, RuleOperator operator, boolean ruleResult) {
        if (running == null) {
            return ruleResult;
        }
        return switch (operator) {
            case AND -> running && ruleResult;
            case OR -> running || ruleResult;
            case NONE -> ruleResult;
        };
    }

    private ExecutionResult fail(ConnectorMessage message, ErrorKind kind, String source, PipelineException e) {
        ProcessingError error = scripts.recordFailure(message, ContentType.PROCESSING_ERROR, kind, source, e);
        message.setProcessingError(error);
        return ExecutionResult.failed(error);
    }

    /** Script results become content as-is when text, as JSON when a map or list, else via {@code toString()}. */
    static String asContent(Object value, String scriptName) {
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            try {
                return MAPPER.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new ScriptRuntimeException(
                        "Script result could not be rendered as JSON: " + e.getOriginalMessage(), e, scriptName);
            }
        }
        return String.valueOf(value);
    }

    private static String ruleLabel(ScriptRule rule) {
        return "filter rule '" + rule.name() + "'";
    }
}
