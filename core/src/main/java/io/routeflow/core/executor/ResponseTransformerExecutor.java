package io.routeflow.core.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.routeflow.core.error.PipelineException;
import io.routeflow.core.error.ScriptException;
import io.routeflow.core.error.SerializationException;
import io.routeflow.core.model.ConnectorMessage;
import io.routeflow.core.model.ContentType;
import io.routeflow.core.model.ErrorKind;
import io.routeflow.core.model.ProcessingError;
import io.routeflow.core.model.Response;
import io.routeflow.core.model.ScriptStep;
import io.routeflow.core.model.Status;
import io.routeflow.core.sandbox.ScriptSandbox;
import io.routeflow.core.spi.Serializer;
import io.routeflow.core.spi.TelemetryListener;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a destination's response transformer to the response its dispatcher received, and records the outcome on
 * the destination connector message.
 *
 * <p>The raw reply goes to {@code RESPONSE}. When the transformer has enabled steps and there is something to
 * transform (a non-empty reply, or an inbound type that needs no serialization), the steps run like transformer steps
 * over the reply, and the result is stored as {@code RESPONSE_TRANSFORMED}. Besides the usual bindings the steps see
 * {@code response}, {@code responseStatus}, {@code responseStatusMessage} and {@code responseErrorMessage}. A
 * non-empty final reply is stored as {@code PROCESSED_RESPONSE}, a JSON document of the four response fields.
 *
 * <p>With queueing enabled an {@code ERROR} reply becomes {@code QUEUED}. The final reply sets the destination's status
 * and is put into its response map under the connector name. A failing step leaves the destination in
 * {@code ERROR} with its failure in {@code RESPONSE_ERROR}.
 *
 * <p>Thread-safe.
 */
public final class ResponseTransformerExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(ResponseTransformerExecutor.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SerializerRegistry serializers;
    private final ScriptInvoker scripts;

    /**
     * @param sandbox           runs every script call
     * @param serializers       serializers by data type
     * @param telemetryListener optional listener, may be null
     */
    public ResponseTransformerExecutor(
            ScriptSandbox sandbox, SerializerRegistry serializers, TelemetryListener telemetryListener) {
        this.serializers = Objects.requireNonNull(serializers, "serializers must not be null");
        this.scripts = new ScriptInvoker(sandbox, telemetryListener);
    }

    /**
     * @param transformer  the destination's response transformer; only its steps and data types are used
     * @param destination  the destination connector message that was dispatched
     * @param response     what the dispatcher got back
     * @param queueEnabled whether the destination queues failed sends
     * @return the response recorded on the destination
     */
    public Response execute(
            FilterTransformer transformer, ConnectorMessage destination, Response response, boolean queueEnabled) {
        Objects.requireNonNull(transformer, "transformer must not be null");
        Objects.requireNonNull(destination, "destination must not be null");
        Objects.requireNonNull(response, "response must not be null");

        destination.setContent(ContentType.RESPONSE, response.message(), transformer.inboundDataType());
        Response processed;
        try {
            processed = transform(transformer, destination, fixStatus(response, queueEnabled));
        } catch (ScriptException e) {
            processed = fail(destination, e.kind(), e.scriptName(), e);
        } catch (SerializationException e) {
            processed = fail(destination, ErrorKind.SERIALIZATION, "serializer " + e.dataType(), e);
        }

        destination.setStatus(processed.status());
        destination.responseMap().put(destination.connectorName(), processed);
        scripts.notifyMessageFinished(destination);
        LOG.debug(
                "response.recorded channelId={} metaDataId={} status={}",
                destination.channelId(),
                destination.metaDataId(),
                processed.status());
        return processed;
    }

    private Response transform(FilterTransformer transformer, ConnectorMessage destination, Response response) {
        Serializer inbound = serializers.forDataType(transformer.inboundDataType());
        boolean serialize = inbound.isSerializationRequired(true);
        Response current = response;
        if (hasEnabledSteps(transformer) && (!response.message().isEmpty() || !serialize)) {
            String working = response.message();
            if (serialize) {
                working = inbound.toXml(working);
                destination.setContent(ContentType.RESPONSE_TRANSFORMED, working, transformer.inboundDataType());
            }
            working = scripts.runSteps(transformer.steps(), working, destination, bindingsFor(response));
            destination.setContent(ContentType.RESPONSE_TRANSFORMED, working, transformer.outboundDataType());

            Serializer outbound = serializers.forDataType(transformer.outboundDataType());
            String content = outbound.isSerializationRequired(false) ? outbound.fromXml(working) : working;
            current = new Response(response.status(), content, response.statusMessage(), response.error());
        }
        if (!current.message().isEmpty()) {
            destination.setContent(
                    ContentType.PROCESSED_RESPONSE, render(current), transformer.outboundDataType());
        }
        return current;
    }

    private Response fail(ConnectorMessage destination, ErrorKind kind, String source, PipelineException e) {
        ProcessingError error = scripts.recordFailure(destination, ContentType.RESPONSE_ERROR, kind, source, e);
        destination.setProcessingError(error);
        return Response.error(error.toString());
    }

    private static Response fixStatus(Response response, boolean queueEnabled) {
        if (queueEnabled && response.status() == Status.ERROR) {
            return new Response(Status.QUEUED, response.message(), response.statusMessage(), response.error());
        }
        return response;
    }

    private static boolean hasEnabledSteps(FilterTransformer transformer) {
        return transformer.steps().stream().anyMatch(ScriptStep::enabled);
    }

    private static Map<String, Object> bindingsFor(Response response) {
        Map<String, Object> extras = new LinkedHashMap<>();
        extras.put("response", response);
        extras.put("responseStatus", response.status());
        extras.put("responseStatusMessage", response.statusMessage());
        extras.put("responseErrorMessage", response.error());
        return extras;
    }

    private static String render(Response response) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("status", response.status().name());
        node.put("message", response.message());
        node.put("statusMessage", response.statusMessage());
        node.put("error", response.error());
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render response", e);
        }
    }
}
