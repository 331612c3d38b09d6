package io.routeflow.core.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.routeflow.core.model.ConnectorMessage;
import io.routeflow.core.model.ProcessingError;

/**
 * Renders a processing failure as the JSON document stored in the {@code PROCESSING_ERROR} content slot:
 *
 * <pre>
 * {"type": "urn:routeflow:error:script-runtime", "kind": "SCRIPT_RUNTIME", "source": "filter rule 'accept ADT'",
 *  "detail": "...", "channelId": "...", "messageId": 7, "metaDataId": 0}
 * </pre>
 *
 * <p>Thread-safe and immutable.
 */
public final class ErrorPayloadBuilder {

    /** Data type of the rendered payload. */
    public static final String DATA_TYPE = "JSON";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Builds the error payload.
     *
     * @param error   the structured failure
     * @param urn     stable error type identifier
     * @param message the connector message the failure belongs to
     * @return the JSON text
     */
    public String build(ProcessingError error, String urn, ConnectorMessage message) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("type", urn);
        payload.put("kind", error.kind().name());
        payload.put("source", error.source());
        payload.put("detail", error.detail());
        payload.put("channelId", message.channelId());
        payload.put("messageId", message.messageId());
        payload.put("metaDataId", message.metaDataId());
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            // an ObjectNode of scalars always serializes
            throw new IllegalStateException("Failed to render error payload", e);
        }
    }
}
