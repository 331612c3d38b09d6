package io.routeflow.core.spi;

import io.routeflow.core.model.ConnectorMessage;
import io.routeflow.core.model.Response;
import io.routeflow.core.model.Status;

/** Builds a reply for the source connector from an overall status, e.g. an HL7 ACK/NACK. */
@FunctionalInterface
public interface AutoResponder {

    /**
     * @param status           the overall status the reply must report
     * @param rawContent       the raw inbound content, never null
     * @param connectorMessage the source message, or the merged view of all connectors; read-only by convention
     * @return the reply, never null
     */
    Response getResponse(Status status, String rawContent, ConnectorMessage connectorMessage);
}
