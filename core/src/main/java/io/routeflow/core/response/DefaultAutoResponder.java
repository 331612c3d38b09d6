package io.routeflow.core.response;

import io.routeflow.core.model.ConnectorMessage;
import io.routeflow.core.model.ProcessingError;
import io.routeflow.core.model.Response;
import io.routeflow.core.model.Status;
import io.routeflow.core.spi.AutoResponder;

/** Plain status acknowledgements, used for data types that define no acknowledgement format of their own. */
public final class DefaultAutoResponder implements AutoResponder {

    @Override
    public Response getResponse(Status status, String rawContent, ConnectorMessage connectorMessage) {
        return switch (status) {
            case RECEIVED -> new Response(Status.RECEIVED, "", "Message received", null);
            case FILTERED -> Response.filtered();
            case QUEUED -> Response.queued();
            case ERROR -> Response.error(errorDetail(connectorMessage));
            default -> Response.sent();
        };
    }

    private static String errorDetail(ConnectorMessage connectorMessage) {
        if (connectorMessage == null) {
            return "Processing error";
        }
        return connectorMessage
                .processingError()
                .map(ProcessingError::detail)
                .orElse("Processing error");
    }
}
