package io.routeflow.core.executor;

import io.routeflow.core.model.ConnectorMessage;
import io.routeflow.core.model.Status;
import java.time.Instant;

/** Read-only identity of the connector message, bound as {@code message} in filter and transformer scripts. */
public record MessageView(
        long messageId,
        int metaDataId,
        String channelId,
        String channelName,
        String connectorName,
        String serverId,
        Instant receivedDate,
        Status status) {

    public static MessageView of(ConnectorMessage message) {
        return new MessageView(
                message.messageId(),
                message.metaDataId(),
                message.channelId(),
                message.channelName(),
                message.connectorName(),
                message.serverId(),
                message.receivedDate(),
                message.status());
    }
}
