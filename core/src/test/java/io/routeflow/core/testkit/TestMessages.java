package io.routeflow.core.testkit;

import io.routeflow.core.model.ConnectorMessage;
import io.routeflow.core.model.ContentType;
import io.routeflow.core.model.Message;
import io.routeflow.core.model.Status;
import java.time.Instant;

/** Builders for connector messages and messages used across tests. */
public final class TestMessages {

    public static final String CHANNEL_ID = "test-channel";

    private TestMessages() {}

    /** Source connector message holding {@code raw} as XML content. */
    public static ConnectorMessage source(long messageId, String raw) {
        ConnectorMessage source = new ConnectorMessage(
                messageId, 0, CHANNEL_ID, "Test Channel", "Source", "test-server", Instant.now(), Status.RECEIVED);
        source.setContent(ContentType.RAW, raw, "XML");
        return source;
    }

    public static ConnectorMessage source(String raw) {
        return source(1L, raw);
    }

    /** Destination connector message with the given status. */
    public static ConnectorMessage destination(long messageId, int metaDataId, Status status) {
        return new ConnectorMessage(
                messageId,
                metaDataId,
                CHANNEL_ID,
                "Test Channel",
                "Destination " + metaDataId,
                "test-server",
                Instant.now(),
                status);
    }

    /** Message with a transformed source and one destination per status, at metaDataIds {@code 1..N}. */
    public static Message withDestinations(Status... destinationStatuses) {
        ConnectorMessage source = source(1L, "payload");
        source.setStatus(Status.TRANSFORMED);
        Message message = Message.ofSource(source);
        for (int i = 0; i < destinationStatuses.length; i++) {
            message.put(destination(1L, i + 1, destinationStatuses[i]));
        }
        return message;
    }
}
