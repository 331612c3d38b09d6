package io.routeflow.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * All connector messages sharing one {@code messageId}, keyed and iterated by {@code metaDataId} in ascending order.
 * The source connector message lives at key {@code 0}.
 */
public final class Message {

    private final long messageId;
    private final String channelId;
    private final Instant receivedDate;
    private final Map<Integer, ConnectorMessage> connectorMessages = new TreeMap<>();

    public Message(long messageId, String channelId, Instant receivedDate) {
        this.messageId = messageId;
        this.channelId = Objects.requireNonNull(channelId, "channelId must not be null");
        this.receivedDate = receivedDate != null ? receivedDate : Instant.now();
    }

    /** Creates the aggregate around an existing source connector message. */
    public static Message ofSource(ConnectorMessage source) {
        Message message = new Message(source.messageId(), source.channelId(), source.receivedDate());
        message.put(source);
        return message;
    }

    public long messageId() {
        return messageId;
    }

    public String channelId() {
        return channelId;
    }

    public Instant receivedDate() {
        return receivedDate;
    }

    /**
     * Adds or replaces the connector message at its {@code metaDataId}.
     *
     * @throws IllegalArgumentException if the connector message belongs to another message id
     */
    public void put(ConnectorMessage connectorMessage) {
        if (connectorMessage.messageId() != messageId) {
            throw new IllegalArgumentException("Connector message " + connectorMessage.messageId()
                    + " does not belong to message " + messageId);
        }
        connectorMessages.put(connectorMessage.metaDataId(), connectorMessage);
    }

    public Optional<ConnectorMessage> get(int metaDataId) {
        return Optional.ofNullable(connectorMessages.get(metaDataId));
    }

    public Optional<ConnectorMessage> source() {
        return get(0);
    }

    /**
     * Returns the source connector message.
     *
     * @throws IllegalStateException if no source connector message was recorded
     */
    public ConnectorMessage requireSource() {
        return source().orElseThrow(
                () -> new IllegalStateException("Message " + messageId + " has no source connector message"));
    }

    /** Read-only view ordered by {@code metaDataId}. */
    public Map<Integer, ConnectorMessage> connectorMessages() {
        return Collections.unmodifiableMap(connectorMessages);
    }

    /** Number of recorded connector messages with {@code metaDataId > 0}. */
    public int destinationCount() {
        return (int) connectorMessages.keySet().stream().filter(id -> id > 0).count();
    }
}
