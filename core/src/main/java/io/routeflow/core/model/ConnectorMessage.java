package io.routeflow.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One message as seen by one connector of a channel: the source at {@code metaDataId 0}, destinations at
 * {@code 1..N}.
 *
 * <p>
 * Holds at most one {@link MessageContent} per {@link ContentType}; a later write for the same tag replaces the
 * earlier one. The four variable maps ({@code sourceMap}, {@code channelMap}, {@code connectorMap},
 * {@code responseMap}) keep insertion order and are handed to user scripts.
 *
 * <p>
 * Not thread-safe. A connector message is owned by the worker processing its payload.
 */
public final class ConnectorMessage {

    private final long messageId;
    private final int metaDataId;
    private final String channelId;
    private final String channelName;
    private final String connectorName;
    private final String serverId;
    private final Instant receivedDate;

    private Status status;
    private ProcessingError processingError;

    private final Map<ContentType, MessageContent> content = new EnumMap<>(ContentType.class);

    private final Map<String, Object> sourceMap = new LinkedHashMap<>();
    private final Map<String, Object> channelMap = new LinkedHashMap<>();
    private final Map<String, Object> connectorMap = new LinkedHashMap<>();
    private final Map<String, Object> responseMap = new LinkedHashMap<>();

    public ConnectorMessage(
            long messageId,
            int metaDataId,
            String channelId,
            String channelName,
            String connectorName,
            String serverId,
            Instant receivedDate,
            Status status) {
        if (metaDataId < 0) {
            throw new IllegalArgumentException("metaDataId must be >= 0, got: " + metaDataId);
        }
        this.messageId = messageId;
        this.metaDataId = metaDataId;
        this.channelId = Objects.requireNonNull(channelId, "channelId must not be null");
        this.channelName = channelName;
        this.connectorName = connectorName;
        this.serverId = serverId;
        this.receivedDate = receivedDate != null ? receivedDate : Instant.now();
        this.status = Objects.requireNonNull(status, "status must not be null");
    }

    public long messageId() {
        return messageId;
    }

    public int metaDataId() {
        return metaDataId;
    }

    public String channelId() {
        return channelId;
    }

    public String channelName() {
        return channelName;
    }

    public String connectorName() {
        return connectorName;
    }

    public String serverId() {
        return serverId;
    }

    public Instant receivedDate() {
        return receivedDate;
    }

    public boolean isSource() {
        return metaDataId == 0;
    }

    public Status status() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = Objects.requireNonNull(status, "status must not be null");
    }

    // ── Content ──

    public Optional<MessageContent> content(ContentType contentType) {
        return Optional.ofNullable(content.get(contentType));
    }

    /** Text of the given slot, or {@code null} when the slot is empty. */
    public String contentText(ContentType contentType) {
        MessageContent slot = content.get(contentType);
        return slot != null ? slot.content() : null;
    }

    /** Stores a content slot, replacing any previous value for the same tag. */
    public void setContent(MessageContent messageContent) {
        content.put(messageContent.contentType(), messageContent);
    }

    public void setContent(ContentType contentType, String text, String dataType) {
        setContent(MessageContent.of(contentType, text, dataType));
    }

    public void removeContent(ContentType contentType) {
        content.remove(contentType);
    }

    /** Read-only view of all content slots. */
    public Map<ContentType, MessageContent> contents() {
        return Collections.unmodifiableMap(content);
    }

    public String rawData() {
        return contentText(ContentType.RAW);
    }

    // ── Errors ──

    public Optional<ProcessingError> processingError() {
        return Optional.ofNullable(processingError);
    }

    public void setProcessingError(ProcessingError processingError) {
        this.processingError = processingError;
    }

    // ── Maps ──

    public Map<String, Object> sourceMap() {
        return sourceMap;
    }

    public Map<String, Object> channelMap() {
        return channelMap;
    }

    public Map<String, Object> connectorMap() {
        return connectorMap;
    }

    public Map<String, Object> responseMap() {
        return responseMap;
    }

    /**
     * Folds the other message's channel map and response map into this message. Entries of {@code other} win on key
     * collision; {@code other} is left untouched.
     */
    public void mergeMapsFrom(ConnectorMessage other) {
        channelMap.putAll(other.channelMap);
        responseMap.putAll(other.responseMap);
    }

    /**
     * Derives a detached copy of this message at {@code metaDataId 0} for auto-response generation. Maps are copied,
     * so writes to the copy never reach this message. Only the raw content slot is carried over.
     */
    public ConnectorMessage toMergeBase() {
        ConnectorMessage copy =
                new ConnectorMessage(messageId, 0, channelId, channelName, connectorName, serverId, receivedDate, status);
        copy.sourceMap.putAll(sourceMap);
        copy.channelMap.putAll(channelMap);
        copy.connectorMap.putAll(connectorMap);
        copy.responseMap.putAll(responseMap);
        MessageContent raw = content.get(ContentType.RAW);
        if (raw != null) {
            copy.setContent(raw);
        }
        return copy;
    }

    /**
     * Derives the connector message a destination starts from. The destination receives copies of the source, channel
     * and response maps, an empty connector map, and this message's encoded content (or raw content when nothing was
     * encoded) as its raw content.
     */
    public ConnectorMessage forDestination(int destinationMetaDataId, String destinationName) {
        if (destinationMetaDataId <= 0) {
            throw new IllegalArgumentException("destination metaDataId must be > 0, got: " + destinationMetaDataId);
        }
        ConnectorMessage destination = new ConnectorMessage(
                messageId,
                destinationMetaDataId,
                channelId,
                channelName,
                destinationName,
                serverId,
                Instant.now(),
                Status.RECEIVED);
        destination.sourceMap.putAll(sourceMap);
        destination.channelMap.putAll(channelMap);
        destination.responseMap.putAll(responseMap);
        MessageContent outbound = content.get(ContentType.ENCODED);
        if (outbound == null) {
            outbound = content.get(ContentType.RAW);
        }
        if (outbound != null) {
            destination.setContent(ContentType.RAW, outbound.content(), outbound.dataType());
        }
        return destination;
    }

    @Override
    public String toString() {
        return "ConnectorMessage[messageId=" + messageId + ", metaDataId=" + metaDataId + ", connector="
                + connectorName + ", status=" + status + "]";
    }
}
