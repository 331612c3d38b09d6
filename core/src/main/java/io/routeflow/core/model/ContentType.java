package io.routeflow.core.model;

/**
 * Content slot tags of a {@link ConnectorMessage}. A connector message holds at most one {@link MessageContent} per
 * tag.
 */
public enum ContentType {
    RAW,
    PROCESSED_RAW,
    TRANSFORMED,
    ENCODED,
    SENT,
    RESPONSE,
    RESPONSE_TRANSFORMED,
    PROCESSED_RESPONSE,
    CONNECTOR_MAP,
    CHANNEL_MAP,
    RESPONSE_MAP,
    PROCESSING_ERROR,
    POSTPROCESSOR_ERROR,
    RESPONSE_ERROR,
    SOURCE_MAP
}
