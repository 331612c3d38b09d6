package io.routeflow.core.model;

/**
 * Processing state of one {@link ConnectorMessage}. The set and the names are part of the stable contract read by
 * persistence and search; do not rename or reorder.
 */
public enum Status {
    RECEIVED,
    FILTERED,
    TRANSFORMED,
    SENT,
    QUEUED,
    ERROR,
    PENDING
}
