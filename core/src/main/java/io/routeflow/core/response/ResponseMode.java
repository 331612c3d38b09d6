package io.routeflow.core.response;

/** When and how a channel answers its source connector. */
public enum ResponseMode {
    /** No response. */
    NONE,
    /** Auto-respond with {@code RECEIVED}, regardless of any processing outcome. */
    BEFORE_PROCESSING,
    /** Auto-respond with the source connector message's own status. */
    AFTER_SOURCE_TRANSFORM,
    /** Auto-respond with the status reconciled from all destinations. */
    DESTINATIONS_COMPLETED,
    /** Return the value stored under a name in the source response map. */
    NAMED
}
