package io.routeflow.core.model;

/** Classification of a per-message processing failure. */
public enum ErrorKind {
    SCRIPT_COMPILE,
    SCRIPT_RUNTIME,
    SCRIPT_TIMEOUT,
    SERIALIZATION,
    INCOMPLETE_DESTINATION_SET
}
