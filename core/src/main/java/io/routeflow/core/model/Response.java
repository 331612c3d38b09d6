package io.routeflow.core.model;

import java.util.Objects;

/**
 * A reply handed back to the source connector.
 *
 * @param status        the status the reply reports
 * @param message       reply payload, never null
 * @param statusMessage short human-readable summary, may be null
 * @param error         error detail for {@link Status#ERROR} replies, may be null
 */
public record Response(Status status, String message, String statusMessage, String error) {

    public Response {
        Objects.requireNonNull(status, "status must not be null");
        message = message != null ? message : "";
    }

    public Response(Status status, String message) {
        this(status, message, null, null);
    }

    public static Response sent() {
        return new Response(Status.SENT, "", "Message sent", null);
    }

    public static Response queued() {
        return new Response(Status.QUEUED, "", "Message queued", null);
    }

    public static Response filtered() {
        return new Response(Status.FILTERED, "", "Message filtered", null);
    }

    public static Response error(String detail) {
        return new Response(Status.ERROR, "", "Message processing failed", detail);
    }
}
