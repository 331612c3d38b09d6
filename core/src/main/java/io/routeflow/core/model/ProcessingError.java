package io.routeflow.core.model;

import java.util.Objects;

/**
 * Structured description of why a message ended in {@link Status#ERROR}.
 *
 * @param kind   failure class
 * @param source the rule, step or script that failed (e.g. {@code filter:Check MSH}); may be null
 * @param detail human-readable message for operators
 */
public record ProcessingError(ErrorKind kind, String source, String detail) {

    public ProcessingError {
        Objects.requireNonNull(kind, "kind must not be null");
        detail = detail != null ? detail : "";
    }

    @Override
    public String toString() {
        return kind + (source != null ? " in " + source : "") + ": " + detail;
    }
}
