package io.routeflow.core.model;

import java.util.Objects;

/**
 * One sub-message cut from a batched payload. Sequence ids start at 1 and are contiguous within one batch run.
 *
 * @param sequenceId 1-based position of this unit within its batch
 * @param content    the unit text; may be empty (an empty record is a legal unit)
 */
public record BatchUnit(int sequenceId, String content) {

    public BatchUnit {
        if (sequenceId < 1) {
            throw new IllegalArgumentException("sequenceId must be >= 1, got: " + sequenceId);
        }
        Objects.requireNonNull(content, "content must not be null");
    }
}
