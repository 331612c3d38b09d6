package io.routeflow.core.executor;

import io.routeflow.core.model.ProcessingError;
import io.routeflow.core.model.Status;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of running a connector's filter and transformer. Exactly one of three states:
 *
 * <ul>
 *   <li>{@link Status#TRANSFORMED}: accepted, every step ran
 *   <li>{@link Status#FILTERED}: a rule rejected the message
 *   <li>{@link Status#ERROR}: a script or serializer failed; {@code error} says which and why
 * </ul>
 */
public record ExecutionResult(Status status, ProcessingError error) {

    public ExecutionResult {
        Objects.requireNonNull(status, "status must not be null");
        if (status == Status.ERROR) {
            Objects.requireNonNull(error, "error must not be null for ERROR");
        }
    }

    static ExecutionResult transformed() {
        return new ExecutionResult(Status.TRANSFORMED, null);
    }

    static ExecutionResult filtered() {
        return new ExecutionResult(Status.FILTERED, null);
    }

    static ExecutionResult failed(ProcessingError error) {
        return new ExecutionResult(Status.ERROR, error);
    }

    public boolean isError() {
        return status == Status.ERROR;
    }

    public boolean isFiltered() {
        return status == Status.FILTERED;
    }

    public Optional<ProcessingError> errorDetail() {
        return Optional.ofNullable(error);
    }
}
