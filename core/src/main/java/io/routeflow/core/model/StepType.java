package io.routeflow.core.model;

/** What the executor does with the value a transformer step returns. */
public enum StepType {
    /** Result ignored; the step works through map side effects only. */
    SCRIPT,
    /** Result stored into the channel map under the step name. */
    MAPPER,
    /** Result becomes the new working message content. */
    MESSAGE_BUILDER
}
