package io.routeflow.core.model;

/**
 * How a filter rule's result combines with the running result of the rules before it.
 *
 * <ul>
 *   <li>{@link #AND}: skipped when the running result is already {@code false}.
 *   <li>{@link #OR}: skipped when the running result is already {@code true}.
 *   <li>{@link #NONE}: replaces the running result with this rule's own result.
 * </ul>
 */
public enum RuleOperator {
    AND,
    OR,
    NONE
}
