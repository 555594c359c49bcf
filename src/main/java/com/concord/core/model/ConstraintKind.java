package com.concord.core.model;

/**
 * Kinds of constraint an objective may carry. The meaning of {@link Constraint#value()}
 * depends on the kind.
 */
public enum ConstraintKind {
    /** Some registered agent must declare the capability tag in {@code value}. */
    REQUIRED_CAPABILITY,
    /** No task unit may require the capability tag in {@code value}. */
    EXCLUDED_CAPABILITY,
    /** The plan may hold at most {@code value} task units. */
    MAX_TASKS,
    /** The aggregate duration estimate may not exceed {@code value} (ISO-8601 duration). */
    MAX_DURATION
}
