package com.concord.core.model;

/**
 * How a dependency edge constrains its target.
 */
public enum DependencyKind {
    /** Target waits for the source to succeed. */
    SEQUENTIAL,
    /** Target waits for the source to succeed and may run alongside its siblings. */
    PARALLEL_SAFE,
    /** Target waits for the source to reach any terminal state. */
    CONDITIONAL;

    public boolean requiresSuccess() {
        return this != CONDITIONAL;
    }
}
