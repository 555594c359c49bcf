package com.concord.core.model;

/**
 * Status of a task unit within a plan execution.
 */
public enum TaskStatus {
    PENDING,
    QUEUED,      // ready, waiting for a capable agent
    RUNNING,
    COMPLETED,
    FAILED,
    SUBSTITUTED, // replaced by its contingency fallback
    BLOCKED,     // a required predecessor failed
    CANCELLED;

    public boolean terminal() {
        return this == COMPLETED || this == FAILED || this == SUBSTITUTED
                || this == BLOCKED || this == CANCELLED;
    }
}
