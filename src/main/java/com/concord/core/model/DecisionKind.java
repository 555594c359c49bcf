package com.concord.core.model;

/**
 * What a decision log entry records.
 */
public enum DecisionKind {
    /** A candidate action was selected for a step. */
    CHOICE,
    /** Execution resumed from an earlier decision point. */
    BACKTRACK,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean terminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
