package com.concord.core.model;

public enum PlanStatus {
    PLANNED,
    EXECUTING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean terminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
