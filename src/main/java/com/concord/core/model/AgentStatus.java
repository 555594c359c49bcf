package com.concord.core.model;

/**
 * Liveness/availability of a registered agent. Written only by the agent registry.
 */
public enum AgentStatus {
    AVAILABLE,
    BUSY,
    UNREACHABLE,
    DRAINING;

    public boolean assignable() {
        return this == AVAILABLE || this == BUSY;
    }
}
