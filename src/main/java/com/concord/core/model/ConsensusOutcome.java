package com.concord.core.model;

public enum ConsensusOutcome {
    ACCEPTED,
    REJECTED,
    CANCELLED
}
