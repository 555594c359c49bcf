package com.concord.core.model;

public enum ResolutionStrategy {
    LAST_WRITER_WINS,
    MERGE,
    CONSENSUS
}
