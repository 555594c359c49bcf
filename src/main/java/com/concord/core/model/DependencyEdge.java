package com.concord.core.model;

import java.io.Serializable;

/**
 * Directed dependency between two task units of the same plan.
 */
public record DependencyEdge(
    String fromTaskId,
    String toTaskId,
    DependencyKind kind
) implements Serializable {}
