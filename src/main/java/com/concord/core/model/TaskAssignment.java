package com.concord.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;

/**
 * Binding of one unfinished task unit to one agent.
 */
public record TaskAssignment(
    String taskId,
    String agentId,
    Priority priority,
    Duration estimatedDuration,
    Instant assignedAt
) implements Serializable {}
