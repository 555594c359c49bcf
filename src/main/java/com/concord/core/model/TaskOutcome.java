package com.concord.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Result of driving one task unit through the decision engine.
 *
 * @param taskId    the task unit
 * @param agentId   agent that executed it
 * @param status    COMPLETED, FAILED or CANCELLED
 * @param decisions the full decision log, in append order
 * @param output    output of the last successful step
 * @param error     failure reason (nullable)
 * @param elapsed   wall-clock time spent
 */
public record TaskOutcome(
    String taskId,
    String agentId,
    TaskStatus status,
    List<Decision> decisions,
    Map<String, Object> output,
    String error,
    Duration elapsed
) implements Serializable {

    public TaskOutcome {
        decisions = decisions != null ? List.copyOf(decisions) : List.of();
        output = output != null ? Map.copyOf(output) : Map.of();
    }
}
