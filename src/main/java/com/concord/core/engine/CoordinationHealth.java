package com.concord.core.engine;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time health of the coordination runtime.
 *
 * @param status            UP, DEGRADED (open circuits, unreachable agents or dead letters) or
 *                          DOWN (no agent can take work)
 * @param agentsByStatus    registered agents per status
 * @param circuits          circuit state per call site
 * @param queueDepths       undelivered messages per bus address
 * @param pendingTasks      units waiting for a capable agent
 * @param activeAssignments units currently held by agents
 * @param runningPlans      plan executions in flight
 * @param deadLetters       messages that exhausted their delivery attempts
 * @param checkedAt         when this snapshot was taken
 */
public record CoordinationHealth(
    Status status,
    Map<String, Integer> agentsByStatus,
    Map<String, String> circuits,
    Map<String, Integer> queueDepths,
    int pendingTasks,
    int activeAssignments,
    int runningPlans,
    int deadLetters,
    Instant checkedAt
) {

    public enum Status { UP, DEGRADED, DOWN }

    public CoordinationHealth {
        agentsByStatus = agentsByStatus != null ? Map.copyOf(agentsByStatus) : Map.of();
        circuits = circuits != null ? Map.copyOf(circuits) : Map.of();
        queueDepths = queueDepths != null ? Map.copyOf(queueDepths) : Map.of();
    }
}
