package com.concord.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while planning and executing, used by execution handles, SSE
 * streaming and the CLI.
 *
 * @param eventType event type (e.g. "plan.started", "task.assigned", "consensus.committed")
 * @param planId    the plan this event belongs to
 * @param taskId    the task this event relates to (nullable for plan-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record CoordinationEvent(
    String eventType,
    String planId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public CoordinationEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    public static CoordinationEvent plan(String eventType, String planId, Map<String, Object> payload) {
        return new CoordinationEvent(eventType, planId, null, payload, Instant.now());
    }

    public static CoordinationEvent task(String eventType, String planId, String taskId,
                                         Map<String, Object> payload) {
        return new CoordinationEvent(eventType, planId, taskId, payload, Instant.now());
    }

    /** True for the events that end a plan execution. */
    public boolean terminal() {
        return "plan.completed".equals(eventType)
                || "plan.failed".equals(eventType)
                || "plan.cancelled".equals(eventType);
    }
}
