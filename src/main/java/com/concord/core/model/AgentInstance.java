package com.concord.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Snapshot of a worker agent as known to the registry.
 *
 * @param id               agent id
 * @param capabilities     declared capability tags with confidence 0..1
 * @param status           current status
 * @param load             reported load metric, normalized 0..1
 * @param capacity         how many assignments the agent takes at once
 * @param activeTasks      assignments currently held
 * @param missedHeartbeats consecutive heartbeat rounds without a reply
 * @param lastHeartbeat    last time the agent was heard from (nullable)
 */
public record AgentInstance(
    String id,
    Map<String, Double> capabilities,
    AgentStatus status,
    double load,
    int capacity,
    int activeTasks,
    int missedHeartbeats,
    Instant lastHeartbeat
) implements Serializable {

    public AgentInstance {
        capabilities = capabilities != null
                ? java.util.Collections.unmodifiableMap(new TreeMap<>(capabilities))
                : Map.of();
        capacity = Math.max(1, capacity);
    }

    public boolean hasCapability(String tag) {
        return capabilities.containsKey(tag);
    }

    public double confidence(String tag) {
        return capabilities.getOrDefault(tag, 0.0);
    }

    public int freeSlots() {
        return Math.max(0, capacity - activeTasks);
    }
}
