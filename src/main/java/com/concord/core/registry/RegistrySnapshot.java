package com.concord.core.registry;

import com.concord.core.model.AgentInstance;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable view of the registry at one version.
 *
 * @param version monotonically increasing registry version
 * @param agents  agents by id, sorted
 * @param takenAt when the snapshot was taken
 */
public record RegistrySnapshot(
    long version,
    Map<String, AgentInstance> agents,
    Instant takenAt
) {

    public RegistrySnapshot {
        agents = agents != null ? Collections.unmodifiableMap(new TreeMap<>(agents)) : Map.of();
    }

    public static RegistrySnapshot of(List<AgentInstance> agents) {
        var byId = new TreeMap<String, AgentInstance>();
        agents.forEach(a -> byId.put(a.id(), a));
        return new RegistrySnapshot(0, byId, Instant.now());
    }

    public Optional<AgentInstance> get(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    /** Agents that may receive new assignments. */
    public List<AgentInstance> assignable() {
        return agents.values().stream().filter(a -> a.status().assignable()).toList();
    }

    /** True when some assignable agent declares {@code tag}. */
    public boolean hasAssignableAgentFor(String tag) {
        return agents.values().stream().anyMatch(a -> a.status().assignable() && a.hasCapability(tag));
    }

    /** True when some registered agent, whatever its status, declares {@code tag}. */
    public boolean declares(String tag) {
        return agents.values().stream().anyMatch(a -> a.hasCapability(tag));
    }

    public int size() {
        return agents.size();
    }
}
