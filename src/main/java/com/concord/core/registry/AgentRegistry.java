package com.concord.core.registry;

import com.concord.core.engine.CoordinationProperties;
import com.concord.core.error.ValidationException;
import com.concord.core.model.AgentInstance;
import com.concord.core.model.AgentStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Authoritative table of worker agents.
 * <p>
 * All writes go through one lock and publish a new {@link RegistrySnapshot}; readers
 * only ever see snapshots. Listeners are notified after each change, outside the lock.
 */
@Service
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, AgentInstance> agents = new TreeMap<>();
    private final Map<String, Set<String>> capabilityIndex = new TreeMap<>();
    private final CopyOnWriteArrayList<Consumer<RegistrySnapshot>> listeners = new CopyOnWriteArrayList<>();
    private final int maxMissedHeartbeats;
    private long version;
    private volatile RegistrySnapshot current = new RegistrySnapshot(0, Map.of(), Instant.now());

    public AgentRegistry(CoordinationProperties properties) {
        this.maxMissedHeartbeats = Math.max(1, properties.getRegistry().getMaxMissedHeartbeats());
    }

    /**
     * Adds an agent. Its status starts as {@code AVAILABLE} unless given otherwise.
     *
     * @throws ValidationException if the id is blank or already registered
     */
    public RegistrySnapshot register(AgentInstance agent) {
        if (agent.id() == null || agent.id().isBlank()) {
            throw new ValidationException("Agent id must not be blank");
        }
        RegistrySnapshot snapshot;
        lock.lock();
        try {
            if (agents.containsKey(agent.id())) {
                throw new ValidationException("Agent already registered: " + agent.id());
            }
            var registered = new AgentInstance(agent.id(), agent.capabilities(),
                    agent.status() != null ? agent.status() : AgentStatus.AVAILABLE,
                    clampLoad(agent.load()), agent.capacity(), 0, 0, Instant.now());
            agents.put(registered.id(), registered);
            registered.capabilities().keySet()
                    .forEach(tag -> capabilityIndex.computeIfAbsent(tag, k -> new TreeSet<>()).add(registered.id()));
            snapshot = publish();
        } finally {
            lock.unlock();
        }
        log.info("Registered agent {} with capabilities {}", agent.id(), agent.capabilities().keySet());
        notifyListeners(snapshot);
        return snapshot;
    }

    public boolean unregister(String agentId) {
        RegistrySnapshot snapshot;
        lock.lock();
        try {
            AgentInstance removed = agents.remove(agentId);
            if (removed == null) {
                return false;
            }
            removed.capabilities().keySet().forEach(tag -> {
                Set<String> ids = capabilityIndex.get(tag);
                if (ids != null) {
                    ids.remove(agentId);
                    if (ids.isEmpty()) {
                        capabilityIndex.remove(tag);
                    }
                }
            });
            snapshot = publish();
        } finally {
            lock.unlock();
        }
        log.info("Unregistered agent {}", agentId);
        notifyListeners(snapshot);
        return true;
    }

    public RegistrySnapshot snapshot() {
        return current;
    }

    public Optional<AgentInstance> find(String agentId) {
        return current.get(agentId);
    }

    /** Ids of agents declaring {@code tag}, whatever their status. */
    public Set<String> agentsWithCapability(String tag) {
        lock.lock();
        try {
            Set<String> ids = capabilityIndex.get(tag);
            return ids != null ? Set.copyOf(ids) : Set.of();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a heartbeat reply: resets the missed count and brings an unreachable
     * agent back to {@code AVAILABLE}.
     */
    public void recordHeartbeat(String agentId, double load) {
        update(agentId, a -> {
            AgentStatus status = a.status() == AgentStatus.UNREACHABLE ? statusFor(a.activeTasks(), a.capacity())
                    : a.status();
            if (a.status() == AgentStatus.UNREACHABLE) {
                log.info("Agent {} is reachable again", agentId);
            }
            return new AgentInstance(a.id(), a.capabilities(), status, clampLoad(load), a.capacity(),
                    a.activeTasks(), 0, Instant.now());
        });
    }

    /**
     * Completes one heartbeat round. Agents in {@code responded} were already recorded
     * through {@link #recordHeartbeat}; every other agent gets one more missed beat.
     *
     * @return ids of agents that became {@code UNREACHABLE} in this round
     */
    public List<String> completeHeartbeatRound(Collection<String> responded) {
        var lost = new ArrayList<String>();
        RegistrySnapshot snapshot;
        lock.lock();
        try {
            for (AgentInstance a : List.copyOf(agents.values())) {
                if (responded.contains(a.id()) || a.status() == AgentStatus.UNREACHABLE) {
                    continue;
                }
                int missed = a.missedHeartbeats() + 1;
                AgentStatus status = a.status();
                if (missed >= maxMissedHeartbeats) {
                    status = AgentStatus.UNREACHABLE;
                    lost.add(a.id());
                }
                agents.put(a.id(), new AgentInstance(a.id(), a.capabilities(), status, a.load(), a.capacity(),
                        a.activeTasks(), missed, a.lastHeartbeat()));
            }
            snapshot = publish();
        } finally {
            lock.unlock();
        }
        lost.forEach(id -> log.warn("Agent {} missed {} heartbeats, marked UNREACHABLE", id, maxMissedHeartbeats));
        notifyListeners(snapshot);
        return lost;
    }

    /** Stops new assignments to the agent; running ones finish. */
    public void drain(String agentId) {
        update(agentId, a -> new AgentInstance(a.id(), a.capabilities(), AgentStatus.DRAINING, a.load(),
                a.capacity(), a.activeTasks(), a.missedHeartbeats(), a.lastHeartbeat()));
        log.info("Draining agent {}", agentId);
    }

    /**
     * Takes one assignment slot on the agent.
     *
     * @return false if the agent is unknown, not assignable or full
     */
    public boolean reserve(String agentId) {
        lock.lock();
        try {
            AgentInstance a = agents.get(agentId);
            if (a == null || !a.status().assignable() || a.freeSlots() == 0) {
                return false;
            }
            int active = a.activeTasks() + 1;
            agents.put(agentId, new AgentInstance(a.id(), a.capabilities(), statusFor(active, a.capacity()),
                    a.load(), a.capacity(), active, a.missedHeartbeats(), a.lastHeartbeat()));
            publish();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Frees one assignment slot on the agent. */
    public void release(String agentId) {
        update(agentId, a -> {
            int active = Math.max(0, a.activeTasks() - 1);
            AgentStatus status = a.status().assignable() ? statusFor(active, a.capacity()) : a.status();
            return new AgentInstance(a.id(), a.capabilities(), status, a.load(), a.capacity(), active,
                    a.missedHeartbeats(), a.lastHeartbeat());
        });
    }

    public void addListener(Consumer<RegistrySnapshot> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<RegistrySnapshot> listener) {
        listeners.remove(listener);
    }

    private void update(String agentId, UnaryOperator<AgentInstance> change) {
        RegistrySnapshot snapshot;
        lock.lock();
        try {
            AgentInstance a = agents.get(agentId);
            if (a == null) {
                throw new ValidationException("Unknown agent: " + agentId);
            }
            agents.put(agentId, change.apply(a));
            snapshot = publish();
        } finally {
            lock.unlock();
        }
        notifyListeners(snapshot);
    }

    private static AgentStatus statusFor(int activeTasks, int capacity) {
        return activeTasks >= capacity ? AgentStatus.BUSY : AgentStatus.AVAILABLE;
    }

    private static double clampLoad(double load) {
        return Math.max(0.0, Math.min(1.0, load));
    }

    // caller holds the lock
    private RegistrySnapshot publish() {
        current = new RegistrySnapshot(++version, agents, Instant.now());
        return current;
    }

    private void notifyListeners(RegistrySnapshot snapshot) {
        for (Consumer<RegistrySnapshot> listener : listeners) {
            try {
                listener.accept(snapshot);
            } catch (RuntimeException e) {
                log.warn("Registry listener failed: {}", e.getMessage(), e);
            }
        }
    }
}
