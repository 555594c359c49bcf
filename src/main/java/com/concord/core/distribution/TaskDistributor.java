package com.concord.core.distribution;

import com.concord.core.engine.CoordinationProperties;
import com.concord.core.error.ValidationException;
import com.concord.core.metrics.CoordinationMetrics;
import com.concord.core.model.AgentInstance;
import com.concord.core.model.AgentStatus;
import com.concord.core.model.Priority;
import com.concord.core.model.TaskAssignment;
import com.concord.core.model.TaskUnit;
import com.concord.core.registry.AgentRegistry;
import com.concord.core.registry.RegistrySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Assigns task units to agent slots with minimum total cost.
 * <p>
 * Each free slot of an assignable agent is one column of the cost matrix; each unit is
 * a row. The cost of putting a unit on a slot is
 * {@code 1 / (capability match * (1 - load) * availability)}, where load accounts for
 * slots already taken on that agent. Costs above the feasibility ceiling are not
 * assignable. Units left unmatched are queued and offered again by
 * {@link #retryPending}. Lower-priority units are the first to stay queued when slots
 * run short.
 * <p>
 * The assignment table is guarded by a single lock: an unfinished unit is never held
 * by two agents and an agent never holds more units than its capacity.
 */
@Service
public class TaskDistributor {

    private static final Logger log = LoggerFactory.getLogger(TaskDistributor.class);

    private static final double INFEASIBLE = 1e9;
    private static final double UNMATCHED = 1e6;
    private static final double TIE_BREAK = 1e-6;

    private final AgentRegistry registry;
    private final CoordinationMetrics metrics;
    private final double feasibilityCeiling;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Held> active = new LinkedHashMap<>();
    private final Map<String, Pending> pending = new LinkedHashMap<>();

    private record Held(TaskUnit unit, TaskAssignment assignment) {}

    private record Pending(TaskUnit unit, Priority priority) {}

    private record Slot(AgentInstance agent, int index) {}

    @Autowired
    public TaskDistributor(AgentRegistry registry, CoordinationProperties properties,
                           @Autowired(required = false) CoordinationMetrics metrics) {
        this.registry = registry;
        this.metrics = metrics;
        this.feasibilityCeiling = properties.getDistributor().getFeasibilityCeiling();
    }

    public TaskDistributor(AgentRegistry registry, CoordinationProperties properties) {
        this(registry, properties, null);
    }

    public List<TaskAssignment> distribute(List<TaskUnit> units, RegistrySnapshot snapshot) {
        return distribute(units, Priority.NORMAL, snapshot);
    }

    /**
     * Assigns as many of {@code units} as the snapshot's free slots allow. Units already
     * assigned are skipped; units that cannot be placed are queued.
     *
     * @return the assignments made in this round
     */
    public List<TaskAssignment> distribute(List<TaskUnit> units, Priority priority, RegistrySnapshot snapshot) {
        lock.lock();
        try {
            var rows = new ArrayList<Pending>();
            for (TaskUnit unit : units) {
                if (active.containsKey(unit.id())) {
                    log.debug("Task {} already assigned to {}, skipping", unit.id(),
                            active.get(unit.id()).assignment().agentId());
                    continue;
                }
                Pending queued = pending.remove(unit.id());
                rows.add(queued != null ? queued : new Pending(unit, priority));
            }
            return assign(rows, snapshot);
        } finally {
            lock.unlock();
        }
    }

    /** Offers every queued unit to the agents in {@code snapshot} again. */
    public List<TaskAssignment> retryPending(RegistrySnapshot snapshot) {
        lock.lock();
        try {
            if (pending.isEmpty()) {
                return List.of();
            }
            var rows = new ArrayList<>(pending.values());
            pending.clear();
            return assign(rows, snapshot);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks a task finished and frees its agent slot.
     *
     * @return the assignment that ended, if the task was assigned
     */
    public Optional<TaskAssignment> complete(String taskId) {
        lock.lock();
        try {
            Held held = active.remove(taskId);
            if (held == null) {
                pending.remove(taskId);
                return Optional.empty();
            }
            releaseSlot(held.assignment().agentId());
            return Optional.of(held.assignment());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes every unit away from {@code agentId} and queues it again.
     *
     * @return ids of the requeued tasks
     */
    public List<String> requeueAgent(String agentId) {
        lock.lock();
        try {
            var requeued = new ArrayList<String>();
            var it = active.entrySet().iterator();
            while (it.hasNext()) {
                Held held = it.next().getValue();
                if (held.assignment().agentId().equals(agentId)) {
                    it.remove();
                    releaseSlot(agentId);
                    pending.put(held.unit().id(), new Pending(held.unit(), held.assignment().priority()));
                    requeued.add(held.unit().id());
                }
            }
            if (!requeued.isEmpty()) {
                log.warn("Requeued {} task(s) from agent {}: {}", requeued.size(), agentId, requeued);
            }
            return requeued;
        } finally {
            lock.unlock();
        }
    }

    /** Drops all queued and active units of a plan, freeing their slots. */
    public void withdraw(String planId) {
        lock.lock();
        try {
            pending.values().removeIf(p -> planId.equals(p.unit().planId()));
            var it = active.values().iterator();
            while (it.hasNext()) {
                Held held = it.next();
                if (planId.equals(held.unit().planId())) {
                    it.remove();
                    releaseSlot(held.assignment().agentId());
                }
            }
        } finally {
            lock.unlock();
        }
    }

    public Optional<TaskAssignment> assignmentFor(String taskId) {
        lock.lock();
        try {
            Held held = active.get(taskId);
            return held != null ? Optional.of(held.assignment()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public List<TaskAssignment> activeAssignments() {
        lock.lock();
        try {
            return active.values().stream().map(Held::assignment).toList();
        } finally {
            lock.unlock();
        }
    }

    public List<String> pendingTasks() {
        lock.lock();
        try {
            return List.copyOf(pending.keySet());
        } finally {
            lock.unlock();
        }
    }

    public boolean isPending(String taskId) {
        lock.lock();
        try {
            return pending.containsKey(taskId);
        } finally {
            lock.unlock();
        }
    }

    /** True when some registered agent declares every capability the unit requires. */
    public static boolean canEverServe(TaskUnit unit, RegistrySnapshot snapshot) {
        return snapshot.agents().values().stream()
                .anyMatch(a -> unit.requiredCapabilities().stream().allMatch(a::hasCapability));
    }

    // caller holds the lock
    private List<TaskAssignment> assign(List<Pending> rows, RegistrySnapshot snapshot) {
        if (rows.isEmpty()) {
            return List.of();
        }
        List<Slot> slots = freeSlots(snapshot);
        int size = Math.max(rows.size(), slots.size());
        double[][] cost = new double[size][size];
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                if (r >= rows.size()) {
                    cost[r][c] = 0.0;
                } else if (c >= slots.size()) {
                    // leaving a unit unmatched costs more the higher its priority
                    cost[r][c] = UNMATCHED * (rows.get(r).priority().ordinal() + 1);
                } else {
                    double raw = cost(rows.get(r).unit(), slots.get(c));
                    cost[r][c] = raw > feasibilityCeiling ? INFEASIBLE : raw + TIE_BREAK * c;
                }
            }
        }

        int[] match = HungarianAlgorithm.solve(cost);
        var made = new ArrayList<TaskAssignment>();
        Instant now = Instant.now();
        for (int r = 0; r < rows.size(); r++) {
            Pending row = rows.get(r);
            int c = match[r];
            boolean placed = false;
            if (c < slots.size() && cost[r][c] < INFEASIBLE) {
                AgentInstance agent = slots.get(c).agent();
                if (registry.reserve(agent.id())) {
                    var assignment = new TaskAssignment(row.unit().id(), agent.id(), row.priority(),
                            row.unit().estimatedDuration(), now);
                    active.put(row.unit().id(), new Held(row.unit(), assignment));
                    made.add(assignment);
                    placed = true;
                    log.debug("Assigned {} to {} (cost {})", row.unit().id(), agent.id(),
                            String.format("%.3f", cost[r][c]));
                }
            }
            if (!placed) {
                pending.put(row.unit().id(), row);
            }
        }
        int queued = rows.size() - made.size();
        if (queued > 0) {
            log.info("Assigned {} task(s), {} queued waiting for a capable agent", made.size(), queued);
        }
        if (metrics != null) {
            metrics.recordAssignments(made.size(), queued);
        }
        return made;
    }

    // columns ordered by (load, id) so equal costs resolve to the least loaded, then lowest id
    private List<Slot> freeSlots(RegistrySnapshot snapshot) {
        var agents = snapshot.assignable().stream()
                .sorted(Comparator.comparingDouble(AgentInstance::load).thenComparing(AgentInstance::id))
                .toList();
        var slots = new ArrayList<Slot>();
        for (AgentInstance agent : agents) {
            int free = agent.capacity() - heldBy(agent.id());
            for (int i = 0; i < free; i++) {
                slots.add(new Slot(agent, i));
            }
        }
        return slots;
    }

    private int heldBy(String agentId) {
        int count = 0;
        for (Held held : active.values()) {
            if (held.assignment().agentId().equals(agentId)) {
                count++;
            }
        }
        return count;
    }

    private double cost(TaskUnit unit, Slot slot) {
        AgentInstance agent = slot.agent();
        double match = capabilityMatch(unit, agent);
        if (match <= 0.0) {
            return INFEASIBLE;
        }
        double occupancy = (double) (heldBy(agent.id()) + slot.index()) / agent.capacity();
        double headroom = 1.0 - Math.max(agent.load(), occupancy);
        double availability = agent.status() == AgentStatus.AVAILABLE ? 1.0 : 0.5;
        double denominator = match * headroom * availability;
        return denominator <= 0.0 ? INFEASIBLE : 1.0 / denominator;
    }

    /** Mean declared confidence over the required tags; 0 if any tag is missing. */
    static double capabilityMatch(TaskUnit unit, AgentInstance agent) {
        if (unit.requiredCapabilities().isEmpty()) {
            return 1.0;
        }
        double sum = 0.0;
        for (String tag : unit.requiredCapabilities()) {
            if (!agent.hasCapability(tag)) {
                return 0.0;
            }
            sum += agent.confidence(tag);
        }
        return sum / unit.requiredCapabilities().size();
    }

    private void releaseSlot(String agentId) {
        try {
            registry.release(agentId);
        } catch (ValidationException e) {
            log.debug("Agent {} left the registry before its slot was released", agentId);
        }
    }
}
