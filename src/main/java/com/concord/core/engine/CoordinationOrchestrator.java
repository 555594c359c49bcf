package com.concord.core.engine;

import com.concord.core.conflict.ConflictDetector;
import com.concord.core.conflict.ConflictResolver;
import com.concord.core.decision.SequentialDecisionEngine;
import com.concord.core.distribution.TaskDistributor;
import com.concord.core.error.ValidationException;
import com.concord.core.events.CoordinationEvent;
import com.concord.core.events.EventBus;
import com.concord.core.knowledge.KnowledgeStore;
import com.concord.core.knowledge.KnowledgeStoreException;
import com.concord.core.logging.MdcContext;
import com.concord.core.messaging.CommunicationBus;
import com.concord.core.messaging.ResilientMessenger;
import com.concord.core.metrics.CoordinationMetrics;
import com.concord.core.model.AgentInstance;
import com.concord.core.model.AgentStatus;
import com.concord.core.model.Objective;
import com.concord.core.model.Priority;
import com.concord.core.model.TaskAssignment;
import com.concord.core.model.TaskPlan;
import com.concord.core.planner.DecisionPlanner;
import com.concord.core.registry.AgentRegistry;
import com.concord.core.registry.RegistrySnapshot;
import com.concord.core.resilience.ResilienceGuard;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Top-level entry point: plans objectives and runs plans across the agent pool.
 * <p>
 * Each plan execution gets one worker routine on a bounded plan pool; the units it
 * dispatches run on a shared bounded task pool. Registry changes and lost agents are
 * fanned out to every running execution. Finished executions and plans are kept for
 * a bounded time and count only.
 */
@Service
public class CoordinationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CoordinationOrchestrator.class);

    private final DecisionPlanner planner;
    private final AgentRegistry registry;
    private final TaskDistributor distributor;
    private final CommunicationBus bus;
    private final ResilienceGuard guard;
    private final EventBus eventBus;
    private final KnowledgeStore knowledgeStore;
    private final ExecutorService planPool;
    private final ExecutorService taskPool;
    private final ExecutionServices services;
    private final ConcurrentHashMap<String, PlanExecution> running = new ConcurrentHashMap<>();
    private final Cache<String, PlanExecution> finished;
    private final Cache<String, TaskPlan> plans;

    @Autowired
    public CoordinationOrchestrator(DecisionPlanner planner, AgentRegistry registry, TaskDistributor distributor,
                                    DependencyScheduler scheduler, SequentialDecisionEngine engine,
                                    CommunicationBus bus, ResilientMessenger messenger, ResilienceGuard guard,
                                    ConflictDetector detector, ConflictResolver resolver, EventBus eventBus,
                                    CoordinationProperties properties,
                                    @Autowired(required = false) HeartbeatMonitor heartbeatMonitor,
                                    @Autowired(required = false) KnowledgeStore knowledgeStore,
                                    @Autowired(required = false) CoordinationMetrics metrics) {
        this.planner = planner;
        this.registry = registry;
        this.distributor = distributor;
        this.bus = bus;
        this.guard = guard;
        this.eventBus = eventBus;
        this.knowledgeStore = knowledgeStore;
        this.planPool = Executors.newFixedThreadPool(properties.getExecution().getMaxConcurrentPlans(),
                named("plan"));
        this.taskPool = Executors.newFixedThreadPool(properties.getExecution().getTaskPoolSize(), named("task"));
        CoordinationProperties.Retention retention = properties.getRetention();
        this.finished = Caffeine.newBuilder()
                .maximumSize(retention.getFinishedExecutions())
                .expireAfterWrite(retention.getTtl())
                .build();
        this.plans = Caffeine.newBuilder()
                .maximumSize(retention.getPlans())
                .expireAfterWrite(retention.getTtl())
                .build();
        this.services = new ExecutionServices(properties, registry, distributor, scheduler, engine, messenger,
                detector, resolver, eventBus, knowledgeStore, metrics, taskPool, this::route);

        registry.addListener(snapshot -> running.values().forEach(PlanExecution::wake));
        if (heartbeatMonitor != null) {
            heartbeatMonitor.addLostAgentListener(this::onAgentLost);
        }
    }

    /**
     * Plans {@code objective} against the current registry and keeps the plan for later
     * execution.
     *
     * @throws ValidationException                          if the objective is malformed
     * @throws com.concord.core.error.PlanningException if it cannot be planned
     */
    public TaskPlan planObjective(Objective objective) {
        long start = System.currentTimeMillis();
        TaskPlan plan = planner.plan(objective);
        try (var mdc = MdcContext.plan(plan.id())) {
            plans.put(plan.id(), plan);
            save(plan);
            log.info("Planned objective {} as {} ({} tasks, {} risk) in {}ms", objective.id(), plan.id(),
                    plan.tasks().size(), plan.risk().level(), System.currentTimeMillis() - start);
            eventBus.publish(CoordinationEvent.plan("plan.created", plan.id(),
                    Map.of("objectiveId", objective.id(), "complexity", plan.complexity().name(),
                            "tasks", plan.tasks().size(), "risk", plan.risk().level().name())));
            return plan;
        }
    }

    /** A plan produced here, or one the knowledge store still holds. */
    public Optional<TaskPlan> findPlan(String planId) {
        TaskPlan plan = plans.getIfPresent(planId);
        if (plan != null) {
            return Optional.of(plan);
        }
        if (knowledgeStore == null) {
            return Optional.empty();
        }
        try {
            return knowledgeStore.loadPlan(planId);
        } catch (KnowledgeStoreException e) {
            log.warn("Could not load plan {}: {}", planId, e.getMessage());
            return Optional.empty();
        }
    }

    public ExecutionHandle distributeAndExecute(TaskPlan plan) {
        return distributeAndExecute(plan, null);
    }

    /**
     * Starts executing {@code plan}. {@code listener}, when given, is subscribed before the
     * execution starts and so sees every event.
     *
     * @throws ValidationException if the plan is empty or already executing
     */
    public ExecutionHandle distributeAndExecute(TaskPlan plan, Consumer<CoordinationEvent> listener) {
        if (plan.tasks().isEmpty()) {
            throw new ValidationException("Plan " + plan.id() + " has no tasks");
        }
        Optional<Objective> objective = planner.objectiveOf(plan.id());
        Priority priority = objective.map(Objective::priority).orElse(Priority.NORMAL);
        Instant deadline = objective.map(Objective::deadline).orElse(null);

        var execution = new PlanExecution(services, plan, priority, deadline);
        PlanExecution existing = running.compute(plan.id(), (id, current) ->
                current == null || current.completion().isDone() ? execution : current);
        if (existing != execution) {
            throw new ValidationException("Plan " + plan.id() + " is already executing");
        }
        plans.asMap().putIfAbsent(plan.id(), plan);
        var handle = new ExecutionHandle(execution, eventBus);
        if (listener != null) {
            handle.subscribe(listener);
        }
        execution.completion().whenComplete((result, error) -> retire(execution));
        planPool.submit(execution);
        return handle;
    }

    // visible in finished before it leaves running
    private void retire(PlanExecution execution) {
        String planId = execution.planId();
        plans.put(planId, execution.currentPlan());
        finished.put(planId, execution);
        running.remove(planId, execution);
    }

    /** The plan's execution while it runs, and for a while after it finished. */
    public Optional<ExecutionHandle> execution(String planId) {
        PlanExecution execution = running.get(planId);
        if (execution == null) {
            execution = finished.getIfPresent(planId);
        }
        return execution != null ? Optional.of(new ExecutionHandle(execution, eventBus)) : Optional.empty();
    }

    public int runningExecutions() {
        return running.size();
    }

    /**
     * Cancels the plan's execution.
     *
     * @return false if the plan has no execution in flight
     */
    public boolean cancelExecution(String planId) {
        PlanExecution execution = running.get(planId);
        if (execution == null || execution.completion().isDone()) {
            return false;
        }
        log.info("Cancel requested for plan {}", planId);
        execution.cancel();
        return true;
    }

    public CoordinationHealth getCoordinationHealth() {
        RegistrySnapshot snapshot = registry.snapshot();
        var byStatus = new TreeMap<String, Integer>();
        for (AgentStatus s : AgentStatus.values()) {
            byStatus.put(s.name(), 0);
        }
        for (AgentInstance agent : snapshot.agents().values()) {
            byStatus.merge(agent.status().name(), 1, Integer::sum);
        }
        Map<String, String> circuits = guard.circuitStates();
        int deadLetters = (int) Math.min(Integer.MAX_VALUE, bus.deadLetterCount());
        int inFlight = (int) running.values().stream().filter(e -> !e.completion().isDone()).count();

        CoordinationHealth.Status status;
        if (snapshot.assignable().isEmpty()) {
            status = CoordinationHealth.Status.DOWN;
        } else if (circuits.containsValue("OPEN") || byStatus.get(AgentStatus.UNREACHABLE.name()) > 0
                || deadLetters > 0) {
            status = CoordinationHealth.Status.DEGRADED;
        } else {
            status = CoordinationHealth.Status.UP;
        }
        return new CoordinationHealth(status, byStatus, circuits, bus.queueDepths(),
                distributor.pendingTasks().size(), distributor.activeAssignments().size(), inFlight, deadLetters,
                Instant.now());
    }

    void onAgentLost(String agentId, List<String> requeuedTaskIds) {
        log.warn("Agent {} lost; {} task(s) back in the queue", agentId, requeuedTaskIds.size());
        for (PlanExecution execution : running.values()) {
            if (!execution.completion().isDone()) {
                execution.agentLost(agentId, requeuedTaskIds);
            }
        }
    }

    // assignment made by one plan's retry round for another plan's unit
    private void route(TaskAssignment assignment) {
        for (PlanExecution execution : running.values()) {
            if (!execution.completion().isDone() && execution.owns(assignment.taskId())) {
                execution.assigned(assignment);
                return;
            }
        }
        log.debug("No execution owns {}, releasing its slot", assignment.taskId());
        distributor.complete(assignment.taskId());
    }

    private void save(TaskPlan plan) {
        if (knowledgeStore == null) {
            return;
        }
        try {
            knowledgeStore.savePlan(plan);
        } catch (KnowledgeStoreException e) {
            log.warn("Could not store plan {}: {}", plan.id(), e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        running.values().forEach(PlanExecution::cancel);
        planPool.shutdownNow();
        taskPool.shutdownNow();
    }

    private static ThreadFactory named(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
