package com.concord.core.engine;

import com.concord.core.concurrent.CancellationToken;
import com.concord.core.distribution.TaskDistributor;
import com.concord.core.error.CoordinationException;
import com.concord.core.error.NoCapableAgentException;
import com.concord.core.events.CoordinationEvent;
import com.concord.core.knowledge.KnowledgeStoreException;
import com.concord.core.logging.MdcContext;
import com.concord.core.messaging.CommunicationBus;
import com.concord.core.model.AgentInstance;
import com.concord.core.model.AgentMessage;
import com.concord.core.model.Conflict;
import com.concord.core.model.ConflictingValue;
import com.concord.core.model.ContingencyPlan;
import com.concord.core.model.ExecutionResult;
import com.concord.core.model.MessageType;
import com.concord.core.model.PlanStatus;
import com.concord.core.model.Priority;
import com.concord.core.model.Resolution;
import com.concord.core.model.TaskAssignment;
import com.concord.core.model.TaskOutcome;
import com.concord.core.model.TaskPlan;
import com.concord.core.model.TaskStatus;
import com.concord.core.model.TaskUnit;
import com.concord.core.registry.RegistrySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static com.concord.core.decision.PatternProtocol.OPERATION;
import static com.concord.core.decision.PatternProtocol.PLAN_ID;
import static com.concord.core.decision.PatternProtocol.TASKS;
import static com.concord.core.decision.PatternProtocol.TASK_REPORT;

/**
 * Worker routine of one plan execution.
 * <p>
 * A single loop thread owns the scheduling state: it dispatches ready units through the
 * distributor, starts assigned units on the task pool and reacts to the signals task
 * threads, the heartbeat monitor and other executions post to its inbox. Task threads
 * never touch the scheduling state directly.
 */
class PlanExecution implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PlanExecution.class);

    private interface Signal {}

    private record Finished(TaskAssignment assignment, TaskOutcome outcome) implements Signal {}

    private record Assigned(TaskAssignment assignment) implements Signal {}

    private record Requeued(String agentId, List<String> taskIds) implements Signal {}

    private record Wake() implements Signal {}

    private final ExecutionServices services;
    private final String planId;
    private final Priority priority;
    private final Instant deadline;
    private final CancellationToken token = new CancellationToken();
    private final LinkedBlockingQueue<Signal> inbox = new LinkedBlockingQueue<>();
    private final CompletableFuture<ExecutionResult> completion = new CompletableFuture<>();

    private final ConcurrentHashMap<String, TaskStatus> statuses = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, TaskOutcome> outcomes = new ConcurrentHashMap<>();
    private final List<Resolution> resolutions = new CopyOnWriteArrayList<>();
    private final List<String> errors = new CopyOnWriteArrayList<>();

    // loop thread only
    private final Map<String, TaskAssignment> runningAssignments = new HashMap<>();
    private final Map<String, Future<?>> runningFutures = new HashMap<>();
    private boolean cancelling;

    private volatile TaskPlan plan;
    private volatile PlanStatus status = PlanStatus.PLANNED;
    private volatile Instant started;

    PlanExecution(ExecutionServices services, TaskPlan plan, Priority priority, Instant deadline) {
        this.services = services;
        this.plan = plan;
        this.planId = plan.id();
        this.priority = priority != null ? priority : Priority.NORMAL;
        this.deadline = deadline;
        plan.tasks().forEach(t -> statuses.put(t.id(), TaskStatus.PENDING));
    }

    @Override
    public void run() {
        try (var mdc = MdcContext.plan(planId)) {
            runPlan();
        }
    }

    private void runPlan() {
        started = Instant.now();
        status = PlanStatus.EXECUTING;
        log.info("Executing plan {} revision {} ({} tasks, priority {})", planId, plan.revision(),
                plan.tasks().size(), priority);
        publish(CoordinationEvent.plan("plan.started", planId,
                Map.of("tasks", plan.tasks().size(), "revision", plan.revision())));
        try {
            loop();
        } catch (RuntimeException e) {
            log.error("Plan {} execution aborted: {}", planId, e.getMessage(), e);
            errors.add("Execution aborted: " + e.getMessage());
            runningFutures.values().forEach(f -> f.cancel(true));
            markRemaining(TaskStatus.CANCELLED);
            finish(PlanStatus.FAILED);
        }
    }

    private void loop() {
        long pollMillis = services.properties().getExecution().getPollInterval().toMillis();
        while (true) {
            Signal signal;
            while ((signal = inbox.poll()) != null) {
                handle(signal);
            }
            if (token.isCancelled()) {
                cancelRemaining();
                finish(PlanStatus.CANCELLED);
                return;
            }
            blockUnreachable();
            dispatchReady();
            retryQueued();
            if (runningAssignments.isEmpty() && allTerminal()) {
                reconcile();
                boolean succeeded = plan.tasks().stream()
                        .allMatch(t -> statuses.get(t.id()) == TaskStatus.COMPLETED);
                finish(succeeded ? PlanStatus.COMPLETED : PlanStatus.FAILED);
                return;
            }
            try {
                signal = inbox.poll(pollMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                log.warn("Plan {} worker interrupted, cancelling", planId);
                token.cancel();
                continue;
            }
            if (signal != null) {
                handle(signal);
            }
        }
    }

    // --- signals ---

    private void handle(Signal signal) {
        if (signal instanceof Finished f) {
            onFinished(f.assignment(), f.outcome());
        } else if (signal instanceof Assigned a) {
            start(a.assignment());
        } else if (signal instanceof Requeued r) {
            onRequeued(r.agentId(), r.taskIds());
        }
    }

    private void onFinished(TaskAssignment assignment, TaskOutcome outcome) {
        String taskId = assignment.taskId();
        if (!assignment.equals(runningAssignments.get(taskId))) {
            log.debug("Discarding stale outcome of {} from {}", taskId, assignment.agentId());
            return;
        }
        runningAssignments.remove(taskId);
        runningFutures.remove(taskId);
        services.distributor().complete(taskId);
        outcomes.put(taskId, outcome);

        switch (outcome.status()) {
            case COMPLETED -> setStatus(taskId, TaskStatus.COMPLETED,
                    Map.of("agentId", outcome.agentId(), "elapsedMs", outcome.elapsed().toMillis()));
            case CANCELLED -> setStatus(taskId, TaskStatus.CANCELLED, Map.of("agentId", outcome.agentId()));
            default -> taskFailed(taskId, outcome.error() != null ? outcome.error() : "task failed");
        }
    }

    private void onRequeued(String agentId, List<String> taskIds) {
        for (String taskId : taskIds) {
            TaskAssignment current = runningAssignments.get(taskId);
            if (!owns(taskId) || (current != null && !current.agentId().equals(agentId))) {
                // already picked up again by a retry round
                continue;
            }
            TaskAssignment assignment = runningAssignments.remove(taskId);
            Future<?> future = runningFutures.remove(taskId);
            if (future != null) {
                future.cancel(true);
            }
            if (assignment != null || statuses.get(taskId) == TaskStatus.QUEUED) {
                setStatus(taskId, TaskStatus.QUEUED, Map.of("reason", "agent " + agentId + " lost"));
            }
        }
    }

    // --- scheduling ---

    private void dispatchReady() {
        RegistrySnapshot snapshot = services.registry().snapshot();
        List<TaskUnit> ready = services.scheduler().computeReady(plan, statuses, Integer.MAX_VALUE);
        if (ready.isEmpty()) {
            return;
        }
        var toDistribute = new ArrayList<TaskUnit>();
        for (TaskUnit unit : ready) {
            if (!TaskDistributor.canEverServe(unit, snapshot)) {
                noCapableAgent(unit);
                continue;
            }
            setStatus(unit.id(), TaskStatus.QUEUED, Map.of("capabilities", List.copyOf(unit.requiredCapabilities())));
            toDistribute.add(unit);
        }
        if (toDistribute.isEmpty()) {
            return;
        }
        List<TaskAssignment> made = services.distributor().distribute(toDistribute, priority, snapshot);
        if (made.size() < toDistribute.size()) {
            log.info("{} of {} ready task(s) wait for a free agent", toDistribute.size() - made.size(),
                    toDistribute.size());
        }
        made.forEach(this::start);
    }

    private void retryQueued() {
        List<String> queued = idsWithStatus(TaskStatus.QUEUED);
        if (queued.isEmpty()) {
            return;
        }
        RegistrySnapshot snapshot = services.registry().snapshot();
        for (String taskId : queued) {
            TaskUnit unit = plan.task(taskId).orElse(null);
            if (unit != null && !runningAssignments.containsKey(taskId)
                    && !TaskDistributor.canEverServe(unit, snapshot)) {
                services.distributor().complete(taskId);
                noCapableAgent(unit);
            }
        }
        if (services.distributor().pendingTasks().isEmpty()) {
            return;
        }
        for (TaskAssignment assignment : services.distributor().retryPending(snapshot)) {
            if (owns(assignment.taskId())) {
                start(assignment);
            } else {
                services.router().accept(assignment);
            }
        }
    }

    private void start(TaskAssignment assignment) {
        String taskId = assignment.taskId();
        TaskUnit unit = plan.task(taskId).orElse(null);
        if (unit == null || statuses.getOrDefault(taskId, TaskStatus.PENDING).terminal() || cancelling) {
            services.distributor().complete(taskId);
            return;
        }
        Optional<AgentInstance> agent = services.registry().find(assignment.agentId());
        if (agent.isEmpty()) {
            services.distributor().complete(taskId);
            setStatus(taskId, TaskStatus.PENDING, Map.of("reason", "agent " + assignment.agentId() + " left"));
            return;
        }
        runningAssignments.put(taskId, assignment);
        setStatus(taskId, TaskStatus.RUNNING, Map.of("agentId", assignment.agentId()));
        Future<?> future = services.taskPool().submit(() -> {
            TaskOutcome outcome;
            try {
                outcome = services.engine().execute(unit, assignment, agent.get(), deadline, token);
            } catch (RuntimeException e) {
                log.error("Task {} aborted: {}", taskId, e.getMessage(), e);
                outcome = new TaskOutcome(taskId, assignment.agentId(), TaskStatus.FAILED, List.of(), Map.of(),
                        "Engine error: " + e.getMessage(), Duration.ZERO);
            }
            inbox.add(new Finished(assignment, outcome));
        });
        runningFutures.put(taskId, future);
    }

    private void blockUnreachable() {
        List<String> blocked;
        while (!(blocked = services.scheduler().computeBlocked(plan, statuses)).isEmpty()) {
            for (String taskId : blocked) {
                if (statuses.get(taskId) == TaskStatus.QUEUED) {
                    services.distributor().complete(taskId);
                }
                setStatus(taskId, TaskStatus.BLOCKED, Map.of("reason", "a required predecessor did not complete"));
            }
        }
    }

    private void noCapableAgent(TaskUnit unit) {
        var error = new NoCapableAgentException(unit.id(), unit.requiredCapabilities());
        if (!cancelling && plan.contingencyFor(unit.id()).isPresent()) {
            substitute(unit.id(), error.getMessage());
            return;
        }
        errors.add(error.getMessage());
        setStatus(unit.id(), TaskStatus.FAILED, Map.of("error", error.getMessage()));
    }

    private void taskFailed(String taskId, String error) {
        if (!cancelling && plan.contingencyFor(taskId).isPresent()) {
            substitute(taskId, error);
            return;
        }
        errors.add(taskId + ": " + error);
        setStatus(taskId, TaskStatus.FAILED, Map.of("error", error));
    }

    private void substitute(String taskId, String reason) {
        ContingencyPlan contingency = plan.contingencyFor(taskId).orElseThrow();
        plan = plan.withSubstitution(taskId);
        String fallbackId = contingency.fallback().id();
        log.warn("Task {} replaced by fallback {} ({}); plan {} now at revision {}", taskId, fallbackId, reason,
                planId, plan.revision());
        setStatus(taskId, TaskStatus.SUBSTITUTED,
                Map.of("fallback", fallbackId, "reason", reason, "revision", plan.revision()));
        statuses.put(fallbackId, TaskStatus.PENDING);
        if (services.metrics() != null) {
            services.metrics().recordContingencySubstitution();
        }
        if (services.knowledgeStore() != null) {
            try {
                services.knowledgeStore().savePlan(plan);
            } catch (KnowledgeStoreException e) {
                log.warn("Could not store revision {} of plan {}: {}", plan.revision(), planId, e.getMessage());
            }
        }
    }

    // --- cancellation and completion ---

    private void cancelRemaining() {
        cancelling = true;
        log.info("Cancelling plan {} with {} running task(s)", planId, runningAssignments.size());
        runningFutures.values().forEach(f -> f.cancel(true));
        long graceEnd = System.nanoTime() + services.properties().getMessageTimeout().toNanos();
        while (!runningAssignments.isEmpty()) {
            long left = graceEnd - System.nanoTime();
            if (left <= 0) {
                break;
            }
            Signal signal;
            try {
                signal = inbox.poll(left, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (signal instanceof Finished f) {
                onFinished(f.assignment(), f.outcome());
            }
        }
        services.distributor().withdraw(planId);
        runningAssignments.clear();
        runningFutures.clear();
        markRemaining(TaskStatus.CANCELLED);
    }

    private void markRemaining(TaskStatus terminal) {
        for (var entry : List.copyOf(statuses.entrySet())) {
            if (!entry.getValue().terminal()) {
                setStatus(entry.getKey(), terminal, Map.of());
            }
        }
    }

    /**
     * Asks every agent that ran work for this plan what it believes each task's status is
     * and resolves disagreements before the result is final.
     */
    private void reconcile() {
        var participants = new TreeSet<String>();
        outcomes.values().forEach(o -> participants.add(o.agentId()));
        if (participants.size() < 2) {
            return;
        }
        var reports = new ArrayList<ConflictingValue>();
        for (String agentId : participants) {
            AgentMessage request = AgentMessage.request(MessageType.STATUS, CommunicationBus.COORDINATOR, agentId,
                    Map.of(OPERATION, TASK_REPORT, PLAN_ID, planId));
            try {
                AgentMessage reply = services.messenger().request(agentId, request,
                        services.properties().getMessageTimeout());
                if (reply.payload().get(TASKS) instanceof Map<?, ?> tasks && !tasks.isEmpty()) {
                    var fields = new TreeMap<String, Object>();
                    tasks.forEach((k, v) -> fields.put(String.valueOf(k), String.valueOf(v)));
                    reports.add(new ConflictingValue(agentId, fields, reply.timestamp()));
                }
            } catch (CoordinationException | CancellationException e) {
                log.debug("No task report from {}: {}", agentId, e.getMessage());
            }
        }
        Optional<Conflict> conflict = services.detector().detect("task-status:" + planId, reports);
        if (conflict.isEmpty()) {
            return;
        }
        Conflict c = conflict.get();
        publish(CoordinationEvent.plan("conflict.detected", planId,
                Map.of("conflictId", c.id(), "severity", c.severity().name(), "sources", reports.size())));
        Resolution resolution = services.resolver().resolve(c, token);
        resolutions.add(resolution);
        resolution.resolvedValue().forEach((taskId, value) -> {
            TaskStatus agreed = parseStatus(value);
            TaskStatus current = statuses.get(taskId);
            if (agreed != null && current != null && plan.task(taskId).isPresent() && agreed != current
                    && (agreed == TaskStatus.COMPLETED || agreed == TaskStatus.FAILED)) {
                log.info("Task {} settled as {} (was {}) by conflict {}", taskId, agreed, current, c.id());
                setStatus(taskId, agreed, Map.of("conflictId", c.id()));
            }
        });
        publish(CoordinationEvent.plan("conflict.resolved", planId,
                Map.of("conflictId", c.id(), "strategy", resolution.strategy().name(),
                        "confidence", resolution.confidence())));
    }

    private void finish(PlanStatus terminal) {
        if (terminal != PlanStatus.COMPLETED) {
            services.distributor().withdraw(planId);
        }
        status = terminal;
        Duration elapsed = Duration.between(started != null ? started : Instant.now(), Instant.now());
        var result = new ExecutionResult(planId, plan.revision(), terminal, Map.copyOf(statuses), orderedOutcomes(),
                List.copyOf(resolutions), List.copyOf(errors), elapsed);
        if (services.metrics() != null) {
            services.metrics().recordPlanResult(terminal.name());
        }
        log.info("Plan {} {} in {}ms: {}", planId, terminal, elapsed.toMillis(), countByStatus());
        var payload = new LinkedHashMap<String, Object>();
        payload.put("status", terminal.name());
        payload.put("revision", plan.revision());
        payload.put("tasks", countByStatus());
        payload.put("elapsedMs", elapsed.toMillis());
        publish(CoordinationEvent.plan("plan." + terminal.name().toLowerCase(), planId, payload));
        completion.complete(result);
    }

    // --- signals posted from other threads ---

    void cancel() {
        if (token.cancel()) {
            inbox.add(new Wake());
        }
    }

    void assigned(TaskAssignment assignment) {
        inbox.add(new Assigned(assignment));
    }

    void agentLost(String agentId, List<String> requeuedTaskIds) {
        inbox.add(new Requeued(agentId, requeuedTaskIds));
    }

    void wake() {
        inbox.add(new Wake());
    }

    // --- views ---

    String planId() {
        return planId;
    }

    TaskPlan currentPlan() {
        return plan;
    }

    PlanStatus status() {
        return status;
    }

    Map<String, TaskStatus> taskStatuses() {
        return Map.copyOf(statuses);
    }

    CompletableFuture<ExecutionResult> completion() {
        return completion;
    }

    boolean owns(String taskId) {
        return plan.task(taskId).isPresent();
    }

    // --- helpers ---

    private void setStatus(String taskId, TaskStatus next, Map<String, Object> details) {
        statuses.put(taskId, next);
        var payload = new HashMap<String, Object>(details);
        payload.put("status", next.name());
        publish(CoordinationEvent.task("task." + next.name().toLowerCase(), planId, taskId, payload));
    }

    private void publish(CoordinationEvent event) {
        services.eventBus().publish(event);
    }

    private boolean allTerminal() {
        return plan.tasks().stream().allMatch(t -> statuses.getOrDefault(t.id(), TaskStatus.PENDING).terminal());
    }

    private List<String> idsWithStatus(TaskStatus wanted) {
        return plan.tasks().stream().map(TaskUnit::id).filter(id -> statuses.get(id) == wanted).toList();
    }

    private List<TaskOutcome> orderedOutcomes() {
        Collection<TaskOutcome> all = outcomes.values();
        return all.stream()
                .sorted((a, b) -> a.taskId().compareTo(b.taskId()))
                .toList();
    }

    private Map<String, Long> countByStatus() {
        var counts = new TreeMap<String, Long>();
        statuses.values().forEach(s -> counts.merge(s.name(), 1L, Long::sum));
        return counts;
    }

    private static TaskStatus parseStatus(Object value) {
        try {
            return value != null ? TaskStatus.valueOf(value.toString()) : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
