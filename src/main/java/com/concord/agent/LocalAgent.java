package com.concord.agent;

import com.concord.core.consensus.ConsensusParticipant;
import com.concord.core.error.CoordinationException;
import com.concord.core.logging.MdcContext;
import com.concord.core.messaging.CommunicationBus;
import com.concord.core.messaging.MessageDeduplicator;
import com.concord.core.model.AgentInstance;
import com.concord.core.model.AgentMessage;
import com.concord.core.model.AgentStatus;
import com.concord.core.model.PatternOutcome;
import com.concord.core.model.TaskStatus;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static com.concord.core.decision.PatternProtocol.*;

/**
 * A worker agent living in the coordinator's process and reachable only through the
 * {@link CommunicationBus}.
 * <p>
 * Heartbeats, status reports and consensus messages are answered on the mailbox
 * thread. Pattern executions run on the agent's own pool of {@code capacity} threads
 * so a long pattern never delays a heartbeat. Redelivered messages are recognised by
 * id and answered with the reply already sent, without running anything twice.
 */
public class LocalAgent {

    private static final Logger log = LoggerFactory.getLogger(LocalAgent.class);

    private final String id;
    private final Map<String, Double> capabilities;
    private final int capacity;
    private final CommunicationBus bus;
    private final WorkflowPatternExecutor executor;
    private final ConsensusParticipant participant;
    private final MessageDeduplicator deduplicator;
    private final ExecutorService workers;
    private final AtomicInteger running = new AtomicInteger();
    // as many task reports as message ids it remembers
    private final Cache<String, TaskReport> reports;
    private volatile boolean responsive = true;

    private record TaskReport(String planId, TaskStatus status) {}

    public LocalAgent(String id, Map<String, Double> capabilities, int capacity, CommunicationBus bus,
                      WorkflowPatternExecutor executor, int dedupWindow) {
        this.id = id;
        this.capabilities = Map.copyOf(capabilities);
        this.capacity = Math.max(1, capacity);
        this.bus = bus;
        this.executor = executor;
        this.participant = new ConsensusParticipant(id);
        this.deduplicator = new MessageDeduplicator(dedupWindow);
        this.reports = Caffeine.newBuilder()
                .maximumSize(Math.max(1, dedupWindow))
                .executor(Runnable::run)
                .build();
        var counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(this.capacity, r -> {
            Thread t = new Thread(r, id + "-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public String id() {
        return id;
    }

    /** How this agent registers itself. */
    public AgentInstance descriptor() {
        return new AgentInstance(id, capabilities, AgentStatus.AVAILABLE, 0.0, capacity, 0, 0, null);
    }

    public void start() {
        bus.subscribe(id, this::handle);
        log.info("Agent {} listening with capabilities {}", id, capabilities.keySet());
    }

    public void stop() {
        bus.unsubscribe(id);
        workers.shutdownNow();
        log.info("Agent {} stopped", id);
    }

    /**
     * While unresponsive the agent drops every message it receives, as a crashed or
     * partitioned agent would.
     */
    public void setResponsive(boolean responsive) {
        this.responsive = responsive;
    }

    public boolean isResponsive() {
        return responsive;
    }

    public double load() {
        return Math.min(1.0, (double) running.get() / capacity);
    }

    /** Last known status of each task this agent worked on for {@code planId}. */
    public Map<String, String> taskReport(String planId) {
        var tasks = new TreeMap<String, String>();
        reports.asMap().forEach((taskId, report) -> {
            if (report.planId().equals(planId)) {
                tasks.put(taskId, report.status().name());
            }
        });
        return tasks;
    }

    void handle(AgentMessage message) {
        if (!responsive) {
            return;
        }
        try (var mdc = MdcContext.agent(id)) {
            if (deduplicator.isDuplicate(message.id())) {
                log.debug("Duplicate {} {} from {}", message.type(), message.id(), message.sender());
                deduplicator.replyFor(message.id()).ifPresent(this::sendReply);
                return;
            }
            switch (message.type()) {
                case HEARTBEAT:
                    respond(message, Map.of(LOAD, load()));
                    break;
                case REQUEST:
                    onRequest(message);
                    break;
                case STATUS:
                    if (TASK_REPORT.equals(message.payloadString(OPERATION))) {
                        String planId = message.payloadString(PLAN_ID);
                        respond(message, Map.of(PLAN_ID, planId != null ? planId : "",
                                TASKS, planId != null ? taskReport(planId) : Map.of()));
                    } else {
                        respond(message, Map.of(LOAD, load()));
                    }
                    break;
                case COORDINATION:
                    participant.handle(message).ifPresentOrElse(
                            body -> respond(message, body),
                            () -> deduplicator.markProcessed(message.id(), null));
                    break;
                default:
                    log.debug("Agent {} ignores {} from {}", id, message.type(), message.sender());
                    deduplicator.markProcessed(message.id(), null);
            }
        }
    }

    private void onRequest(AgentMessage message) {
        String operation = message.payloadString(OPERATION);
        if (!EXECUTE_PATTERN.equals(operation)) {
            respond(message, Map.of(SUCCESS, false, ERROR, "Unsupported operation: " + operation));
            return;
        }
        // claimed now, answered when the pattern finishes
        deduplicator.markProcessed(message.id(), null);
        try {
            workers.submit(() -> execute(message));
        } catch (RejectedExecutionException e) {
            respond(message, Map.of(SUCCESS, false, ERROR, "Agent " + id + " is shutting down"));
        }
    }

    private void execute(AgentMessage message) {
        String planId = message.payloadString(PLAN_ID);
        String taskId = message.payloadString(TASK_ID);
        String patternId = message.payloadString(PATTERN_ID);
        try (var mdc = MdcContext.task(planId, taskId, id)) {
            respond(message, runPattern(planId, taskId, patternId, message));
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> runPattern(String planId, String taskId, String patternId, AgentMessage message) {
        running.incrementAndGet();
        long start = System.currentTimeMillis();
        PatternOutcome outcome;
        try {
            Object context = message.payload().get(CONTEXT);
            outcome = executor.executePattern(patternId,
                    context instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of());
        } catch (RuntimeException e) {
            log.warn("Pattern {} threw: {}", patternId, e.getMessage());
            outcome = PatternOutcome.failed(e.getClass().getSimpleName() + ": " + e.getMessage(),
                    Duration.ofMillis(System.currentTimeMillis() - start));
        } finally {
            running.decrementAndGet();
        }
        if (taskId != null && planId != null) {
            reports.put(taskId, new TaskReport(planId, outcome.success() ? TaskStatus.COMPLETED : TaskStatus.FAILED));
        }
        log.debug("Pattern {} for {} {} in {}ms", patternId, taskId,
                outcome.success() ? "succeeded" : "failed", outcome.elapsed().toMillis());

        var body = new HashMap<String, Object>();
        body.put(SUCCESS, outcome.success());
        body.put(OUTPUT, outcome.output());
        body.put(ELAPSED_MS, outcome.elapsed().toMillis());
        if (outcome.error() != null) {
            body.put(ERROR, outcome.error());
        }
        return body;
    }

    private void respond(AgentMessage request, Map<String, Object> body) {
        AgentMessage reply = request.reply(id, body);
        deduplicator.markProcessed(request.id(), reply);
        if (request.requiresResponse()) {
            sendReply(reply);
        }
    }

    private void sendReply(AgentMessage reply) {
        if (reply.recipients().isEmpty()) {
            return;
        }
        try {
            bus.send(reply.recipients().get(0), reply);
        } catch (CoordinationException e) {
            // the requester stopped waiting
            log.debug("Reply {} from {} not delivered: {}", reply.correlationId(), id, e.getMessage());
        }
    }
}
