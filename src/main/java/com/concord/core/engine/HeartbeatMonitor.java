package com.concord.core.engine;

import com.concord.core.distribution.TaskDistributor;
import com.concord.core.error.ValidationException;
import com.concord.core.messaging.CommunicationBus;
import com.concord.core.messaging.ResilientMessenger;
import com.concord.core.metrics.CoordinationMetrics;
import com.concord.core.model.AgentInstance;
import com.concord.core.model.AgentMessage;
import com.concord.core.model.MessageType;
import com.concord.core.registry.AgentRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiConsumer;

import static com.concord.core.decision.PatternProtocol.LOAD;
import static com.concord.core.decision.PatternProtocol.OPERATION;
import static com.concord.core.decision.PatternProtocol.PING;

/**
 * Runs heartbeat rounds over the bus and keeps registry liveness current. An agent that
 * misses the configured number of consecutive rounds becomes UNREACHABLE; its
 * assignments are taken back and queued again, and lost-agent listeners are told which
 * tasks moved.
 */
@Service
public class HeartbeatMonitor {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final AgentRegistry registry;
    private final ResilientMessenger messenger;
    private final TaskDistributor distributor;
    private final CoordinationProperties properties;
    private final CoordinationMetrics metrics;
    private final List<BiConsumer<String, List<String>>> lostAgentListeners = new CopyOnWriteArrayList<>();
    private ScheduledExecutorService scheduler;

    @Autowired
    public HeartbeatMonitor(AgentRegistry registry, ResilientMessenger messenger, TaskDistributor distributor,
                            CoordinationProperties properties,
                            @Autowired(required = false) CoordinationMetrics metrics) {
        this.registry = registry;
        this.messenger = messenger;
        this.distributor = distributor;
        this.properties = properties;
        this.metrics = metrics;
    }

    @PostConstruct
    public synchronized void start() {
        Duration interval = properties.getRegistry().getHeartbeatInterval();
        if (interval == null || interval.isZero() || interval.isNegative() || scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "heartbeat");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::safeRound, interval.toMillis(), interval.toMillis(),
                TimeUnit.MILLISECONDS);
        log.info("Heartbeat monitor started, interval {}", interval);
    }

    @PreDestroy
    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    /** Called with the lost agent's id and the ids of the tasks taken back from it. */
    public void addLostAgentListener(BiConsumer<String, List<String>> listener) {
        lostAgentListeners.add(listener);
    }

    /**
     * Pings every registered agent once and waits for the replies.
     *
     * @return ids of the agents that became UNREACHABLE in this round
     */
    public List<String> runRound() {
        Duration timeout = properties.getRegistry().getHeartbeatTimeout();
        var replies = new LinkedHashMap<String, CompletableFuture<AgentMessage>>();
        for (AgentInstance agent : registry.snapshot().agents().values()) {
            AgentMessage ping = AgentMessage.request(MessageType.HEARTBEAT, CommunicationBus.COORDINATOR, agent.id(),
                    Map.of(OPERATION, PING));
            replies.put(agent.id(), messenger.requestAsync(agent.id(), ping, timeout));
        }

        var responded = new ArrayList<String>();
        long waitUntil = System.nanoTime() + timeout.toNanos();
        for (Map.Entry<String, CompletableFuture<AgentMessage>> entry : replies.entrySet()) {
            String agentId = entry.getKey();
            try {
                long left = Math.max(0, waitUntil - System.nanoTime());
                AgentMessage reply = entry.getValue().get(left, TimeUnit.NANOSECONDS);
                Object load = reply.payload().get(LOAD);
                registry.recordHeartbeat(agentId, load instanceof Number n ? n.doubleValue() : 0.0);
                responded.add(agentId);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return List.of();
            } catch (ExecutionException | TimeoutException e) {
                log.debug("No heartbeat from {}: {}", agentId, e.getMessage());
            } catch (ValidationException e) {
                log.debug("Agent {} left during the heartbeat round", agentId);
            }
        }

        List<String> lost = registry.completeHeartbeatRound(responded);
        for (String agentId : lost) {
            if (metrics != null) {
                metrics.recordAgentLost(agentId);
            }
            List<String> requeued = distributor.requeueAgent(agentId);
            for (BiConsumer<String, List<String>> listener : lostAgentListeners) {
                listener.accept(agentId, requeued);
            }
        }
        return lost;
    }

    private void safeRound() {
        try {
            runRound();
        } catch (RuntimeException e) {
            log.warn("Heartbeat round failed: {}", e.getMessage(), e);
        }
    }
}
