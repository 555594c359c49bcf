package com.concord.dispatch.api;

import com.concord.core.events.CoordinationEvent;
import com.concord.core.events.EventBus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Streams one plan's {@link CoordinationEvent}s to an HTTP client as server-sent events.
 * <p>
 * Every client gets a {@link PlanStream}: an {@link SseEmitter} fed by its own event bus
 * subscription, so a slow client only holds up itself. Events carry an increasing id
 * per stream. The stream ends after the plan's terminal event, and is dropped on the
 * first failed write. Streams that sent nothing for {@link #IDLE_HEARTBEAT} get a
 * comment line so proxies keep the connection open.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    private static final long DEFAULT_TIMEOUT_MS = Duration.ofMinutes(30).toMillis();

    static final Duration IDLE_HEARTBEAT = Duration.ofSeconds(30);

    private final EventBus eventBus;
    private final long timeoutMs;
    private final Map<String, Set<PlanStream>> streamsByPlan = new ConcurrentHashMap<>();

    private final ScheduledExecutorService heartbeats = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeats() {
        long periodSeconds = IDLE_HEARTBEAT.toSeconds() / 2;
        heartbeats.scheduleAtFixedRate(() -> heartbeatIdle(Instant.now()), periodSeconds, periodSeconds,
                TimeUnit.SECONDS);
    }

    @PreDestroy
    void stop() {
        heartbeats.shutdownNow();
        allStreams().forEach(PlanStream::close);
    }

    /**
     * Opens a stream of the events of {@code planId}.
     */
    public SseEmitter createEmitter(String planId) {
        var stream = new PlanStream(planId, new SseEmitter(timeoutMs));
        streamsByPlan.computeIfAbsent(planId, k -> ConcurrentHashMap.newKeySet()).add(stream);
        stream.open();
        log.info("SSE stream opened for plan {} ({} open for it)", planId, streamsByPlan.get(planId).size());
        return stream.emitter;
    }

    public int activeEmitterCount() {
        return streamsByPlan.values().stream().mapToInt(Set::size).sum();
    }

    public int activeEmitterCount(String planId) {
        Set<PlanStream> streams = streamsByPlan.get(planId);
        return streams != null ? streams.size() : 0;
    }

    /** Sends a heartbeat comment to every stream idle since before {@code now - IDLE_HEARTBEAT}. */
    int heartbeatIdle(Instant now) {
        Instant idleSince = now.minus(IDLE_HEARTBEAT);
        int sent = 0;
        for (PlanStream stream : allStreams()) {
            if (stream.lastSent().isBefore(idleSince) && stream.write(SseEmitter.event().comment("heartbeat"))) {
                sent++;
            }
        }
        return sent;
    }

    static Map<String, Object> eventData(CoordinationEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("planId", event.planId());
        if (event.taskId() != null) {
            data.put("taskId", event.taskId());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        return data;
    }

    private List<PlanStream> allStreams() {
        return streamsByPlan.values().stream().flatMap(Set::stream).toList();
    }

    private void forget(PlanStream stream) {
        streamsByPlan.computeIfPresent(stream.planId, (k, streams) -> {
            streams.remove(stream);
            return streams.isEmpty() ? null : streams;
        });
    }

    /** One client's view of one plan. */
    private final class PlanStream {

        private final String planId;
        private final SseEmitter emitter;
        private final AtomicLong nextEventId = new AtomicLong();
        private volatile Instant lastSent = Instant.now();
        private volatile EventBus.Subscription subscription;

        PlanStream(String planId, SseEmitter emitter) {
            this.planId = planId;
            this.emitter = emitter;
        }

        void open() {
            emitter.onCompletion(this::release);
            emitter.onTimeout(() -> {
                log.debug("SSE stream for plan {} timed out", planId);
                release();
            });
            emitter.onError(ex -> {
                log.debug("SSE stream for plan {} failed: {}", planId, ex.getMessage());
                release();
            });
            subscription = eventBus.subscribe(planId, this::onEvent);
            write(SseEmitter.event().comment("connected"));
        }

        Instant lastSent() {
            return lastSent;
        }

        private void onEvent(CoordinationEvent event) {
            boolean sent = write(SseEmitter.event()
                    .id(String.valueOf(nextEventId.incrementAndGet()))
                    .name(event.eventType())
                    .data(eventData(event)));
            if (sent && event.terminal()) {
                close();
            }
        }

        boolean write(SseEmitter.SseEventBuilder frame) {
            try {
                emitter.send(frame);
                lastSent = Instant.now();
                return true;
            } catch (IOException | IllegalStateException e) {
                log.debug("SSE write for plan {} failed, dropping stream: {}", planId, e.getMessage());
                release();
                return false;
            }
        }

        void close() {
            emitter.complete();
            release();
        }

        private void release() {
            EventBus.Subscription current = subscription;
            if (current != null) {
                current.unsubscribe();
            }
            forget(this);
        }
    }
}
