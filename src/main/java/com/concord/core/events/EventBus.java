package com.concord.core.events;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for progress events, per plan or for all plans.
 * <p>
 * {@link #publish} never blocks and never runs subscriber code on the publishing
 * thread's behalf: each subscriber owns a bounded queue that is drained on the
 * dispatch executor, one event at a time and in publish order. A subscriber that falls
 * {@code capacity} events behind loses the newest progress events; terminal events are
 * always queued, evicting the oldest progress event if need be.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    static final int DEFAULT_CAPACITY = 1024;

    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final int capacity;
    private final AtomicLong dropped = new AtomicLong();

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Subscriber>> planSubscribers =
            new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Subscriber> globalSubscribers = new CopyOnWriteArrayList<>();

    public EventBus() {
        this(dispatchPool(), DEFAULT_CAPACITY);
    }

    /**
     * @param executor runs subscriber deliveries; {@code Runnable::run} delivers on the
     *                 publishing thread
     * @param capacity events a subscriber may fall behind before events are dropped
     */
    public EventBus(Executor executor, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.executor = executor;
        this.ownedExecutor = executor instanceof ExecutorService pool ? pool : null;
        this.capacity = capacity;
    }

    private static ExecutorService dispatchPool() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "event-dispatch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queues {@code event} for its plan's subscribers and for all global subscribers.
     */
    public void publish(CoordinationEvent event) {
        log.debug("Publishing event: {} for plan {}", event.eventType(), event.planId());
        List<Subscriber> planSubs = event.planId() != null ? planSubscribers.get(event.planId()) : null;
        if (planSubs != null) {
            planSubs.forEach(s -> s.offer(event));
        }
        globalSubscribers.forEach(s -> s.offer(event));
    }

    /**
     * Subscribe to events of one plan.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String planId, Consumer<CoordinationEvent> consumer) {
        var subscriber = new Subscriber("plan " + planId, consumer);
        planSubscribers.computeIfAbsent(planId, k -> new CopyOnWriteArrayList<>()).add(subscriber);
        log.debug("Subscribed to plan {}", planId);
        return () -> {
            subscriber.cancel();
            planSubscribers.computeIfPresent(planId, (k, subs) -> {
                subs.remove(subscriber);
                return subs.isEmpty() ? null : subs;
            });
        };
    }

    public Subscription subscribeAll(Consumer<CoordinationEvent> consumer) {
        var subscriber = new Subscriber("all plans", consumer);
        globalSubscribers.add(subscriber);
        return () -> {
            subscriber.cancel();
            globalSubscribers.remove(subscriber);
        };
    }

    /** Events dropped since startup because a subscriber fell behind. */
    public long droppedEvents() {
        return dropped.get();
    }

    @PreDestroy
    public void shutdown() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    /**
     * Handle for cancelling a subscription. Events still queued for the subscriber are
     * discarded.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private final class Subscriber {

        private final String name;
        private final Consumer<CoordinationEvent> consumer;

        // guarded by this
        private final ArrayDeque<CoordinationEvent> queue = new ArrayDeque<>();
        private boolean draining;
        private boolean cancelled;
        private long droppedHere;

        Subscriber(String name, Consumer<CoordinationEvent> consumer) {
            this.name = name;
            this.consumer = consumer;
        }

        void offer(CoordinationEvent event) {
            synchronized (this) {
                if (cancelled) {
                    return;
                }
                if (queue.size() >= capacity && !makeRoomFor(event)) {
                    dropped.incrementAndGet();
                    if (droppedHere++ == 0) {
                        log.warn("Subscriber to {} is {} events behind, dropping progress events", name, capacity);
                    }
                    return;
                }
                queue.addLast(event);
                if (draining) {
                    return;
                }
                draining = true;
            }
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                log.debug("Event dispatch for {} stopped: {}", name, e.getMessage());
                synchronized (this) {
                    draining = false;
                    queue.clear();
                }
            }
        }

        // only a terminal event may push another one out
        private boolean makeRoomFor(CoordinationEvent event) {
            if (!event.terminal()) {
                return false;
            }
            Iterator<CoordinationEvent> it = queue.iterator();
            while (it.hasNext()) {
                if (!it.next().terminal()) {
                    it.remove();
                    dropped.incrementAndGet();
                    return true;
                }
            }
            queue.pollFirst();
            dropped.incrementAndGet();
            return true;
        }

        private void drain() {
            while (true) {
                CoordinationEvent next;
                synchronized (this) {
                    next = cancelled ? null : queue.pollFirst();
                    if (next == null) {
                        draining = false;
                        return;
                    }
                }
                deliverSafely(next);
            }
        }

        synchronized void cancel() {
            cancelled = true;
            queue.clear();
        }

        private void deliverSafely(CoordinationEvent event) {
            try {
                consumer.accept(event);
            } catch (Exception e) {
                log.warn("Subscriber to {} threw processing event {}: {}", name, event.eventType(), e.getMessage(), e);
            }
        }
    }
}
