package com.concord.core.messaging;

import com.concord.core.error.QueueFullException;
import com.concord.core.model.AgentMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Bounded FIFO queue for one recipient, drained by a single dispatcher thread so
 * delivery order matches enqueue order.
 */
class Mailbox {

    private static final Logger log = LoggerFactory.getLogger(Mailbox.class);

    private final String address;
    private final BlockingQueue<AgentMessage> queue;
    private final MessageHandler handler;
    private final int maxDeliveryAttempts;
    private final Duration redeliveryDelay;
    private final Consumer<AgentMessage> deadLetters;
    private final Thread dispatcher;
    private volatile boolean running = true;

    Mailbox(String address, int capacity, MessageHandler handler, int maxDeliveryAttempts,
            Duration redeliveryDelay, Consumer<AgentMessage> deadLetters) {
        this.address = address;
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.handler = handler;
        this.maxDeliveryAttempts = Math.max(1, maxDeliveryAttempts);
        this.redeliveryDelay = redeliveryDelay;
        this.deadLetters = deadLetters;
        this.dispatcher = new Thread(this::dispatchLoop, "bus-" + address);
        this.dispatcher.setDaemon(true);
    }

    void start() {
        dispatcher.start();
    }

    /**
     * Enqueues {@code message}, blocking up to {@code timeout} while the mailbox is full.
     *
     * @throws QueueFullException if no room frees up in time
     */
    void enqueue(AgentMessage message, Duration timeout) {
        boolean accepted;
        try {
            accepted = queue.offer(message, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            accepted = false;
        }
        if (!accepted) {
            throw new QueueFullException(address, queue.size());
        }
    }

    int depth() {
        return queue.size();
    }

    /**
     * Stops the dispatcher and returns the messages that were never delivered.
     */
    List<AgentMessage> close() {
        running = false;
        dispatcher.interrupt();
        var undelivered = new ArrayList<AgentMessage>();
        queue.drainTo(undelivered);
        return undelivered;
    }

    private void dispatchLoop() {
        while (running) {
            AgentMessage message;
            try {
                message = queue.take();
            } catch (InterruptedException e) {
                return;
            }
            deliver(message);
        }
    }

    private void deliver(AgentMessage message) {
        for (int attempt = 1; attempt <= maxDeliveryAttempts; attempt++) {
            try {
                handler.handle(message);
                return;
            } catch (RuntimeException e) {
                log.warn("Delivery {}/{} of {} {} to {} failed: {}", attempt, maxDeliveryAttempts,
                        message.type(), message.id(), address, e.getMessage());
                if (attempt < maxDeliveryAttempts && !pause()) {
                    break;
                }
            }
        }
        deadLetters.accept(message);
    }

    private boolean pause() {
        try {
            Thread.sleep(redeliveryDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
