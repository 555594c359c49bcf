package com.concord.core.messaging;

import com.concord.core.error.AgentUnavailableException;
import com.concord.core.error.CoordinationException;
import com.concord.core.error.MessageTimeoutException;
import com.concord.core.model.AgentMessage;
import com.concord.core.model.MessageType;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Point-to-point and broadcast messaging between the coordinator and agents.
 * <p>
 * Each subscribed address owns a bounded {@link Mailbox}. Delivery is at-least-once:
 * a handler that throws gets the same message again, up to
 * {@code maxDeliveryAttempts}, after which it is kept as a dead letter. Senders block
 * on a full mailbox for at most {@code sendTimeout} and then receive
 * {@link com.concord.core.error.QueueFullException}; nothing is dropped silently.
 * Only the most recent {@code deadLetterRetention} dead letters are kept, but all of
 * them are counted.
 * <p>
 * Responses whose {@code correlationId} matches an outstanding {@link #request}
 * complete that request's future and bypass the mailboxes.
 */
@Service
public class CommunicationBus {

    private static final Logger log = LoggerFactory.getLogger(CommunicationBus.class);

    /** Address of the coordinator side of the bus. */
    public static final String COORDINATOR = "coordinator";

    private final BusProperties properties;
    private final ConcurrentHashMap<String, Mailbox> mailboxes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<AgentMessage>> pending = new ConcurrentHashMap<>();
    private final Deque<AgentMessage> deadLetters = new ArrayDeque<>();
    private final AtomicLong deadLetterCount = new AtomicLong();
    private final ScheduledExecutorService timer;

    public CommunicationBus(BusProperties properties) {
        this.properties = properties;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "bus-timeouts");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Registers {@code handler} as the receiver of messages addressed to {@code address}.
     *
     * @throws IllegalStateException if the address already has a subscriber
     */
    public void subscribe(String address, MessageHandler handler) {
        var mailbox = new Mailbox(address, properties.getMailboxCapacity(), handler,
                properties.getMaxDeliveryAttempts(), properties.getRedeliveryDelay(), this::deadLetter);
        if (mailboxes.putIfAbsent(address, mailbox) != null) {
            throw new IllegalStateException("Address already subscribed: " + address);
        }
        mailbox.start();
        log.debug("Subscribed mailbox {}", address);
    }

    public void unsubscribe(String address) {
        Mailbox mailbox = mailboxes.remove(address);
        if (mailbox != null) {
            List<AgentMessage> undelivered = mailbox.close();
            undelivered.forEach(this::deadLetter);
            log.debug("Unsubscribed mailbox {} ({} undelivered)", address, undelivered.size());
        }
    }

    public boolean isSubscribed(String address) {
        return mailboxes.containsKey(address);
    }

    /**
     * Delivers {@code message} to {@code to}.
     *
     * @throws com.concord.core.error.QueueFullException if the mailbox stays full
     * @throws AgentUnavailableException if nothing is subscribed at {@code to}
     */
    public void send(String to, AgentMessage message) {
        send(to, message, properties.getSendTimeout());
    }

    private void send(String to, AgentMessage message, Duration enqueueTimeout) {
        if (message.type() == MessageType.RESPONSE && message.correlationId() != null) {
            CompletableFuture<AgentMessage> waiting = pending.remove(message.correlationId());
            if (waiting != null) {
                waiting.complete(message);
                return;
            }
        }
        Mailbox mailbox = mailboxes.get(to);
        if (mailbox == null) {
            throw new AgentUnavailableException("No subscriber at " + to);
        }
        mailbox.enqueue(message, enqueueTimeout);
    }

    /**
     * Sends {@code message} to every recipient.
     *
     * @return the recipients it could not be delivered to
     */
    public List<String> broadcast(String from, AgentMessage message, Collection<String> recipients) {
        var failed = new ArrayList<String>();
        for (String recipient : recipients) {
            try {
                send(recipient, message);
            } catch (CoordinationException e) {
                log.debug("Broadcast {} from {} to {} failed: {}", message.type(), from, recipient, e.getMessage());
                failed.add(recipient);
            }
        }
        return failed;
    }

    /**
     * Sends {@code message} and returns a future completed by the response whose
     * {@code correlationId} equals the message id. The future fails with
     * {@link MessageTimeoutException} when no response arrives within {@code timeout},
     * or with the send error when delivery fails. A full mailbox is waited on for no
     * longer than {@code timeout} either.
     */
    public CompletableFuture<AgentMessage> request(String to, AgentMessage message, Duration timeout) {
        var future = new CompletableFuture<AgentMessage>();
        pending.put(message.id(), future);
        try {
            Duration sendTimeout = properties.getSendTimeout();
            send(to, message, timeout.compareTo(sendTimeout) < 0 ? timeout : sendTimeout);
        } catch (CoordinationException e) {
            pending.remove(message.id(), future);
            future.completeExceptionally(e);
            return future;
        }
        timer.schedule(() -> {
            if (pending.remove(message.id(), future)) {
                future.completeExceptionally(new MessageTimeoutException(
                        "No response from " + to + " to " + message.type() + " within " + timeout.toMillis() + "ms"));
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        return future;
    }

    /** Current mailbox depth per address, sorted. */
    public Map<String, Integer> queueDepths() {
        var depths = new TreeMap<String, Integer>();
        mailboxes.forEach((address, mailbox) -> depths.put(address, mailbox.depth()));
        return depths;
    }

    /** The most recent dead letters, oldest first. */
    public List<AgentMessage> deadLetters() {
        synchronized (deadLetters) {
            return List.copyOf(deadLetters);
        }
    }

    /** Every message dead-lettered since startup, including those no longer retained. */
    public long deadLetterCount() {
        return deadLetterCount.get();
    }

    public int pendingRequests() {
        return pending.size();
    }

    private void deadLetter(AgentMessage message) {
        log.error("Dead-lettered {} {} from {} to {}", message.type(), message.id(), message.sender(),
                message.recipients());
        deadLetterCount.incrementAndGet();
        synchronized (deadLetters) {
            deadLetters.addLast(message);
            while (deadLetters.size() > Math.max(1, properties.getDeadLetterRetention())) {
                deadLetters.removeFirst();
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        for (String address : List.copyOf(mailboxes.keySet())) {
            unsubscribe(address);
        }
        timer.shutdownNow();
        pending.values().forEach(f -> f.completeExceptionally(new AgentUnavailableException("Bus shut down")));
        pending.clear();
    }
}
