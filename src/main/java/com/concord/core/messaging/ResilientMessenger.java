package com.concord.core.messaging;

import com.concord.core.error.AgentUnavailableException;
import com.concord.core.error.CoordinationException;
import com.concord.core.error.MessageTimeoutException;
import com.concord.core.error.QueueFullException;
import com.concord.core.error.RateLimitedException;
import com.concord.core.model.AgentMessage;
import com.concord.core.resilience.ResilienceGuard;
import com.concord.core.resilience.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Coordinator-side facade over the {@link CommunicationBus}. Every call to an agent
 * runs through that agent's circuit ({@code agent:<id>}); synchronous calls are also
 * rate limited and retry transient delivery failures.
 */
@Service
public class ResilientMessenger {

    private static final Logger log = LoggerFactory.getLogger(ResilientMessenger.class);

    private static final Set<Class<? extends Throwable>> TRANSIENT = Set.of(QueueFullException.class,
            AgentUnavailableException.class, MessageTimeoutException.class, RateLimitedException.class);

    // a timed out request has used up its whole budget
    private static final Set<Class<? extends Throwable>> UNDELIVERED = Set.of(QueueFullException.class,
            AgentUnavailableException.class, RateLimitedException.class);

    private final CommunicationBus bus;
    private final ResilienceGuard guard;
    private final RetryPolicy retryPolicy;
    private final RetryPolicy requestRetryPolicy;

    public ResilientMessenger(CommunicationBus bus, ResilienceGuard guard) {
        this.bus = bus;
        this.guard = guard;
        this.retryPolicy = guard.defaultPolicy(TRANSIENT);
        this.requestRetryPolicy = guard.defaultPolicy(UNDELIVERED);
    }

    public static String callSite(String agentId) {
        return "agent:" + agentId;
    }

    public void send(String agentId, AgentMessage message) {
        guard.callWithRetry(callSite(agentId), () -> {
            bus.send(agentId, message);
            return null;
        }, retryPolicy);
    }

    /**
     * Single-attempt notification that reports failure instead of throwing. Used for
     * fire-and-forget traffic such as commit and abort notices.
     */
    public boolean trySend(String agentId, AgentMessage message) {
        try {
            guard.run(callSite(agentId), () -> bus.send(agentId, message));
            return true;
        } catch (CoordinationException e) {
            log.debug("Notification {} to {} not delivered: {}", message.type(), agentId, e.getMessage());
            return false;
        }
    }

    /**
     * Sends {@code message} and waits for the correlated response, all within
     * {@code timeout}. Only failed deliveries are retried, each attempt with what is left
     * of the timeout; a missing reply is not. Retried attempts reuse the message id so the
     * agent answers them from its de-duplication cache.
     *
     * @throws MessageTimeoutException if no reply arrives within {@code timeout}
     * @throws CancellationException   if the calling thread is interrupted while waiting
     */
    public AgentMessage request(String agentId, AgentMessage message, Duration timeout) {
        Instant deadline = Instant.now().plus(timeout);
        return guard.callWithRetry(callSite(agentId), () -> {
            Duration remaining = Duration.between(Instant.now(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                throw new MessageTimeoutException("No response from " + agentId + " to " + message.type()
                        + " within " + timeout.toMillis() + "ms");
            }
            return await(agentId, bus.request(agentId, message, remaining));
        }, requestRetryPolicy, deadline);
    }

    /**
     * Single-attempt asynchronous request, used where many agents are asked at once and
     * a missing reply simply counts as no vote.
     */
    public CompletableFuture<AgentMessage> requestAsync(String agentId, AgentMessage message, Duration timeout) {
        return guard.callAsync(callSite(agentId), () -> bus.request(agentId, message, timeout));
    }

    private static AgentMessage await(String agentId, CompletableFuture<AgentMessage> response) {
        try {
            return response.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            response.cancel(true);
            throw new CancellationException("Interrupted waiting for " + agentId);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                    ? e.getCause().getCause() : e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new AgentUnavailableException("Request to " + agentId + " failed: " + cause);
        }
    }
}
