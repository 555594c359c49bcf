package com.concord.core.resilience;

import com.concord.core.error.CircuitOpenException;
import com.concord.core.error.CoordinationException;
import com.concord.core.error.ErrorCategory;
import com.concord.core.error.RateLimitedException;
import com.concord.core.metrics.CoordinationMetrics;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Circuit breaker and rate limiter per call site, plus an independent, composable retry
 * wrapper.
 * <p>
 * A call site's circuit opens after {@code failureThreshold} consecutive failures; a
 * success in between starts the count again, and so does a streak that began more than
 * {@code monitoringPeriod} ago. An open circuit fails fast with
 * {@link CircuitOpenException} for {@code openTimeout}, then lets a single trial call
 * through: success closes it, failure reopens it. Validation and feasibility errors
 * are the caller's fault and are not counted against the dependency.
 */
@Service
public class ResilienceGuard {

    private static final Logger log = LoggerFactory.getLogger(ResilienceGuard.class);

    private final CircuitBreakerRegistry circuitBreakers;
    private final RateLimiterRegistry rateLimiters;
    private final ConcurrentHashMap<String, Instant> failureStreaks = new ConcurrentHashMap<>();
    private final ResilienceProperties properties;
    private final CoordinationMetrics metrics;
    private final AtomicLong retrySequence = new AtomicLong();

    @Autowired
    public ResilienceGuard(ResilienceProperties properties,
                           @Autowired(required = false) CoordinationMetrics metrics) {
        this.properties = properties;
        this.metrics = metrics;
        this.circuitBreakers = CircuitBreakerRegistry.of(circuitConfig(properties));
        this.rateLimiters = RateLimiterRegistry.of(rateLimiterConfig(properties.getRateLimit()));
        this.circuitBreakers.getEventPublisher().onEntryAdded(event -> {
            CircuitBreaker added = event.getAddedEntry();
            added.getEventPublisher()
                    .onError(e -> failureStreaks.putIfAbsent(added.getName(), Instant.now()))
                    .onSuccess(e -> failureStreaks.remove(added.getName()));
            added.getEventPublisher().onStateTransition(transition -> {
                log.warn("Circuit '{}' {}", added.getName(), transition.getStateTransition());
                if (this.metrics != null) {
                    this.metrics.recordCircuitTransition(added.getName(),
                            transition.getStateTransition().getToState().name());
                }
            });
        });
    }

    public ResilienceGuard(ResilienceProperties properties) {
        this(properties, null);
    }

    private static CircuitBreakerConfig circuitConfig(ResilienceProperties p) {
        int threshold = Math.max(1, p.getFailureThreshold());
        // a full window of failures and nothing else
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(p.getOpenTimeout())
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .ignoreException(ResilienceGuard::isCallerError)
                .build();
    }

    private static RateLimiterConfig rateLimiterConfig(ResilienceProperties.RateLimit r) {
        return RateLimiterConfig.custom()
                .limitForPeriod(Math.max(1, r.getLimitForPeriod()))
                .limitRefreshPeriod(r.getRefreshPeriod())
                .timeoutDuration(r.getTimeout())
                .build();
    }

    private static boolean isCallerError(Throwable t) {
        if (t instanceof CancellationException) {
            return true;
        }
        return t instanceof CoordinationException ce
                && (ce.getCategory() == ErrorCategory.VALIDATION || ce.getCategory() == ErrorCategory.FEASIBILITY);
    }

    /**
     * Runs {@code operation} through the circuit of {@code callSite}.
     *
     * @throws CircuitOpenException if the circuit is open; the operation is not invoked
     */
    public <T> T call(String callSite, Supplier<T> operation) {
        CircuitBreaker circuit = circuit(callSite);
        try {
            return circuit.executeSupplier(operation);
        } catch (CallNotPermittedException e) {
            log.debug("Call to '{}' rejected, circuit {}", callSite, circuit.getState());
            throw new CircuitOpenException(callSite, e);
        }
    }

    /**
     * Asynchronous variant of {@link #call}: the stage's outcome is recorded against the
     * circuit when it completes. While the circuit is open the returned future fails with
     * {@link CircuitOpenException} and {@code operation} is not invoked.
     */
    public <T> CompletableFuture<T> callAsync(String callSite, Supplier<CompletionStage<T>> operation) {
        CircuitBreaker circuit = circuit(callSite);
        return CircuitBreaker.decorateCompletionStage(circuit, operation).get()
                .toCompletableFuture()
                .handle((value, error) -> {
                    if (error == null) {
                        return value;
                    }
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause() : error;
                    if (cause instanceof CallNotPermittedException) {
                        throw new CircuitOpenException(callSite, cause);
                    }
                    throw cause instanceof RuntimeException re ? re : new CompletionException(cause);
                });
    }

    /**
     * Like {@link #call}, but first takes a permit from the call site's rate limiter,
     * waiting at most the configured rate limit timeout.
     *
     * @throws RateLimitedException if no permit frees up in time; the operation is not invoked
     */
    public <T> T callThrottled(String callSite, Supplier<T> operation) {
        if (properties.getRateLimit().isEnabled()) {
            RateLimiter limiter = rateLimiters.rateLimiter(callSite);
            if (!limiter.acquirePermission()) {
                log.debug("Call to '{}' throttled", callSite);
                throw new RateLimitedException(callSite);
            }
        }
        return call(callSite, operation);
    }

    public void run(String callSite, Runnable operation) {
        call(callSite, () -> {
            operation.run();
            return null;
        });
    }

    /**
     * Retries {@code operation} according to {@code policy}. Exceptions outside the
     * policy's retryable set propagate on the first failure.
     */
    public <T> T executeWithRetry(Supplier<T> operation, RetryPolicy policy) {
        Retry retry = Retry.of("retry-" + retrySequence.incrementAndGet(), policy.toRetryConfig());
        retry.getEventPublisher().onRetry(event ->
                log.debug("Retry attempt {} after {}", event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "failure"));
        return Retry.decorateSupplier(retry, operation).get();
    }

    /**
     * {@link #executeWithRetry(Supplier, RetryPolicy)} bounded by {@code deadline}: once it
     * has passed the last failure propagates instead of being retried.
     */
    public <T> T executeWithRetry(Supplier<T> operation, RetryPolicy policy, Instant deadline) {
        Retry retry = Retry.of("retry-" + retrySequence.incrementAndGet(), policy.toRetryConfig(deadline));
        return Retry.decorateSupplier(retry, operation).get();
    }

    /**
     * Retry wrapped around the rate limiter and circuit of {@code callSite}; each attempt
     * counts against the circuit.
     */
    public <T> T callWithRetry(String callSite, Supplier<T> operation, RetryPolicy policy) {
        return executeWithRetry(() -> callThrottled(callSite, operation), policy);
    }

    public <T> T callWithRetry(String callSite, Supplier<T> operation, RetryPolicy policy, Instant deadline) {
        return executeWithRetry(() -> callThrottled(callSite, operation), policy, deadline);
    }

    public RetryPolicy defaultPolicy(Set<Class<? extends Throwable>> retryable) {
        return RetryPolicy.of(properties.getRetry(), retryable);
    }

    public CircuitBreaker.State state(String callSite) {
        return circuitBreakers.circuitBreaker(callSite).getState();
    }

    private CircuitBreaker circuit(String callSite) {
        CircuitBreaker circuit = circuitBreakers.circuitBreaker(callSite);
        Instant streakStart = failureStreaks.get(callSite);
        if (streakStart != null && circuit.getState() == CircuitBreaker.State.CLOSED
                && Duration.between(streakStart, Instant.now()).compareTo(properties.getMonitoringPeriod()) > 0) {
            log.debug("Failure streak of '{}' expired", callSite);
            failureStreaks.remove(callSite, streakStart);
            circuit.reset();
        }
        return circuit;
    }

    /** Circuit state per call site seen so far, sorted by name. */
    public Map<String, String> circuitStates() {
        var states = new TreeMap<String, String>();
        for (CircuitBreaker circuit : circuitBreakers.getAllCircuitBreakers()) {
            states.put(circuit.getName(), circuit.getState().name());
        }
        return states;
    }

    public void reset(String callSite) {
        failureStreaks.remove(callSite);
        circuitBreakers.find(callSite).ifPresent(CircuitBreaker::reset);
    }
}
