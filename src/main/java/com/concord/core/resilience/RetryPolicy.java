package com.concord.core.resilience;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Retry policy: only exceptions assignable to one of {@code retryable} are retried,
 * with exponential backoff, up to {@code maxAttempts} calls in total.
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    double multiplier,
    Set<Class<? extends Throwable>> retryable
) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        retryable = retryable != null ? Set.copyOf(retryable) : Set.of();
    }

    public static RetryPolicy of(ResilienceProperties.Retry defaults, Set<Class<? extends Throwable>> retryable) {
        return new RetryPolicy(defaults.getMaxAttempts(), defaults.getInitialBackoff(),
                defaults.getMultiplier(), retryable);
    }

    public boolean isRetryable(Throwable t) {
        return retryable.stream().anyMatch(c -> c.isInstance(t));
    }

    RetryConfig toRetryConfig() {
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, multiplier))
                .retryOnException(this::isRetryable)
                .build();
    }

    /**
     * Same policy, but no retry starts once {@code deadline} has passed and no backoff
     * sleeps past it.
     */
    RetryConfig toRetryConfig(Instant deadline) {
        IntervalFunction backoff = IntervalFunction.ofExponentialBackoff(initialBackoff, multiplier);
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(attempt -> Math.max(0L,
                        Math.min(backoff.apply(attempt), Duration.between(Instant.now(), deadline).toMillis())))
                .retryOnException(t -> isRetryable(t) && Instant.now().isBefore(deadline))
                .build();
    }
}
