package com.concord.core.resilience;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Circuit breaker, retry and rate limit defaults applied to every protected call site.
 */
@Component
@ConfigurationProperties(prefix = "concord.resilience")
public class ResilienceProperties {

    /** Consecutive failures that open a circuit. */
    private int failureThreshold = 5;
    /** A failure streak older than this no longer counts. */
    private Duration monitoringPeriod = Duration.ofSeconds(60);
    private Duration openTimeout = Duration.ofSeconds(30);
    private Retry retry = new Retry();
    private RateLimit rateLimit = new RateLimit();

    public int getFailureThreshold() { return failureThreshold; }
    public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
    public Duration getMonitoringPeriod() { return monitoringPeriod; }
    public void setMonitoringPeriod(Duration monitoringPeriod) { this.monitoringPeriod = monitoringPeriod; }
    public Duration getOpenTimeout() { return openTimeout; }
    public void setOpenTimeout(Duration openTimeout) { this.openTimeout = openTimeout; }
    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }
    public RateLimit getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimit rateLimit) { this.rateLimit = rateLimit; }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private double multiplier = 2.0;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }
    }

    /**
     * Token bucket per call site: {@code limitForPeriod} permits every
     * {@code refreshPeriod}; a caller waits at most {@code timeout} for one.
     */
    public static class RateLimit {
        private boolean enabled = true;
        private int limitForPeriod = 50;
        private Duration refreshPeriod = Duration.ofSeconds(1);
        private Duration timeout = Duration.ofMillis(500);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getLimitForPeriod() { return limitForPeriod; }
        public void setLimitForPeriod(int limitForPeriod) { this.limitForPeriod = limitForPeriod; }
        public Duration getRefreshPeriod() { return refreshPeriod; }
        public void setRefreshPeriod(Duration refreshPeriod) { this.refreshPeriod = refreshPeriod; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }
}
