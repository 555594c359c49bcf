package com.concord.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the coordination runtime. DOWN when any component is
 * down, DEGRADED when any is degraded.
 */
@Component("coordinationHealthIndicator")
public class CoordinationHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public CoordinationHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        boolean anyDown = false;
        boolean anyDegraded = false;
        var builder = Health.unknown();
        for (HealthStatus check : healthCheckService.checkAll()) {
            builder.withDetail(check.component(), check.status() + ": " + check.detail());
            anyDown |= check.status() == HealthStatus.Status.DOWN;
            anyDegraded |= check.status() == HealthStatus.Status.DEGRADED;
        }
        if (anyDown) {
            return builder.down().build();
        }
        return anyDegraded ? builder.status("DEGRADED").build() : builder.up().build();
    }
}
