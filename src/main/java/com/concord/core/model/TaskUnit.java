package com.concord.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Smallest independently assignable unit of work within a {@link TaskPlan}.
 *
 * @param id                   globally unique id ({@code <planId>-T001})
 * @param planId               owning plan
 * @param phase                template phase this unit was expanded from (e.g. "prepare")
 * @param description          what the unit should accomplish
 * @param requiredCapabilities capability tags an agent must declare to take the unit
 * @param estimatedDuration    planner's duration estimate
 * @param preconditions        conditions established, in order, before the main step
 * @param expectedOutcome      descriptor of the outcome that counts as success
 * @param timeout              how long an execution may take; null for the configured default
 */
public record TaskUnit(
    String id,
    String planId,
    String phase,
    String description,
    Set<String> requiredCapabilities,
    Duration estimatedDuration,
    List<String> preconditions,
    String expectedOutcome,
    Duration timeout
) implements Serializable {

    public TaskUnit(String id, String planId, String phase, String description, Set<String> requiredCapabilities,
                    Duration estimatedDuration, List<String> preconditions, String expectedOutcome) {
        this(id, planId, phase, description, requiredCapabilities, estimatedDuration, preconditions, expectedOutcome,
                null);
    }

    public TaskUnit {
        requiredCapabilities = requiredCapabilities != null
                ? java.util.Collections.unmodifiableSet(new TreeSet<>(requiredCapabilities))
                : Set.of();
        preconditions = preconditions != null ? List.copyOf(preconditions) : List.of();
        estimatedDuration = estimatedDuration != null ? estimatedDuration : Duration.ZERO;
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    /** {@link #timeout()} if declared, otherwise {@code fallback}. */
    public Duration timeoutOr(Duration fallback) {
        return timeout != null ? timeout : fallback;
    }
}
