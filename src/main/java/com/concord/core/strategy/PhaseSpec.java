package com.concord.core.strategy;

import java.time.Duration;
import java.util.List;

/**
 * One phase of a decomposition template.
 *
 * @param name          phase name, e.g. "prepare"
 * @param capability    capability the phase always needs, or null to use the objective's
 *                      primary capability
 * @param duration      default duration estimate
 * @param preconditions checks run as separate steps before the phase's main step
 * @param conditional   true for phases that run even when their predecessor failed
 */
public record PhaseSpec(
    String name,
    String capability,
    Duration duration,
    List<String> preconditions,
    boolean conditional
) {
    public PhaseSpec {
        preconditions = preconditions != null ? List.copyOf(preconditions) : List.of();
    }
}
