package com.concord.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for planning and coordination.
 */
@Service
public class CoordinationMetrics {

    private final MeterRegistry registry;

    public CoordinationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPlanningDuration(String complexity, long ms) {
        Timer.builder("concord.planning.duration")
                .tag("complexity", complexity)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPlanSize(int taskCount) {
        DistributionSummary.builder("concord.plan.tasks")
                .description("Task units per generated plan")
                .register(registry)
                .record(taskCount);
    }

    public void recordTaskExecution(String status, long ms) {
        Timer.builder("concord.task.duration")
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPlanResult(String status) {
        Counter.builder("concord.plans.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordBacktrack() {
        Counter.builder("concord.decision.backtracks")
                .description("Backtracks taken by the decision engine")
                .register(registry)
                .increment();
    }

    public void recordAssignments(int assigned, int queued) {
        Counter.builder("concord.distribution.assigned").register(registry).increment(assigned);
        Counter.builder("concord.distribution.queued").register(registry).increment(queued);
    }

    /**
     * Records the end of a consensus round.
     *
     * @param outcome ACCEPTED, REJECTED or CANCELLED
     */
    public void recordConsensus(String outcome, long ms) {
        Timer.builder("concord.consensus.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordConflictResolution(String severity, String strategy) {
        Counter.builder("concord.conflicts.resolved")
                .tag("severity", severity)
                .tag("strategy", strategy)
                .register(registry)
                .increment();
    }

    public void recordCircuitTransition(String callSite, String toState) {
        Counter.builder("concord.circuit.transitions")
                .description("Circuit breaker state transitions")
                .tag("to", toState)
                .register(registry)
                .increment();
    }

    public void recordAgentLost(String agentId) {
        Counter.builder("concord.agents.lost")
                .description("Agents marked unreachable after missed heartbeats")
                .register(registry)
                .increment();
    }

    public void recordContingencySubstitution() {
        Counter.builder("concord.contingency.substitutions")
                .register(registry)
                .increment();
    }
}
