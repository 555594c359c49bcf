package com.concord.dispatch.api;

import com.concord.core.model.ContingencyPlan;
import com.concord.core.model.DependencyEdge;
import com.concord.core.model.TaskPlan;
import com.concord.core.model.TaskUnit;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON response for plan endpoints.
 */
public record PlanResponse(
    @JsonProperty("plan_id") String planId,
    @JsonProperty("objective_id") String objectiveId,
    int revision,
    String complexity,
    @JsonProperty("estimated_duration_ms") long estimatedDurationMs,
    RiskResponse risk,
    List<TaskResponse> tasks,
    List<EdgeResponse> edges,
    List<ContingencyResponse> contingencies
) {

    public record RiskResponse(
        String level,
        double overall,
        @JsonProperty("constraint_violations") int constraintViolations,
        @JsonProperty("task_risks") Map<String, Double> taskRisks
    ) {}

    public record TaskResponse(
        String id,
        String phase,
        String description,
        @JsonProperty("required_capabilities") List<String> requiredCapabilities,
        @JsonProperty("estimated_duration_ms") long estimatedDurationMs,
        List<String> preconditions,
        @JsonProperty("expected_outcome") String expectedOutcome
    ) {}

    public record EdgeResponse(String from, String to, String kind) {}

    public record ContingencyResponse(
        String id,
        @JsonProperty("task_id") String taskId,
        String trigger,
        TaskResponse fallback
    ) {}

    public static PlanResponse from(TaskPlan plan) {
        var risk = plan.risk() != null
                ? new RiskResponse(plan.risk().level().name(), plan.risk().overallRisk(),
                        plan.risk().constraintViolations(), plan.risk().taskRisks())
                : null;
        return new PlanResponse(
                plan.id(),
                plan.objectiveId(),
                plan.revision(),
                plan.complexity() != null ? plan.complexity().name() : null,
                plan.estimatedDuration() != null ? plan.estimatedDuration().toMillis() : 0L,
                risk,
                plan.tasks().stream().map(PlanResponse::task).toList(),
                plan.edges().stream().map(PlanResponse::edge).toList(),
                plan.contingencies().stream().map(PlanResponse::contingency).toList());
    }

    private static TaskResponse task(TaskUnit unit) {
        return new TaskResponse(unit.id(), unit.phase(), unit.description(),
                List.copyOf(unit.requiredCapabilities()), unit.estimatedDuration().toMillis(),
                unit.preconditions(), unit.expectedOutcome());
    }

    private static EdgeResponse edge(DependencyEdge edge) {
        return new EdgeResponse(edge.fromTaskId(), edge.toTaskId(), edge.kind().name());
    }

    private static ContingencyResponse contingency(ContingencyPlan contingency) {
        return new ContingencyResponse(contingency.id(), contingency.taskId(), contingency.triggerCondition(),
                task(contingency.fallback()));
    }
}
