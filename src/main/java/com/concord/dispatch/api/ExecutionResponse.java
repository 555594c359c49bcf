package com.concord.dispatch.api;

import com.concord.core.engine.ExecutionHandle;
import com.concord.core.model.ExecutionResult;
import com.concord.core.model.Resolution;
import com.concord.core.model.TaskOutcome;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON response for execution endpoints. While the execution runs only the status
 * fields are filled; outcomes and resolutions appear once it has finished.
 */
public record ExecutionResponse(
    @JsonProperty("plan_id") String planId,
    @JsonProperty("plan_revision") int planRevision,
    String status,
    boolean done,
    @JsonProperty("task_statuses") Map<String, String> taskStatuses,
    List<OutcomeResponse> outcomes,
    List<ResolutionResponse> resolutions,
    List<String> errors,
    @JsonProperty("elapsed_ms") Long elapsedMs
) {

    public record OutcomeResponse(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("agent_id") String agentId,
        String status,
        int decisions,
        String error,
        @JsonProperty("elapsed_ms") long elapsedMs
    ) {}

    public record ResolutionResponse(
        @JsonProperty("conflict_id") String conflictId,
        String strategy,
        @JsonProperty("resolved_value") Map<String, Object> resolvedValue,
        double confidence,
        String rationale,
        @JsonProperty("escalated_fields") List<String> escalatedFields
    ) {}

    public static ExecutionResponse from(ExecutionHandle handle) {
        return handle.result()
                .map(ExecutionResponse::from)
                .orElseGet(() -> new ExecutionResponse(handle.planId(), handle.currentPlan().revision(),
                        handle.status().name(), false, names(handle.taskStatuses()), List.of(), List.of(),
                        List.of(), null));
    }

    public static ExecutionResponse from(ExecutionResult result) {
        return new ExecutionResponse(
                result.planId(),
                result.planRevision(),
                result.status().name(),
                true,
                names(result.taskStatuses()),
                result.outcomes().stream().map(ExecutionResponse::outcome).toList(),
                result.resolutions().stream().map(ExecutionResponse::resolution).toList(),
                result.errors(),
                result.elapsed() != null ? result.elapsed().toMillis() : null);
    }

    private static Map<String, String> names(Map<String, ? extends Enum<?>> statuses) {
        var names = new TreeMap<String, String>();
        statuses.forEach((id, status) -> names.put(id, status.name()));
        return names;
    }

    private static OutcomeResponse outcome(TaskOutcome outcome) {
        return new OutcomeResponse(outcome.taskId(), outcome.agentId(), outcome.status().name(),
                outcome.decisions().size(), outcome.error(),
                outcome.elapsed() != null ? outcome.elapsed().toMillis() : 0L);
    }

    private static ResolutionResponse resolution(Resolution resolution) {
        return new ResolutionResponse(resolution.conflictId(), resolution.strategy().name(),
                resolution.resolvedValue(), resolution.confidence(), resolution.rationale(),
                resolution.escalatedFields());
    }
}
