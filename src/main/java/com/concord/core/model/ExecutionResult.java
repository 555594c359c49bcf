package com.concord.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Aggregate, terminal outcome of executing a plan.
 *
 * @param planId       plan executed
 * @param planRevision revision in effect at the end (contingency substitutions bump it)
 * @param status       COMPLETED, FAILED or CANCELLED
 * @param taskStatuses final status per task id
 * @param outcomes     per-task engine outcomes
 * @param resolutions  conflicts resolved while finalizing
 * @param errors       plan-level errors
 * @param elapsed      wall-clock duration
 */
public record ExecutionResult(
    String planId,
    int planRevision,
    PlanStatus status,
    Map<String, TaskStatus> taskStatuses,
    List<TaskOutcome> outcomes,
    List<Resolution> resolutions,
    List<String> errors,
    Duration elapsed
) implements Serializable {

    public ExecutionResult {
        taskStatuses = taskStatuses != null ? Map.copyOf(taskStatuses) : Map.of();
        outcomes = outcomes != null ? List.copyOf(outcomes) : List.of();
        resolutions = resolutions != null ? List.copyOf(resolutions) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
