package com.concord.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Executable plan for an {@link Objective}: ordered task units plus the dependency
 * edges between them. Read-only; {@link #withSubstitution} returns a new revision.
 *
 * @param id                plan id
 * @param objectiveId       the objective this plan was generated from
 * @param complexity        complexity class the decomposition used
 * @param tasks             task units in declaration order
 * @param edges             dependency edges (a DAG over {@code tasks})
 * @param estimatedDuration aggregate duration estimate along the critical path
 * @param risk              risk assessment
 * @param contingencies     fallbacks for high-risk task units
 * @param revision          0 for a freshly planned objective, +1 per substitution
 * @param createdAt         when the planner produced this plan
 */
public record TaskPlan(
    String id,
    String objectiveId,
    ComplexityClass complexity,
    List<TaskUnit> tasks,
    List<DependencyEdge> edges,
    Duration estimatedDuration,
    RiskAssessment risk,
    List<ContingencyPlan> contingencies,
    int revision,
    Instant createdAt
) implements Serializable {

    public TaskPlan {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
        contingencies = contingencies != null ? List.copyOf(contingencies) : List.of();
    }

    public Optional<TaskUnit> task(String taskId) {
        return tasks.stream().filter(t -> t.id().equals(taskId)).findFirst();
    }

    public Optional<ContingencyPlan> contingencyFor(String taskId) {
        return contingencies.stream().filter(c -> c.taskId().equals(taskId)).findFirst();
    }

    /** Edges whose target is the given task. */
    public List<DependencyEdge> incoming(String taskId) {
        return edges.stream().filter(e -> e.toTaskId().equals(taskId)).toList();
    }

    /**
     * Returns the next revision of this plan with {@code taskId} replaced by the
     * fallback unit of its contingency. The fallback takes the original's position
     * and edges; the consumed contingency is dropped.
     *
     * @throws IllegalArgumentException if the task has no contingency
     */
    public TaskPlan withSubstitution(String taskId) {
        ContingencyPlan contingency = contingencyFor(taskId).orElseThrow(
                () -> new IllegalArgumentException("No contingency for task " + taskId));
        TaskUnit fallback = contingency.fallback();

        var newTasks = new ArrayList<TaskUnit>(tasks.size());
        for (var t : tasks) {
            newTasks.add(t.id().equals(taskId) ? fallback : t);
        }
        var newEdges = new ArrayList<DependencyEdge>(edges.size());
        for (var e : edges) {
            String from = e.fromTaskId().equals(taskId) ? fallback.id() : e.fromTaskId();
            String to = e.toTaskId().equals(taskId) ? fallback.id() : e.toTaskId();
            newEdges.add(new DependencyEdge(from, to, e.kind()));
        }
        var remaining = contingencies.stream()
                .filter(c -> !c.taskId().equals(taskId))
                .toList();

        return new TaskPlan(id, objectiveId, complexity, newTasks, newEdges, estimatedDuration,
                risk, remaining, revision + 1, createdAt);
    }
}
