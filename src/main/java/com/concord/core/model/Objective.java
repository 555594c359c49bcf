package com.concord.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Top-level goal supplied by a caller. Immutable once a plan has been generated from it.
 *
 * @param id               caller-supplied or generated identifier
 * @param description      free-text description, used for complexity and capability inference
 * @param priority         scheduling priority carried into every assignment
 * @param deadline         optional deadline (nullable)
 * @param successCriteria  conditions that define success
 * @param constraints      restrictions on the decomposition
 * @param subObjectives    nested objectives expanded recursively into their own phases
 */
public record Objective(
    String id,
    String description,
    Priority priority,
    Instant deadline,
    List<SuccessCriterion> successCriteria,
    List<Constraint> constraints,
    List<Objective> subObjectives
) implements Serializable {

    public Objective {
        priority = priority != null ? priority : Priority.NORMAL;
        successCriteria = successCriteria != null ? List.copyOf(successCriteria) : List.of();
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
        subObjectives = subObjectives != null ? List.copyOf(subObjectives) : List.of();
    }

    /**
     * Convenience factory for an objective with no criteria, constraints or children.
     */
    public static Objective of(String id, String description) {
        return new Objective(id, description, Priority.NORMAL, null, List.of(), List.of(), List.of());
    }
}
