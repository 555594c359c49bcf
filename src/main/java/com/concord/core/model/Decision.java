package com.concord.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Entry of a task's append-only decision log.
 *
 * @param id                   decision id
 * @param taskId               task unit being executed
 * @param timestamp            when it was made
 * @param type                 decision type
 * @param kind                 what the entry records
 * @param step                 step index the decision belongs to (-1 for terminal entries)
 * @param selected             chosen action (null for backtrack and terminal entries)
 * @param confidence           confidence in the choice, 0..1
 * @param rejectedAlternatives the candidates not chosen, best first
 * @param rationale            explanation
 * @param parentId             previous decision this one follows from (nullable)
 */
public record Decision(
    String id,
    String taskId,
    Instant timestamp,
    DecisionType type,
    DecisionKind kind,
    int step,
    CandidateAction selected,
    double confidence,
    List<CandidateAction> rejectedAlternatives,
    String rationale,
    String parentId
) implements Serializable {

    public Decision {
        rejectedAlternatives = rejectedAlternatives != null ? List.copyOf(rejectedAlternatives) : List.of();
    }
}
