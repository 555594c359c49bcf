package com.concord.core.model;

import java.io.Serializable;

/**
 * An action the decision engine may take for a step.
 *
 * @param id                 unique within the decision
 * @param patternId          workflow pattern the executor runs
 * @param kind               execution shape
 * @param capability         capability tag the action exercises
 * @param successProbability expected success probability 0..1
 * @param resourceCost       relative resource cost, 0 = free
 * @param deadlineFit        0..1, how well the action fits the remaining time
 * @param score              multi-factor score used for selection
 */
public record CandidateAction(
    String id,
    String patternId,
    ActionKind kind,
    String capability,
    double successProbability,
    double resourceCost,
    double deadlineFit,
    double score
) implements Serializable {

    public CandidateAction withScore(double newScore, double newSuccess, double newDeadlineFit) {
        return new CandidateAction(id, patternId, kind, capability, newSuccess, resourceCost,
                newDeadlineFit, newScore);
    }
}
