package com.concord.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Terminal result of a consensus round. Immutable once recorded.
 *
 * @param proposalId     the proposal voted on
 * @param term           its term
 * @param outcome        accepted, rejected or cancelled
 * @param reason         why the round ended this way
 * @param promises       promises gathered in the prepare phase
 * @param acceptances    acceptances gathered in the accept phase
 * @param quorum         votes needed in each phase
 * @param committedValue the committed payload when accepted, empty otherwise
 * @param decidedAt      when the round ended
 */
public record ConsensusResult(
    String proposalId,
    long term,
    ConsensusOutcome outcome,
    String reason,
    int promises,
    int acceptances,
    int quorum,
    Map<String, Object> committedValue,
    Instant decidedAt
) implements Serializable {

    public ConsensusResult {
        committedValue = committedValue != null ? Map.copyOf(committedValue) : Map.of();
    }

    public boolean accepted() {
        return outcome == ConsensusOutcome.ACCEPTED;
    }
}
