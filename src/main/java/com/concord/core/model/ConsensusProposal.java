package com.concord.core.model;

import java.io.Serializable;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A value put to a quorum vote.
 *
 * @param id        proposal id
 * @param term      proposing term, strictly increasing per coordinator
 * @param payload   the value proposed
 * @param targetAgentIds agents asked to vote
 */
public record ConsensusProposal(
    String id,
    long term,
    Map<String, Object> payload,
    Set<String> targetAgentIds
) implements Serializable {

    public ConsensusProposal {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
        targetAgentIds = targetAgentIds != null
                ? java.util.Collections.unmodifiableSet(new TreeSet<>(targetAgentIds))
                : Set.of();
    }

    /** floor(n/2)+1 over the targeted agents. */
    public int quorum() {
        return targetAgentIds.size() / 2 + 1;
    }
}
