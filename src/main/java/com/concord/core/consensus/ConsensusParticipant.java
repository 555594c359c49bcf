package com.concord.core.consensus;

import com.concord.core.model.AgentMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.concord.core.consensus.ConsensusProtocol.*;

/**
 * Acceptor side of the consensus exchange, held by each agent.
 * <p>
 * A prepare is promised only for a term strictly greater than any term promised
 * before; an accept is honoured only for a term not lower than the highest promise.
 * A promise reports the term of the value accepted so far, if any. Commit and abort
 * notices apply only to the proposal and term last accepted.
 */
public class ConsensusParticipant {

    private static final Logger log = LoggerFactory.getLogger(ConsensusParticipant.class);

    private final String agentId;
    private long highestPromised;
    private long acceptedTerm;
    private String acceptedProposal;
    private Map<String, Object> acceptedValue = Map.of();
    private final List<String> committed = new ArrayList<>();

    public ConsensusParticipant(String agentId) {
        this.agentId = agentId;
    }

    /**
     * Handles one coordination message.
     *
     * @return the reply body, or empty for commit and abort notices
     */
    public synchronized Optional<Map<String, Object>> handle(AgentMessage message) {
        String phase = message.payloadString(PHASE);
        String proposalId = message.payloadString(PROPOSAL_ID);
        long term = termOf(message);
        if (phase == null) {
            return Optional.empty();
        }
        switch (phase) {
            case PREPARE:
                return Optional.of(prepare(proposalId, term));
            case ACCEPT:
                return Optional.of(accept(proposalId, term, valueOf(message)));
            case COMMIT:
                if (isCurrentAcceptance(proposalId, term)) {
                    committed.add(proposalId);
                    log.debug("Agent {} committed {} at term {}", agentId, proposalId, term);
                } else {
                    log.debug("Agent {} ignoring stale commit of {} at term {} (accepted term {})",
                            agentId, proposalId, term, acceptedTerm);
                }
                return Optional.empty();
            case ABORT:
                if (isCurrentAcceptance(proposalId, term)) {
                    acceptedProposal = null;
                    acceptedValue = Map.of();
                }
                return Optional.empty();
            default:
                log.warn("Agent {} ignoring unknown consensus phase {}", agentId, phase);
                return Optional.empty();
        }
    }

    private Map<String, Object> prepare(String proposalId, long term) {
        if (term <= highestPromised) {
            log.debug("Agent {} refuses prepare {} at term {} (promised {})", agentId, proposalId, term, highestPromised);
            return Map.of(VOTE, REJECT, PROMISED, highestPromised);
        }
        highestPromised = term;
        if (acceptedProposal != null) {
            return Map.of(VOTE, PROMISE, TERM, term, ACCEPTED_TERM, acceptedTerm);
        }
        return Map.of(VOTE, PROMISE, TERM, term);
    }

    private boolean isCurrentAcceptance(String proposalId, long term) {
        return proposalId != null && proposalId.equals(acceptedProposal) && term == acceptedTerm;
    }

    private Map<String, Object> accept(String proposalId, long term, Map<String, Object> value) {
        if (term < highestPromised) {
            return Map.of(VOTE, REJECT, PROMISED, highestPromised);
        }
        highestPromised = term;
        acceptedTerm = term;
        acceptedProposal = proposalId;
        acceptedValue = value;
        return Map.of(VOTE, ACCEPTED, TERM, term);
    }

    public synchronized long highestPromised() {
        return highestPromised;
    }

    public synchronized long acceptedTerm() {
        return acceptedTerm;
    }

    public synchronized Map<String, Object> acceptedValue() {
        return acceptedValue;
    }

    public synchronized List<String> committed() {
        return List.copyOf(committed);
    }

    private static long termOf(AgentMessage message) {
        Object term = message.payload().get(TERM);
        if (term instanceof Number n) {
            return n.longValue();
        }
        return term != null ? Long.parseLong(term.toString()) : 0L;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> valueOf(AgentMessage message) {
        Object value = message.payload().get(VALUE);
        return value instanceof Map<?, ?> m ? new HashMap<>((Map<String, Object>) m) : Map.of();
    }
}
