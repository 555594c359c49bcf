package com.concord.core.consensus;

/**
 * Payload keys and values of the consensus exchange carried in
 * {@code COORDINATION} messages.
 */
public final class ConsensusProtocol {

    private ConsensusProtocol() {}

    public static final String PHASE = "phase";
    public static final String PROPOSAL_ID = "proposalId";
    public static final String TERM = "term";
    public static final String VALUE = "value";
    public static final String VOTE = "vote";
    public static final String PROMISED = "promised";
    public static final String ACCEPTED_TERM = "acceptedTerm";

    public static final String PREPARE = "prepare";
    public static final String ACCEPT = "accept";
    public static final String COMMIT = "commit";
    public static final String ABORT = "abort";

    public static final String PROMISE = "promise";
    public static final String ACCEPTED = "accepted";
    public static final String REJECT = "reject";
}
