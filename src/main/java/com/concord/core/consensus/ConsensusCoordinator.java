package com.concord.core.consensus;

import com.concord.core.concurrent.CancellationToken;
import com.concord.core.engine.CoordinationProperties;
import com.concord.core.error.ValidationException;
import com.concord.core.messaging.CommunicationBus;
import com.concord.core.messaging.ResilientMessenger;
import com.concord.core.metrics.CoordinationMetrics;
import com.concord.core.model.AgentMessage;
import com.concord.core.model.ConsensusOutcome;
import com.concord.core.model.ConsensusProposal;
import com.concord.core.model.ConsensusResult;
import com.concord.core.model.MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static com.concord.core.consensus.ConsensusProtocol.*;

/**
 * Proposer side of a two-phase quorum protocol.
 * <p>
 * Prepare collects promises, accept collects acceptances from the agents that
 * promised. Both phases need {@code floor(n/2)+1} positive votes within the phase
 * timeout. On success every target receives a commit notice; otherwise every target
 * receives an abort notice, so a value is never partially committed. Terms strictly
 * increase per coordinator.
 */
@Service
public class ConsensusCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ConsensusCoordinator.class);
    private static final long POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(25);

    private final ResilientMessenger messenger;
    private final Duration phaseTimeout;
    private final CoordinationMetrics metrics;
    private final AtomicLong term = new AtomicLong();

    @Autowired
    public ConsensusCoordinator(ResilientMessenger messenger, CoordinationProperties properties,
                                @Autowired(required = false) CoordinationMetrics metrics) {
        this.messenger = messenger;
        this.phaseTimeout = properties.getConsensus().getPhaseTimeout();
        this.metrics = metrics;
    }

    public ConsensusCoordinator(ResilientMessenger messenger, CoordinationProperties properties) {
        this(messenger, properties, null);
    }

    public ConsensusResult propose(Collection<String> agentIds, Map<String, Object> payload) {
        return propose(agentIds, payload, CancellationToken.none());
    }

    /**
     * Runs one consensus round over {@code agentIds}.
     *
     * @throws ValidationException if no agents are given
     */
    public ConsensusResult propose(Collection<String> agentIds, Map<String, Object> payload,
                                   CancellationToken token) {
        if (agentIds == null || agentIds.isEmpty()) {
            throw new ValidationException("Consensus needs at least one participant");
        }
        long started = System.currentTimeMillis();
        var proposal = new ConsensusProposal(UUID.randomUUID().toString(), term.incrementAndGet(),
                payload, Set.copyOf(agentIds));
        int quorum = proposal.quorum();
        log.info("Consensus {} term {} over {} agent(s), quorum {}", proposal.id(), proposal.term(),
                proposal.targetAgentIds().size(), quorum);

        var prepareBody = Map.<String, Object>of(PHASE, PREPARE, PROPOSAL_ID, proposal.id(), TERM, proposal.term());
        Votes promises = collect(proposal.targetAgentIds(), prepareBody, PROMISE, quorum, token);
        if (promises.cancelled()) {
            return finish(proposal, ConsensusOutcome.CANCELLED, "cancelled during prepare", promises.count(), 0, started);
        }
        if (promises.count() < quorum) {
            return finish(proposal, ConsensusOutcome.REJECTED,
                    "prepare: " + promises.count() + "/" + proposal.targetAgentIds().size()
                            + " promises, quorum " + quorum, promises.count(), 0, started);
        }

        var acceptBody = new HashMap<String, Object>();
        acceptBody.put(PHASE, ACCEPT);
        acceptBody.put(PROPOSAL_ID, proposal.id());
        acceptBody.put(TERM, proposal.term());
        acceptBody.put(VALUE, proposal.payload());
        Votes acceptances = collect(promises.voters(), acceptBody, ACCEPTED, quorum, token);
        if (acceptances.cancelled()) {
            return finish(proposal, ConsensusOutcome.CANCELLED, "cancelled during accept",
                    promises.count(), acceptances.count(), started);
        }
        if (acceptances.count() < quorum) {
            return finish(proposal, ConsensusOutcome.REJECTED,
                    "accept: " + acceptances.count() + "/" + proposal.targetAgentIds().size()
                            + " acceptances, quorum " + quorum, promises.count(), acceptances.count(), started);
        }
        return finish(proposal, ConsensusOutcome.ACCEPTED, "quorum reached",
                promises.count(), acceptances.count(), started);
    }

    public long currentTerm() {
        return term.get();
    }

    private record Votes(int count, List<String> voters, boolean cancelled) {}

    private Votes collect(Collection<String> agents, Map<String, Object> body, String positiveVote,
                          int quorum, CancellationToken token) {
        var positive = new AtomicInteger();
        var settled = new AtomicInteger();
        var voters = new CopyOnWriteArrayList<String>();
        var signal = new Semaphore(0);
        for (String agentId : agents) {
            AgentMessage request = AgentMessage.request(MessageType.COORDINATION, CommunicationBus.COORDINATOR,
                    agentId, body);
            CompletableFuture<AgentMessage> reply = messenger.requestAsync(agentId, request, phaseTimeout);
            reply.whenComplete((response, error) -> {
                if (error == null && positiveVote.equals(response.payloadString(VOTE))) {
                    voters.add(agentId);
                    positive.incrementAndGet();
                } else if (error != null) {
                    log.debug("No {} vote from {}: {}", positiveVote, agentId, error.getMessage());
                }
                settled.incrementAndGet();
                signal.release();
            });
        }
        long deadline = System.nanoTime() + phaseTimeout.toNanos();
        while (true) {
            if (token.isCancelled()) {
                return new Votes(positive.get(), List.copyOf(voters), true);
            }
            int votes = positive.get();
            int outstanding = agents.size() - settled.get();
            long remaining = deadline - System.nanoTime();
            if (votes >= quorum || votes + outstanding < quorum || outstanding == 0 || remaining <= 0) {
                return new Votes(votes, List.copyOf(voters), false);
            }
            try {
                signal.tryAcquire(Math.min(remaining, POLL_NANOS), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new Votes(positive.get(), List.copyOf(voters), true);
            }
        }
    }

    private ConsensusResult finish(ConsensusProposal proposal, ConsensusOutcome outcome, String reason,
                                   int promises, int acceptances, long started) {
        boolean accepted = outcome == ConsensusOutcome.ACCEPTED;
        var notice = Map.<String, Object>of(PHASE, accepted ? COMMIT : ABORT,
                PROPOSAL_ID, proposal.id(), TERM, proposal.term());
        var undelivered = new ArrayList<String>();
        for (String agentId : proposal.targetAgentIds()) {
            AgentMessage message = AgentMessage.of(MessageType.COORDINATION, CommunicationBus.COORDINATOR,
                    List.of(agentId), notice);
            if (!messenger.trySend(agentId, message)) {
                undelivered.add(agentId);
            }
        }
        if (!undelivered.isEmpty()) {
            log.debug("{} notice for {} not delivered to {}", accepted ? "Commit" : "Abort", proposal.id(), undelivered);
        }
        var result = new ConsensusResult(proposal.id(), proposal.term(), outcome, reason, promises, acceptances,
                proposal.quorum(), accepted ? proposal.payload() : Map.of(), Instant.now());
        long elapsed = System.currentTimeMillis() - started;
        if (accepted) {
            log.info("Consensus {} accepted ({} promises, {} acceptances) in {}ms", proposal.id(), promises,
                    acceptances, elapsed);
        } else {
            log.warn("Consensus {} {}: {}", proposal.id(), outcome, reason);
        }
        if (metrics != null) {
            metrics.recordConsensus(outcome.name(), elapsed);
        }
        return result;
    }
}
