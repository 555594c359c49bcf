package com.concord.core.decision;

import com.concord.core.messaging.CommunicationBus;
import com.concord.core.messaging.ResilientMessenger;
import com.concord.core.model.AgentMessage;
import com.concord.core.model.CandidateAction;
import com.concord.core.model.MessageType;
import com.concord.core.model.PatternOutcome;
import com.concord.core.model.TaskAssignment;
import com.concord.core.model.TaskUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static com.concord.core.decision.PatternProtocol.*;

/**
 * Sends the action to the assigned agent as a REQUEST over the bus, through the
 * agent's circuit, and turns the RESPONSE back into a {@link PatternOutcome}.
 */
@Component
public class BusActionDispatcher implements ActionDispatcher {

    private final ResilientMessenger messenger;

    public BusActionDispatcher(ResilientMessenger messenger) {
        this.messenger = messenger;
    }

    @Override
    public PatternOutcome dispatch(TaskAssignment assignment, TaskUnit unit, CandidateAction action,
                                   Map<String, Object> context, Duration timeout) {
        var body = new HashMap<String, Object>();
        body.put(OPERATION, EXECUTE_PATTERN);
        body.put(PLAN_ID, unit.planId());
        body.put(TASK_ID, unit.id());
        body.put(PATTERN_ID, action.patternId());
        body.put(ACTION_KIND, action.kind().name());
        body.put(CAPABILITY, action.capability());
        body.put(CONTEXT, Map.copyOf(context));
        AgentMessage request = AgentMessage.request(MessageType.REQUEST, CommunicationBus.COORDINATOR,
                assignment.agentId(), body);
        AgentMessage response = messenger.request(assignment.agentId(), request, timeout);
        return toOutcome(response);
    }

    @SuppressWarnings("unchecked")
    static PatternOutcome toOutcome(AgentMessage response) {
        Map<String, Object> payload = response.payload();
        boolean success = Boolean.TRUE.equals(payload.get(SUCCESS));
        Object elapsed = payload.get(ELAPSED_MS);
        Duration took = elapsed instanceof Number n ? Duration.ofMillis(n.longValue()) : Duration.ZERO;
        Object output = payload.get(OUTPUT);
        if (success) {
            return PatternOutcome.succeeded(output instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of(), took);
        }
        String error = response.payloadString(ERROR);
        return PatternOutcome.failed(error != null ? error : "pattern failed", took);
    }
}
