package com.concord.core.decision;

import com.concord.core.model.CandidateAction;
import com.concord.core.model.PatternOutcome;
import com.concord.core.model.TaskAssignment;
import com.concord.core.model.TaskUnit;

import java.time.Duration;
import java.util.Map;

/**
 * Carries a selected action to the agent holding the assignment and returns what the
 * agent's workflow-pattern executor reported.
 */
public interface ActionDispatcher {

    /**
     * @param context step context passed to the pattern executor
     * @param timeout how long to wait for the outcome
     * @throws com.concord.core.error.CoordinationException when the agent cannot be reached
     *         or does not answer in time
     */
    PatternOutcome dispatch(TaskAssignment assignment, TaskUnit unit, CandidateAction action,
                            Map<String, Object> context, Duration timeout);
}
