package com.concord.agent;

import com.concord.core.model.PatternOutcome;

import java.util.Map;

/**
 * Runs a named workflow pattern on behalf of an agent.
 * <p>
 * Implementations report failure through {@link PatternOutcome#failed} rather than by
 * throwing; an exception is treated by the agent as a failed outcome carrying its
 * message.
 */
@FunctionalInterface
public interface WorkflowPatternExecutor {

    PatternOutcome executePattern(String patternId, Map<String, Object> context);
}
