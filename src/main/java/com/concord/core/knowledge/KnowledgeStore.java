package com.concord.core.knowledge;

import com.concord.core.model.Conflict;
import com.concord.core.model.Decision;
import com.concord.core.model.HistoricalPattern;
import com.concord.core.model.PatternOutcome;
import com.concord.core.model.Resolution;
import com.concord.core.model.TaskPlan;

import java.util.List;
import java.util.Optional;

/**
 * Durable memory of plans, decision outcomes and conflict resolutions.
 * <p>
 * Callers treat the store as best effort: a failing store must not fail planning or
 * execution, so implementations throw {@link KnowledgeStoreException} and callers log it.
 */
public interface KnowledgeStore {

    /**
     * Records what happened after {@code decision} was acted on. The decision's selected
     * action provides the context (its capability) and the pattern id.
     */
    void saveDecisionOutcome(Decision decision, PatternOutcome outcome);

    /**
     * Outcome history for a context (a capability tag), one entry per pattern, most
     * sampled first.
     */
    List<HistoricalPattern> queryHistoricalPatterns(String context);

    /** Stores a plan revision, replacing any earlier revision with the same id. */
    void savePlan(TaskPlan plan);

    Optional<TaskPlan> loadPlan(String planId);

    void saveResolution(Conflict conflict, Resolution resolution);
}
