package com.concord.core.knowledge;

import com.concord.core.model.Conflict;
import com.concord.core.model.Decision;
import com.concord.core.model.HistoricalPattern;
import com.concord.core.model.PatternOutcome;
import com.concord.core.model.Resolution;
import com.concord.core.model.TaskPlan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Plans are kept in their JSON form so a load goes through the
 * same codec as the JDBC store. Nothing survives a restart.
 */
public class InMemoryKnowledgeStore implements KnowledgeStore {

    private final PlanCodec codec = new PlanCodec();
    private final ConcurrentHashMap<String, String> plans = new ConcurrentHashMap<>();
    // context -> patternId -> {successes, samples}
    private final Map<String, Map<String, long[]>> outcomes = new TreeMap<>();
    private final ConcurrentHashMap<String, String> resolutions = new ConcurrentHashMap<>();

    @Override
    public void saveDecisionOutcome(Decision decision, PatternOutcome outcome) {
        if (decision.selected() == null) {
            return;
        }
        synchronized (outcomes) {
            long[] counts = outcomes
                    .computeIfAbsent(decision.selected().capability(), k -> new TreeMap<>())
                    .computeIfAbsent(decision.selected().patternId(), k -> new long[2]);
            if (outcome.success()) {
                counts[0]++;
            }
            counts[1]++;
        }
    }

    @Override
    public List<HistoricalPattern> queryHistoricalPatterns(String context) {
        var patterns = new ArrayList<HistoricalPattern>();
        synchronized (outcomes) {
            Map<String, long[]> byPattern = outcomes.getOrDefault(context, Map.of());
            byPattern.forEach((patternId, counts) -> patterns.add(
                    new HistoricalPattern(context, patternId, (double) counts[0] / counts[1], (int) counts[1])));
        }
        patterns.sort(Comparator.comparingInt(HistoricalPattern::samples).reversed()
                .thenComparing(HistoricalPattern::patternId));
        return patterns;
    }

    @Override
    public void savePlan(TaskPlan plan) {
        plans.put(plan.id(), codec.encode(plan));
    }

    @Override
    public Optional<TaskPlan> loadPlan(String planId) {
        String json = plans.get(planId);
        return json != null ? Optional.of(codec.decode(json)) : Optional.empty();
    }

    @Override
    public void saveResolution(Conflict conflict, Resolution resolution) {
        resolutions.put(conflict.id(), codec.encode(resolution));
    }

    public Optional<Resolution> loadResolution(String conflictId) {
        String json = resolutions.get(conflictId);
        return json != null ? Optional.of(codec.decodeResolution(json)) : Optional.empty();
    }
}
