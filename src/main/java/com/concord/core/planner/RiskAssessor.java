package com.concord.core.planner;

import com.concord.core.knowledge.KnowledgeStore;
import com.concord.core.model.HistoricalPattern;
import com.concord.core.model.RiskAssessment;
import com.concord.core.model.RiskLevel;
import com.concord.core.model.TaskUnit;
import com.concord.core.registry.RegistrySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Weighs complexity, optional-constraint violations, resource scarcity and recorded
 * failure history into a plan risk, and derives a risk per task from it.
 */
public class RiskAssessor {

    private static final Logger log = LoggerFactory.getLogger(RiskAssessor.class);

    private final PlannerProperties properties;
    private final KnowledgeStore knowledgeStore;

    public RiskAssessor(PlannerProperties properties, KnowledgeStore knowledgeStore) {
        this.properties = properties;
        this.knowledgeStore = knowledgeStore;
    }

    public RiskAssessment assess(List<TaskUnit> tasks, DependencyGraph graph, double complexityScore,
                                 int constraintViolations, RegistrySnapshot snapshot) {
        Set<String> capabilities = new LinkedHashSet<>();
        tasks.forEach(t -> capabilities.addAll(t.requiredCapabilities()));
        long scarce = capabilities.stream().filter(c -> !snapshot.hasAssignableAgentFor(c)).count();
        double scarcity = capabilities.isEmpty() ? 0.0 : (double) scarce / capabilities.size();
        double history = historicalFailureRate(capabilities);

        double overall = clamp(properties.getComplexityRiskWeight() * complexityScore
                + properties.getViolationRiskWeight() * Math.min(1.0, constraintViolations / 3.0)
                + properties.getScarcityRiskWeight() * scarcity
                + properties.getHistoryRiskWeight() * history);

        Map<String, Integer> depths = graph.depths();
        int maxDepth = depths.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        var taskRisks = new HashMap<String, Double>();
        for (TaskUnit task : tasks) {
            boolean unserved = snapshot.assignable().stream()
                    .noneMatch(a -> task.requiredCapabilities().stream().allMatch(a::hasCapability));
            double position = maxDepth == 0 ? 0.0 : (double) depths.getOrDefault(task.id(), 0) / maxDepth;
            taskRisks.put(task.id(), clamp(overall + (unserved ? 0.3 : 0.0) + 0.1 * position));
        }
        return new RiskAssessment(overall, complexityScore, constraintViolations, scarcity, history,
                taskRisks, RiskLevel.of(overall));
    }

    /**
     * Sample-weighted failure rate of the recorded patterns for these capabilities,
     * averaged over the capabilities with history. 0 when nothing is recorded or the
     * store is unavailable.
     */
    double historicalFailureRate(Set<String> capabilities) {
        if (knowledgeStore == null || capabilities.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        int withHistory = 0;
        try {
            for (String capability : capabilities) {
                List<HistoricalPattern> patterns = knowledgeStore.queryHistoricalPatterns(capability);
                int samples = patterns.stream().mapToInt(HistoricalPattern::samples).sum();
                if (samples == 0) {
                    continue;
                }
                double successes = patterns.stream().mapToDouble(p -> p.successRate() * p.samples()).sum();
                sum += 1.0 - successes / samples;
                withHistory++;
            }
        } catch (RuntimeException e) {
            log.warn("Knowledge store unavailable, assessing risk without history: {}", e.getMessage());
            return 0.0;
        }
        return withHistory == 0 ? 0.0 : sum / withHistory;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
