package com.concord.core.planner;

import com.concord.core.model.ComplexityClass;
import com.concord.core.model.Objective;
import com.concord.core.strategy.StrategyCatalog;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Scores an objective from its description keywords, constraint count, deadline
 * tightness and sub-objective count, and maps the score to a complexity class.
 */
public class ComplexityClassifier {

    /**
     * @param rawScore   unbounded weighted score
     * @param normalized rawScore scaled to 0..1
     * @param complexity class the score falls in
     */
    public record Assessment(double rawScore, double normalized, ComplexityClass complexity) {}

    private final StrategyCatalog catalog;
    private final PlannerProperties properties;
    private final Clock clock;

    public ComplexityClassifier(StrategyCatalog catalog, PlannerProperties properties, Clock clock) {
        this.catalog = catalog;
        this.properties = properties;
        this.clock = clock;
    }

    public Assessment assess(Objective objective) {
        String description = objective.description();
        int words = description.isBlank() ? 0 : description.trim().split("\\s+").length;
        double raw = catalog.complexityKeywordScore(description)
                + Math.min(2.0, words * 0.1)
                + 0.5 * objective.constraints().size()
                + deadlineTightness(objective.deadline())
                + 1.5 * objective.subObjectives().size();
        double normalized = Math.min(1.0, raw / properties.getComplexityScale());
        return new Assessment(raw, normalized, classOf(raw));
    }

    ComplexityClass classOf(double raw) {
        if (raw >= properties.getVeryComplexThreshold()) {
            return ComplexityClass.VERY_COMPLEX;
        }
        if (raw >= properties.getComplexThreshold()) {
            return ComplexityClass.COMPLEX;
        }
        if (raw >= properties.getModerateThreshold()) {
            return ComplexityClass.MODERATE;
        }
        return ComplexityClass.SIMPLE;
    }

    private double deadlineTightness(Instant deadline) {
        if (deadline == null) {
            return 0.0;
        }
        Duration left = Duration.between(clock.instant(), deadline);
        if (left.isNegative() || left.compareTo(Duration.ofHours(1)) < 0) {
            return 1.0;
        }
        return left.compareTo(Duration.ofDays(1)) < 0 ? 0.5 : 0.0;
    }
}
