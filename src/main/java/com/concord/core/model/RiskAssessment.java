package com.concord.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Risk of a plan as computed by the planner.
 *
 * @param overallRisk          weighted sum of the factors, clamped to 0..1
 * @param complexityScore      normalized complexity score (0..1)
 * @param constraintViolations optional constraints violated by the chosen decomposition
 * @param resourceScarcity     share of required capabilities with no available agent (0..1)
 * @param historicalFailureRate failure rate of similar past work, 0 when unknown
 * @param taskRisks            per-task risk keyed by task id
 * @param level                banded overall risk
 */
public record RiskAssessment(
    double overallRisk,
    double complexityScore,
    int constraintViolations,
    double resourceScarcity,
    double historicalFailureRate,
    Map<String, Double> taskRisks,
    RiskLevel level
) implements Serializable {

    public RiskAssessment {
        taskRisks = taskRisks != null ? Map.copyOf(taskRisks) : Map.of();
    }

    public double riskOf(String taskId) {
        return taskRisks.getOrDefault(taskId, overallRisk);
    }
}
