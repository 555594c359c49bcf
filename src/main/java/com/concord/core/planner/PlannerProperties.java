package com.concord.core.planner;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Planner thresholds and weights. The weights are tuning knobs, not correctness
 * requirements.
 */
@Component
@ConfigurationProperties(prefix = "concord.planner")
public class PlannerProperties {

    /** Raw complexity score at which an objective becomes MODERATE. */
    private double moderateThreshold = 1.0;
    private double complexThreshold = 3.0;
    private double veryComplexThreshold = 5.0;
    /** Raw score that normalizes to a complexity score of 1.0. */
    private double complexityScale = 6.0;

    /** Task risk above which a contingency is prepared. */
    private double riskThreshold = 0.5;
    private double complexityRiskWeight = 0.35;
    private double violationRiskWeight = 0.2;
    private double scarcityRiskWeight = 0.3;
    private double historyRiskWeight = 0.15;

    private double successWeight = 1.0;
    private double costWeight = 0.5;
    private double deadlineWeight = 0.5;
    /** Share of a pattern's success estimate taken from recorded history once enough samples exist. */
    private double historyBlend = 0.5;
    private int minHistorySamples = 3;
    /** Objectives of the most recent plans kept for replanning. */
    private int retainedObjectives = 1024;

    /** Extra description keyword to capability tag rules, checked before the built-in ones. */
    private Map<String, String> capabilityKeywords = new LinkedHashMap<>();

    public double getModerateThreshold() {
        return moderateThreshold;
    }

    public void setModerateThreshold(double moderateThreshold) {
        this.moderateThreshold = moderateThreshold;
    }

    public double getComplexThreshold() {
        return complexThreshold;
    }

    public void setComplexThreshold(double complexThreshold) {
        this.complexThreshold = complexThreshold;
    }

    public double getVeryComplexThreshold() {
        return veryComplexThreshold;
    }

    public void setVeryComplexThreshold(double veryComplexThreshold) {
        this.veryComplexThreshold = veryComplexThreshold;
    }

    public double getComplexityScale() {
        return complexityScale;
    }

    public void setComplexityScale(double complexityScale) {
        this.complexityScale = complexityScale;
    }

    public double getRiskThreshold() {
        return riskThreshold;
    }

    public void setRiskThreshold(double riskThreshold) {
        this.riskThreshold = riskThreshold;
    }

    public double getComplexityRiskWeight() {
        return complexityRiskWeight;
    }

    public void setComplexityRiskWeight(double complexityRiskWeight) {
        this.complexityRiskWeight = complexityRiskWeight;
    }

    public double getViolationRiskWeight() {
        return violationRiskWeight;
    }

    public void setViolationRiskWeight(double violationRiskWeight) {
        this.violationRiskWeight = violationRiskWeight;
    }

    public double getScarcityRiskWeight() {
        return scarcityRiskWeight;
    }

    public void setScarcityRiskWeight(double scarcityRiskWeight) {
        this.scarcityRiskWeight = scarcityRiskWeight;
    }

    public double getHistoryRiskWeight() {
        return historyRiskWeight;
    }

    public void setHistoryRiskWeight(double historyRiskWeight) {
        this.historyRiskWeight = historyRiskWeight;
    }

    public double getSuccessWeight() {
        return successWeight;
    }

    public void setSuccessWeight(double successWeight) {
        this.successWeight = successWeight;
    }

    public double getCostWeight() {
        return costWeight;
    }

    public void setCostWeight(double costWeight) {
        this.costWeight = costWeight;
    }

    public double getDeadlineWeight() {
        return deadlineWeight;
    }

    public void setDeadlineWeight(double deadlineWeight) {
        this.deadlineWeight = deadlineWeight;
    }

    public double getHistoryBlend() {
        return historyBlend;
    }

    public void setHistoryBlend(double historyBlend) {
        this.historyBlend = historyBlend;
    }

    public int getMinHistorySamples() {
        return minHistorySamples;
    }

    public void setMinHistorySamples(int minHistorySamples) {
        this.minHistorySamples = minHistorySamples;
    }

    public Map<String, String> getCapabilityKeywords() {
        return capabilityKeywords;
    }

    public void setCapabilityKeywords(Map<String, String> capabilityKeywords) {
        this.capabilityKeywords = capabilityKeywords;
    }

    public int getRetainedObjectives() {
        return retainedObjectives;
    }

    public void setRetainedObjectives(int retainedObjectives) {
        this.retainedObjectives = retainedObjectives;
    }
}
