package com.concord.core.strategy;

/**
 * Exponents of the candidate score
 * {@code success^successWeight * efficiency^costWeight * deadlineFit^deadlineWeight}.
 */
public record ScoringWeights(double successWeight, double costWeight, double deadlineWeight) {

    public double score(double successProbability, double resourceCost, double deadlineFit) {
        double efficiency = 1.0 / (1.0 + Math.max(0.0, resourceCost));
        return Math.pow(clamp(successProbability), successWeight)
                * Math.pow(efficiency, costWeight)
                * Math.pow(clamp(deadlineFit), deadlineWeight);
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
