package com.concord.core.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public static RiskLevel of(double risk) {
        if (risk >= 0.66) return HIGH;
        if (risk >= 0.33) return MEDIUM;
        return LOW;
    }
}
