package com.concord.core.model;

public enum DecisionType {
    STRATEGIC,
    TACTICAL,
    OPERATIONAL,
    REACTIVE
}
