package com.concord.core.model;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH
}
