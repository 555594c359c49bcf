package com.concord.core.model;

/**
 * Priority of an objective, and of the assignments and messages derived from it.
 */
public enum Priority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}
