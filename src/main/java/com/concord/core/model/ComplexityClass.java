package com.concord.core.model;

/**
 * Complexity class assigned to an objective by the planner. Each class maps to a
 * fixed phase template.
 */
public enum ComplexityClass {
    SIMPLE,
    MODERATE,
    COMPLEX,
    VERY_COMPLEX;

    /** The next simpler class, or {@code null} for {@link #SIMPLE}. */
    public ComplexityClass simpler() {
        return ordinal() == 0 ? null : values()[ordinal() - 1];
    }
}
