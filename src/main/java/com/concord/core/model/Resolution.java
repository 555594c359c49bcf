package com.concord.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * How a {@link Conflict} was settled.
 *
 * @param conflictId      the conflict resolved
 * @param strategy        strategy used
 * @param resolvedValue   the agreed field values
 * @param confidence      0..1 confidence in the resolved value
 * @param rationale       human-readable explanation
 * @param escalatedFields fields that needed escalation beyond the primary strategy
 * @param resolvedAt      resolution time
 */
public record Resolution(
    String conflictId,
    ResolutionStrategy strategy,
    Map<String, Object> resolvedValue,
    double confidence,
    String rationale,
    List<String> escalatedFields,
    Instant resolvedAt
) implements Serializable {

    public Resolution {
        resolvedValue = resolvedValue != null ? Map.copyOf(resolvedValue) : Map.of();
        escalatedFields = escalatedFields != null ? List.copyOf(escalatedFields) : List.of();
    }
}
