package com.concord.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Disagreement between agents about a shared piece of state.
 *
 * @param id         conflict id
 * @param severity   classification driving the resolution strategy
 * @param domain     what is disputed (e.g. "task-status:PLAN-2026-0001")
 * @param values     the competing versions with their sources
 * @param detectedAt detection time
 */
public record Conflict(
    String id,
    Severity severity,
    String domain,
    List<ConflictingValue> values,
    Instant detectedAt
) implements Serializable {

    public Conflict {
        values = values != null ? List.copyOf(values) : List.of();
    }
}
