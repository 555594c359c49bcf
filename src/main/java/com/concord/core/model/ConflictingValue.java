package com.concord.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * One agent's version of the disputed state.
 *
 * @param sourceAgent agent that reported it
 * @param fields      reported field values
 * @param timestamp   when the agent reported it
 */
public record ConflictingValue(
    String sourceAgent,
    Map<String, Object> fields,
    Instant timestamp
) implements Serializable {

    public ConflictingValue {
        fields = fields != null ? Map.copyOf(fields) : Map.of();
    }
}
