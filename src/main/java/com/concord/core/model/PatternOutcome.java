package com.concord.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.Map;

/**
 * Result of running one workflow pattern on an agent.
 */
public record PatternOutcome(
    boolean success,
    Map<String, Object> output,
    String error,
    Duration elapsed
) implements Serializable {

    public PatternOutcome {
        output = output != null ? Map.copyOf(output) : Map.of();
        elapsed = elapsed != null ? elapsed : Duration.ZERO;
    }

    public static PatternOutcome succeeded(Map<String, Object> output, Duration elapsed) {
        return new PatternOutcome(true, output, null, elapsed);
    }

    public static PatternOutcome failed(String error, Duration elapsed) {
        return new PatternOutcome(false, Map.of(), error, elapsed);
    }
}
