package com.concord.agent;

import com.concord.core.model.PatternOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Default executor for in-process agents: waits {@code latency}, then succeeds unless
 * the pattern is listed as failing. Patterns are matched by exact id or by capability
 * prefix, so {@code "validate"} fails every {@code validate.*} pattern.
 */
public class SimulatedPatternExecutor implements WorkflowPatternExecutor {

    private static final Logger log = LoggerFactory.getLogger(SimulatedPatternExecutor.class);

    private final Duration latency;
    private final Set<String> failingPatterns;

    public SimulatedPatternExecutor(Duration latency, Set<String> failingPatterns) {
        this.latency = latency != null ? latency : Duration.ZERO;
        this.failingPatterns = failingPatterns != null ? Set.copyOf(failingPatterns) : Set.of();
    }

    @Override
    public PatternOutcome executePattern(String patternId, Map<String, Object> context) {
        long start = System.currentTimeMillis();
        if (!latency.isZero() && !latency.isNegative()) {
            try {
                Thread.sleep(latency.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return PatternOutcome.failed("Interrupted while running " + patternId,
                        Duration.ofMillis(System.currentTimeMillis() - start));
            }
        }
        Duration elapsed = Duration.ofMillis(System.currentTimeMillis() - start);
        if (fails(patternId)) {
            log.debug("Pattern {} configured to fail", patternId);
            return PatternOutcome.failed("Pattern " + patternId + " failed", elapsed);
        }
        var output = new LinkedHashMap<String, Object>();
        output.put("patternId", patternId);
        Object step = context.get("step");
        if (step != null) {
            output.put("step", step);
        }
        output.put("result", "done");
        return PatternOutcome.succeeded(output, elapsed);
    }

    private boolean fails(String patternId) {
        if (failingPatterns.contains(patternId)) {
            return true;
        }
        int dot = patternId.indexOf('.');
        return dot > 0 && failingPatterns.contains(patternId.substring(0, dot));
    }
}
