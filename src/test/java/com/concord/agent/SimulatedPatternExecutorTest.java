package com.concord.agent;

import com.concord.core.model.PatternOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedPatternExecutorTest {

    @Test
    @DisplayName("patterns succeed with their id and step in the output")
    void succeeds() {
        var executor = new SimulatedPatternExecutor(Duration.ZERO, Set.of());

        PatternOutcome outcome = executor.executePattern("report.sequential", Map.of("step", "main"));

        assertTrue(outcome.success());
        assertEquals("report.sequential", outcome.output().get("patternId"));
        assertEquals("main", outcome.output().get("step"));
        assertNull(outcome.error());
    }

    @Test
    @DisplayName("failing entries match by exact pattern id or by capability prefix")
    void failingPatterns() {
        var executor = new SimulatedPatternExecutor(null, Set.of("validate", "file-write.parallel"));

        assertFalse(executor.executePattern("validate.sequential", Map.of()).success());
        assertFalse(executor.executePattern("validate.adaptive", Map.of()).success());
        assertFalse(executor.executePattern("file-write.parallel", Map.of()).success());
        assertTrue(executor.executePattern("file-write.sequential", Map.of()).success());
        assertTrue(executor.executePattern("validated.sequential", Map.of()).success());
    }

    @Test
    @DisplayName("the configured latency is spent before answering")
    void latency() {
        var executor = new SimulatedPatternExecutor(Duration.ofMillis(50), Set.of());

        PatternOutcome outcome = executor.executePattern("analyze.adaptive", Map.of());

        assertTrue(outcome.elapsed().toMillis() >= 50);
    }

    @Test
    @DisplayName("an interrupted run reports failure and keeps the interrupt flag")
    void interrupted() {
        var executor = new SimulatedPatternExecutor(Duration.ofSeconds(5), Set.of());
        Thread.currentThread().interrupt();
        try {
            PatternOutcome outcome = executor.executePattern("analyze.adaptive", Map.of());

            assertFalse(outcome.success());
            assertTrue(outcome.error().startsWith("Interrupted"));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
