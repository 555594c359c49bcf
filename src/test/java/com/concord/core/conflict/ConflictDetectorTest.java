package com.concord.core.conflict;

import com.concord.core.model.Conflict;
import com.concord.core.model.ConflictingValue;
import com.concord.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConflictDetectorTest {

    private final ConflictDetector detector = new ConflictDetector();
    private final Instant now = Instant.now();

    private ConflictingValue report(String agent, Map<String, Object> fields) {
        return new ConflictingValue(agent, fields, now);
    }

    @Test
    @DisplayName("compatible reports are not a conflict")
    void compatibleReports() {
        var reports = List.of(
                report("a", Map.of("status", "done")),
                report("b", Map.of("status", "done", "count", 3)));
        assertTrue(detector.detect("task.t1", reports).isEmpty());
        assertTrue(detector.detect("task.t1", List.of(report("a", Map.of("x", 1)))).isEmpty());
    }

    @Test
    @DisplayName("a single disputed field is LOW")
    void lowSeverity() {
        Conflict conflict = detector.detect("task.t1", List.of(
                report("a", Map.of("status", "done")),
                report("b", Map.of("status", "failed")))).orElseThrow();
        assertEquals(Severity.LOW, conflict.severity());
        assertEquals(2, conflict.values().size());
    }

    @Test
    @DisplayName("a minority of disputed fields is MEDIUM")
    void mediumSeverity() {
        Conflict conflict = detector.detect("task.t1", List.of(
                report("a", Map.of("status", "done", "count", 3)),
                report("b", Map.of("status", "done", "count", 4, "owner", "x")))).orElseThrow();
        assertEquals(Severity.MEDIUM, conflict.severity());
    }

    @Test
    @DisplayName("mostly disputed reports and plan disputes are HIGH")
    void highSeverity() {
        assertEquals(Severity.HIGH, detector.detect("task.t1", List.of(
                report("a", Map.of("status", "done", "count", 3)),
                report("b", Map.of("status", "failed", "count", 4)))).orElseThrow().severity());
        assertEquals(Severity.HIGH, detector.detect("plan.p1", List.of(
                report("a", Map.of("status", "done")),
                report("b", Map.of("status", "failed")))).orElseThrow().severity());
    }
}
