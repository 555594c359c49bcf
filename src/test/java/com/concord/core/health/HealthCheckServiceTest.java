package com.concord.core.health;

import com.concord.core.engine.CoordinationHealth;
import com.concord.core.engine.CoordinationOrchestrator;
import com.concord.core.knowledge.InMemoryKnowledgeStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private CoordinationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = mock(CoordinationOrchestrator.class);
    }

    private static CoordinationHealth health(int available, int unreachable, Map<String, String> circuits,
                                             int deadLetters) {
        var byStatus = Map.of("AVAILABLE", available, "BUSY", 0, "DRAINING", 0, "UNREACHABLE", unreachable);
        return new CoordinationHealth(CoordinationHealth.Status.UP, byStatus, circuits, Map.of("alpha", 2),
                1, 0, 0, deadLetters, Instant.now());
    }

    private static HealthStatus component(List<HealthStatus> results, String name) {
        return results.stream().filter(s -> name.equals(s.component())).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("checkAll reports agents, circuits, bus and knowledge store")
    void checkAllReturnsAllComponents() {
        when(orchestrator.getCoordinationHealth()).thenReturn(health(2, 0, Map.of(), 0));
        var service = new HealthCheckService(orchestrator, new InMemoryKnowledgeStore(), null);

        List<HealthStatus> results = service.checkAll();

        assertEquals(List.of("agents", "circuits", "bus", "knowledge-store"),
                results.stream().map(HealthStatus::component).toList());
        assertTrue(results.stream().allMatch(s -> s.status() == HealthStatus.Status.UP));
        assertEquals("2", component(results, "bus").metadata().get("queued"));
    }

    @Test
    @DisplayName("no assignable agent -> agents DOWN")
    void noAgentsDown() {
        when(orchestrator.getCoordinationHealth()).thenReturn(health(0, 1, Map.of(), 0));
        var service = new HealthCheckService(orchestrator, new InMemoryKnowledgeStore(), null);

        assertEquals(HealthStatus.Status.DOWN, component(service.checkAll(), "agents").status());
    }

    @Test
    @DisplayName("unreachable agents, open circuits and dead letters degrade their component")
    void degradedComponents() {
        when(orchestrator.getCoordinationHealth())
                .thenReturn(health(1, 1, Map.of("agent:beta", "OPEN", "agent:alpha", "CLOSED"), 3));
        var service = new HealthCheckService(orchestrator, new InMemoryKnowledgeStore(), null);

        List<HealthStatus> results = service.checkAll();

        assertEquals(HealthStatus.Status.DEGRADED, component(results, "agents").status());
        assertEquals(HealthStatus.Status.DEGRADED, component(results, "circuits").status());
        assertEquals("1 of 2 circuit(s) open", component(results, "circuits").detail());
        assertEquals(HealthStatus.Status.DEGRADED, component(results, "bus").status());
    }

    @Test
    @DisplayName("without a knowledge store the store is DEGRADED")
    void noKnowledgeStore() {
        when(orchestrator.getCoordinationHealth()).thenReturn(health(1, 0, Map.of(), 0));
        var service = new HealthCheckService(orchestrator, null, null);

        assertEquals(HealthStatus.Status.DEGRADED, component(service.checkAll(), "knowledge-store").status());
    }

    @Test
    @DisplayName("the actuator indicator is DOWN when any component is down")
    void indicatorFollowsWorstComponent() {
        when(orchestrator.getCoordinationHealth()).thenReturn(health(0, 0, Map.of(), 0));
        var indicator = new CoordinationHealthIndicator(
                new HealthCheckService(orchestrator, new InMemoryKnowledgeStore(), null));
        assertEquals(Status.DOWN, indicator.health().getStatus());

        when(orchestrator.getCoordinationHealth()).thenReturn(health(1, 1, Map.of(), 0));
        assertEquals("DEGRADED", indicator.health().getStatus().getCode());

        when(orchestrator.getCoordinationHealth()).thenReturn(health(1, 0, Map.of(), 0));
        assertEquals(Status.UP, indicator.health().getStatus());
        assertTrue(indicator.health().getDetails().containsKey("agents"));
    }
}
