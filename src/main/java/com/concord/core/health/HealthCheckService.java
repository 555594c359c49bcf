package com.concord.core.health;

import com.concord.core.engine.CoordinationHealth;
import com.concord.core.engine.CoordinationOrchestrator;
import com.concord.core.knowledge.KnowledgeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Component health checks shared by the REST health endpoint, the CLI and the actuator
 * indicator.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final CoordinationOrchestrator orchestrator;
    private final KnowledgeStore knowledgeStore;
    private final DataSource dataSource;

    public HealthCheckService(
            CoordinationOrchestrator orchestrator,
            @Autowired(required = false) KnowledgeStore knowledgeStore,
            @Autowired(required = false) DataSource dataSource) {
        this.orchestrator = orchestrator;
        this.knowledgeStore = knowledgeStore;
        this.dataSource = dataSource;
    }

    public List<HealthStatus> checkAll() {
        CoordinationHealth health = orchestrator.getCoordinationHealth();
        var results = new ArrayList<HealthStatus>();
        results.add(checkAgents(health));
        results.add(checkCircuits(health));
        results.add(checkBus(health));
        results.add(checkKnowledgeStore());
        return results;
    }

    public CoordinationHealth coordinationHealth() {
        return orchestrator.getCoordinationHealth();
    }

    private HealthStatus checkAgents(CoordinationHealth health) {
        Map<String, String> counts = new LinkedHashMap<>();
        health.agentsByStatus().forEach((status, n) -> counts.put(status, String.valueOf(n)));
        int available = health.agentsByStatus().getOrDefault("AVAILABLE", 0)
                + health.agentsByStatus().getOrDefault("BUSY", 0);
        int unreachable = health.agentsByStatus().getOrDefault("UNREACHABLE", 0);
        if (available == 0) {
            return new HealthStatus("agents", HealthStatus.Status.DOWN, "No agent can take work", counts);
        }
        if (unreachable > 0) {
            return new HealthStatus("agents", HealthStatus.Status.DEGRADED,
                    available + " assignable, " + unreachable + " unreachable", counts);
        }
        return new HealthStatus("agents", HealthStatus.Status.UP, available + " assignable agent(s)", counts);
    }

    private HealthStatus checkCircuits(CoordinationHealth health) {
        long open = health.circuits().values().stream().filter("OPEN"::equals).count();
        if (open > 0) {
            return new HealthStatus("circuits", HealthStatus.Status.DEGRADED,
                    open + " of " + health.circuits().size() + " circuit(s) open", health.circuits());
        }
        return new HealthStatus("circuits", HealthStatus.Status.UP,
                health.circuits().size() + " circuit(s), none open", health.circuits());
    }

    private HealthStatus checkBus(CoordinationHealth health) {
        int queued = health.queueDepths().values().stream().mapToInt(Integer::intValue).sum();
        var metadata = Map.of("queued", String.valueOf(queued), "deadLetters", String.valueOf(health.deadLetters()),
                "pendingTasks", String.valueOf(health.pendingTasks()),
                "runningPlans", String.valueOf(health.runningPlans()));
        if (health.deadLetters() > 0) {
            return new HealthStatus("bus", HealthStatus.Status.DEGRADED,
                    health.deadLetters() + " dead-lettered message(s)", metadata);
        }
        return new HealthStatus("bus", HealthStatus.Status.UP, queued + " message(s) queued", metadata);
    }

    private HealthStatus checkKnowledgeStore() {
        if (knowledgeStore == null) {
            return new HealthStatus("knowledge-store", HealthStatus.Status.DEGRADED,
                    "No knowledge store configured", Map.of());
        }
        if (dataSource == null) {
            return HealthStatus.up("knowledge-store",
                    "In-memory store (" + knowledgeStore.getClass().getSimpleName() + ")");
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return HealthStatus.up("knowledge-store", "Database connection valid");
            }
            return new HealthStatus("knowledge-store", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Knowledge store health check failed: {}", e.getMessage());
            return new HealthStatus("knowledge-store", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }
}
