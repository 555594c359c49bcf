package com.concord.dispatch.api;

import com.concord.core.model.AgentInstance;
import com.concord.core.registry.AgentRegistry;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST controller for the agent registry.
 */
@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private final AgentRegistry registry;

    public AgentController(AgentRegistry registry) {
        this.registry = registry;
    }

    public record AgentResponse(
        String id,
        String status,
        Map<String, Double> capabilities,
        double load,
        int capacity,
        @JsonProperty("active_tasks") int activeTasks,
        @JsonProperty("missed_heartbeats") int missedHeartbeats,
        @JsonProperty("last_heartbeat") Instant lastHeartbeat
    ) {
        static AgentResponse from(AgentInstance agent) {
            return new AgentResponse(agent.id(), agent.status().name(), agent.capabilities(), agent.load(),
                    agent.capacity(), agent.activeTasks(), agent.missedHeartbeats(), agent.lastHeartbeat());
        }
    }

    /**
     * GET /api/v1/agents — Registered agents, sorted by id.
     */
    @GetMapping
    public ResponseEntity<List<AgentResponse>> listAgents() {
        return ResponseEntity.ok(registry.snapshot().agents().values().stream()
                .map(AgentResponse::from)
                .toList());
    }

    /**
     * POST /api/v1/agents/{id}/drain — Stop new assignments to an agent; running ones finish.
     */
    @PostMapping("/{id}/drain")
    public ResponseEntity<AgentResponse> drain(@PathVariable String id) {
        if (registry.find(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        registry.drain(id);
        return registry.find(id)
                .map(agent -> ResponseEntity.ok(AgentResponse.from(agent)))
                .orElse(ResponseEntity.notFound().build());
    }
}
