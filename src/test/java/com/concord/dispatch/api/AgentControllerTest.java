package com.concord.dispatch.api;

import com.concord.core.model.AgentInstance;
import com.concord.core.model.AgentStatus;
import com.concord.core.registry.AgentRegistry;
import com.concord.core.registry.RegistrySnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AgentController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class AgentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AgentRegistry registry;

    private static AgentInstance agent(String id, AgentStatus status) {
        return new AgentInstance(id, Map.of("file-write", 0.9), status, 0.5, 2, 1, 0,
                Instant.parse("2026-03-01T10:00:00Z"));
    }

    @Test
    @DisplayName("GET /agents lists registered agents by id")
    void listAgents() throws Exception {
        when(registry.snapshot()).thenReturn(RegistrySnapshot.of(List.of(
                agent("beta", AgentStatus.BUSY), agent("alpha", AgentStatus.AVAILABLE))));

        mockMvc.perform(get("/api/v1/agents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].id").value("alpha"))
                .andExpect(jsonPath("$[1].status").value("BUSY"))
                .andExpect(jsonPath("$[0].capabilities['file-write']").value(0.9))
                .andExpect(jsonPath("$[0].active_tasks").value(1))
                .andExpect(jsonPath("$[0].last_heartbeat").exists());
    }

    @Test
    @DisplayName("POST /agents/{id}/drain drains the agent")
    void drain() throws Exception {
        when(registry.find("alpha")).thenReturn(Optional.of(agent("alpha", AgentStatus.AVAILABLE)),
                Optional.of(agent("alpha", AgentStatus.DRAINING)));

        mockMvc.perform(post("/api/v1/agents/alpha/drain"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DRAINING"));
        verify(registry).drain("alpha");
    }

    @Test
    @DisplayName("POST /agents/{id}/drain returns 404 for unknown agents")
    void drainUnknown() throws Exception {
        when(registry.find("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/agents/ghost/drain"))
                .andExpect(status().isNotFound());
        verify(registry, never()).drain(anyString());
    }
}
