package com.concord.dispatch.api;

import com.concord.core.health.HealthCheckService;
import com.concord.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("all components UP -> 200 UP")
    void allUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("agents", HealthStatus.Status.UP, "3 assignable agent(s)", Map.of("AVAILABLE", "3")),
                new HealthStatus("bus", HealthStatus.Status.UP, "0 message(s) queued", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.agents.metadata.AVAILABLE").value("3"))
                .andExpect(jsonPath("$.components.bus.metadata").doesNotExist());
    }

    @Test
    @DisplayName("a degraded component -> 200 DEGRADED")
    void degraded() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("agents", HealthStatus.Status.UP, "2 assignable agent(s)", Map.of()),
                new HealthStatus("circuits", HealthStatus.Status.DEGRADED, "1 of 2 circuit(s) open", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.components.circuits.status").value("DEGRADED"));
    }

    @Test
    @DisplayName("a component DOWN -> 503 DOWN")
    void down() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("agents", HealthStatus.Status.DOWN, "No agent can take work", Map.of()),
                new HealthStatus("circuits", HealthStatus.Status.DEGRADED, "1 of 1 circuit(s) open", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.components.agents.detail").value("No agent can take work"));
    }
}
