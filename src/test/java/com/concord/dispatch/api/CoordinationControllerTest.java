package com.concord.dispatch.api;

import com.concord.core.engine.CoordinationOrchestrator;
import com.concord.core.engine.ExecutionHandle;
import com.concord.core.error.AgentUnavailableException;
import com.concord.core.error.MessageTimeoutException;
import com.concord.core.error.PlanningException;
import com.concord.core.error.ValidationException;
import com.concord.core.model.ComplexityClass;
import com.concord.core.model.DependencyEdge;
import com.concord.core.model.DependencyKind;
import com.concord.core.model.ExecutionResult;
import com.concord.core.model.Objective;
import com.concord.core.model.PlanStatus;
import com.concord.core.model.Priority;
import com.concord.core.model.RiskAssessment;
import com.concord.core.model.RiskLevel;
import com.concord.core.model.TaskOutcome;
import com.concord.core.model.TaskPlan;
import com.concord.core.model.TaskStatus;
import com.concord.core.model.TaskUnit;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(CoordinationController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class CoordinationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private CoordinationOrchestrator orchestrator;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    private static TaskPlan samplePlan() {
        var prepare = new TaskUnit("PLAN-2026-0001-T1", "PLAN-2026-0001", "prepare", "Prepare: migrate files",
                Set.of("file-write"), Duration.ofMinutes(10), List.of(), "ready");
        var validate = new TaskUnit("PLAN-2026-0001-T2", "PLAN-2026-0001", "validate", "Validate: migrate files",
                Set.of("validate"), Duration.ofMinutes(5), List.of(), "validated");
        var risk = new RiskAssessment(0.3, 0.4, 0, 0.1, 0, Map.of("PLAN-2026-0001-T1", 0.3), RiskLevel.LOW);
        return new TaskPlan("PLAN-2026-0001", "obj-1", ComplexityClass.MODERATE, List.of(prepare, validate),
                List.of(new DependencyEdge(prepare.id(), validate.id(), DependencyKind.SEQUENTIAL)),
                Duration.ofMinutes(15), risk, List.of(), 0, Instant.parse("2026-03-01T10:00:00Z"));
    }

    // ── POST /api/v1/plans ───────────────────────────────────────────

    @Nested
    @DisplayName("POST /api/v1/plans")
    class CreatePlanTests {

        @Test
        @DisplayName("returns 201 with the plan")
        void createsPlan() throws Exception {
            when(orchestrator.planObjective(any())).thenReturn(samplePlan());
            String body = objectMapper.writeValueAsString(new ObjectiveRequest("obj-1", "Migrate 3 files with validation",
                    "high", null, List.of("3 files present"), null, null));

            mockMvc.perform(post("/api/v1/plans")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.plan_id").value("PLAN-2026-0001"))
                    .andExpect(jsonPath("$.complexity").value("MODERATE"))
                    .andExpect(jsonPath("$.estimated_duration_ms").value(900000))
                    .andExpect(jsonPath("$.risk.level").value("LOW"))
                    .andExpect(jsonPath("$.tasks", hasSize(2)))
                    .andExpect(jsonPath("$.tasks[0].required_capabilities[0]").value("file-write"))
                    .andExpect(jsonPath("$.edges[0].kind").value("SEQUENTIAL"));

            var captor = ArgumentCaptor.forClass(Objective.class);
            verify(orchestrator).planObjective(captor.capture());
            assertEquals(Priority.HIGH, captor.getValue().priority());
            assertEquals("obj-1", captor.getValue().id());
        }

        @Test
        @DisplayName("returns 400 with violations for a malformed objective")
        void malformedObjective() throws Exception {
            when(orchestrator.planObjective(any())).thenThrow(new ValidationException("Invalid objective",
                    List.of("description must not be blank")));

            mockMvc.perform(post("/api/v1/plans")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"description\":\"\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.category").value("VALIDATION"))
                    .andExpect(jsonPath("$.violations[0]").value("description must not be blank"));
        }

        @Test
        @DisplayName("returns 400 for an unknown priority without planning")
        void unknownPriority() throws Exception {
            mockMvc.perform(post("/api/v1/plans")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"description\":\"Migrate files\",\"priority\":\"urgent\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Invalid priority: urgent"));
        }

        @Test
        @DisplayName("returns 422 with diagnostics when the objective is infeasible")
        void infeasibleObjective() throws Exception {
            when(orchestrator.planObjective(any())).thenThrow(new PlanningException(
                    PlanningException.Reason.INFEASIBLE, "No feasible plan", List.of("no agent declares deploy")));

            mockMvc.perform(post("/api/v1/plans")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"description\":\"Deploy the service\"}"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.reason").value("INFEASIBLE"))
                    .andExpect(jsonPath("$.diagnostics[0]").value("no agent declares deploy"));
        }
    }

    // ── GET /api/v1/plans/{id} ───────────────────────────────────────

    @Test
    @DisplayName("GET /plans/{id} returns the plan or 404")
    void getPlan() throws Exception {
        when(orchestrator.findPlan("PLAN-2026-0001")).thenReturn(Optional.of(samplePlan()));
        when(orchestrator.findPlan("PLAN-missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/plans/PLAN-2026-0001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.revision").value(0))
                .andExpect(jsonPath("$.objective_id").value("obj-1"));
        mockMvc.perform(get("/api/v1/plans/PLAN-missing"))
                .andExpect(status().isNotFound());
    }

    // ── executions ───────────────────────────────────────────────────

    @Nested
    @DisplayName("executions")
    class ExecutionTests {

        @Test
        @DisplayName("POST /plans/{id}/executions returns 202 with the status")
        void startsExecution() throws Exception {
            TaskPlan plan = samplePlan();
            ExecutionHandle handle = mock(ExecutionHandle.class);
            when(handle.planId()).thenReturn(plan.id());
            when(handle.status()).thenReturn(PlanStatus.EXECUTING);
            when(orchestrator.findPlan(plan.id())).thenReturn(Optional.of(plan));
            when(orchestrator.distributeAndExecute(plan)).thenReturn(handle);

            mockMvc.perform(post("/api/v1/plans/PLAN-2026-0001/executions"))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.plan_id").value("PLAN-2026-0001"))
                    .andExpect(jsonPath("$.status").value("EXECUTING"));
        }

        @Test
        @DisplayName("starting a plan that is already running returns 400")
        void alreadyRunning() throws Exception {
            TaskPlan plan = samplePlan();
            when(orchestrator.findPlan(plan.id())).thenReturn(Optional.of(plan));
            when(orchestrator.distributeAndExecute(plan))
                    .thenThrow(new ValidationException("Plan PLAN-2026-0001 is already executing"));

            mockMvc.perform(post("/api/v1/plans/PLAN-2026-0001/executions"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value(containsString("already executing")));
        }

        @Test
        @DisplayName("GET /plans/{id}/execution returns the finished result")
        void finishedExecution() throws Exception {
            var outcome = new TaskOutcome("PLAN-2026-0001-T1", "alpha", TaskStatus.COMPLETED, List.of(), Map.of(),
                    null, Duration.ofMillis(40));
            var result = new ExecutionResult("PLAN-2026-0001", 1, PlanStatus.COMPLETED,
                    Map.of("PLAN-2026-0001-T1", TaskStatus.COMPLETED), List.of(outcome), List.of(), List.of(),
                    Duration.ofMillis(120));
            ExecutionHandle handle = mock(ExecutionHandle.class);
            when(handle.result()).thenReturn(Optional.of(result));
            when(orchestrator.execution("PLAN-2026-0001")).thenReturn(Optional.of(handle));

            mockMvc.perform(get("/api/v1/plans/PLAN-2026-0001/execution"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("COMPLETED"))
                    .andExpect(jsonPath("$.done").value(true))
                    .andExpect(jsonPath("$.plan_revision").value(1))
                    .andExpect(jsonPath("$.outcomes[0].agent_id").value("alpha"))
                    .andExpect(jsonPath("$.task_statuses['PLAN-2026-0001-T1']").value("COMPLETED"));
        }

        @Test
        @DisplayName("GET /plans/{id}/execution shows live statuses while running")
        void runningExecution() throws Exception {
            ExecutionHandle handle = mock(ExecutionHandle.class);
            when(handle.result()).thenReturn(Optional.empty());
            when(handle.planId()).thenReturn("PLAN-2026-0001");
            when(handle.currentPlan()).thenReturn(samplePlan());
            when(handle.status()).thenReturn(PlanStatus.EXECUTING);
            when(handle.taskStatuses()).thenReturn(Map.of("PLAN-2026-0001-T1", TaskStatus.RUNNING,
                    "PLAN-2026-0001-T2", TaskStatus.PENDING));
            when(orchestrator.execution("PLAN-2026-0001")).thenReturn(Optional.of(handle));

            mockMvc.perform(get("/api/v1/plans/PLAN-2026-0001/execution"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.done").value(false))
                    .andExpect(jsonPath("$.task_statuses['PLAN-2026-0001-T1']").value("RUNNING"))
                    .andExpect(jsonPath("$.elapsed_ms").doesNotExist());
        }

        @Test
        @DisplayName("DELETE /plans/{id}/execution cancels, 409 once finished, 404 when unknown")
        void cancel() throws Exception {
            when(orchestrator.cancelExecution("PLAN-running")).thenReturn(true);
            when(orchestrator.cancelExecution("PLAN-done")).thenReturn(false);
            when(orchestrator.execution("PLAN-done")).thenReturn(Optional.of(mock(ExecutionHandle.class)));
            when(orchestrator.cancelExecution("PLAN-unknown")).thenReturn(false);
            when(orchestrator.execution("PLAN-unknown")).thenReturn(Optional.empty());

            mockMvc.perform(delete("/api/v1/plans/PLAN-running/execution"))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.status").value("CANCELLING"));
            mockMvc.perform(delete("/api/v1/plans/PLAN-done/execution"))
                    .andExpect(status().isConflict());
            mockMvc.perform(delete("/api/v1/plans/PLAN-unknown/execution"))
                    .andExpect(status().isNotFound());
        }
    }

    // ── GET /api/v1/plans/{id}/events ────────────────────────────────

    @Test
    @DisplayName("GET /plans/{id}/events opens a stream for known plans only")
    void streamEvents() throws Exception {
        when(orchestrator.findPlan("PLAN-2026-0001")).thenReturn(Optional.of(samplePlan()));
        when(orchestrator.findPlan("PLAN-missing")).thenReturn(Optional.empty());
        when(sseStreamingService.createEmitter("PLAN-2026-0001")).thenReturn(new SseEmitter(0L));

        mockMvc.perform(get("/api/v1/plans/PLAN-2026-0001/events").accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(status().isOk())
                .andExpect(request().asyncStarted());
        mockMvc.perform(get("/api/v1/plans/PLAN-missing/events").accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("timeouts map to 504 and unavailable agents to 503")
    void statusMapping() {
        assertEquals(504, CoordinationController.statusFor(new MessageTimeoutException("slow")));
        assertEquals(503, CoordinationController.statusFor(new AgentUnavailableException("gone")));
        assertEquals(400, CoordinationController.statusFor(new ValidationException("bad")));
    }
}
