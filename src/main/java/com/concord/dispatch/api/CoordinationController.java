package com.concord.dispatch.api;

import com.concord.core.engine.CoordinationOrchestrator;
import com.concord.core.engine.ExecutionHandle;
import com.concord.core.error.CoordinationException;
import com.concord.core.error.MessageTimeoutException;
import com.concord.core.error.PlanningException;
import com.concord.core.error.ValidationException;
import com.concord.core.model.Objective;
import com.concord.core.model.TaskPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for planning objectives and running plans.
 */
@RestController
@RequestMapping("/api/v1/plans")
public class CoordinationController {

    private static final Logger log = LoggerFactory.getLogger(CoordinationController.class);

    private final CoordinationOrchestrator orchestrator;
    private final SseStreamingService sseStreamingService;

    public CoordinationController(CoordinationOrchestrator orchestrator, SseStreamingService sseStreamingService) {
        this.orchestrator = orchestrator;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/plans — Plan an objective against the current agent pool.
     * 201 with the plan, 400 for a malformed objective, 422 if it cannot be planned.
     */
    @PostMapping
    public ResponseEntity<?> createPlan(@RequestBody ObjectiveRequest request) {
        try {
            Objective objective = request.toObjective();
            TaskPlan plan = orchestrator.planObjective(objective);
            return ResponseEntity.status(201).body(PlanResponse.from(plan));
        } catch (CoordinationException e) {
            return errorResponse(e);
        }
    }

    /**
     * GET /api/v1/plans/{id} — The plan, at its latest revision.
     */
    @GetMapping("/{id}")
    public ResponseEntity<PlanResponse> getPlan(@PathVariable String id) {
        return orchestrator.findPlan(id)
                .map(plan -> ResponseEntity.ok(PlanResponse.from(plan)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * POST /api/v1/plans/{id}/executions — Start executing a plan. Runs asynchronously.
     */
    @PostMapping("/{id}/executions")
    public ResponseEntity<?> execute(@PathVariable String id) {
        Optional<TaskPlan> plan = orchestrator.findPlan(id);
        if (plan.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        try {
            ExecutionHandle handle = orchestrator.distributeAndExecute(plan.get());
            log.info("Accepted execution of plan {}", id);
            return ResponseEntity.accepted().body(Map.of(
                    "plan_id", handle.planId(),
                    "status", handle.status().name()
            ));
        } catch (CoordinationException e) {
            return errorResponse(e);
        }
    }

    /**
     * GET /api/v1/plans/{id}/execution — Live status, or the result once finished.
     */
    @GetMapping("/{id}/execution")
    public ResponseEntity<ExecutionResponse> getExecution(@PathVariable String id) {
        return orchestrator.execution(id)
                .map(handle -> ResponseEntity.ok(ExecutionResponse.from(handle)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * DELETE /api/v1/plans/{id}/execution — Cancel the running execution.
     */
    @DeleteMapping("/{id}/execution")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable String id) {
        if (!orchestrator.cancelExecution(id)) {
            if (orchestrator.execution(id).isPresent()) {
                return ResponseEntity.status(409).body(Map.of("error", "Execution of " + id + " already finished"));
            }
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.accepted().body(Map.of(
                "plan_id", id,
                "status", "CANCELLING"
        ));
    }

    /**
     * GET /api/v1/plans/{id}/events — Server-sent progress events of the plan.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        if (orchestrator.findPlan(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }

    private static ResponseEntity<Map<String, Object>> errorResponse(CoordinationException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("category", e.getCategory().name());
        if (e instanceof ValidationException v && !v.getViolations().isEmpty()) {
            body.put("violations", v.getViolations());
        }
        if (e instanceof PlanningException p) {
            body.put("reason", p.getReason().name());
            body.put("diagnostics", p.getDiagnostics() != null ? p.getDiagnostics() : List.of());
        }
        return ResponseEntity.status(statusFor(e)).body(body);
    }

    static int statusFor(CoordinationException e) {
        if (e instanceof MessageTimeoutException) {
            return 504;
        }
        switch (e.getCategory()) {
            case VALIDATION:
                return 400;
            case FEASIBILITY:
                return 422;
            default:
                return 503;
        }
    }
}
