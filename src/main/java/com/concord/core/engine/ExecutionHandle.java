package com.concord.core.engine;

import com.concord.core.events.CoordinationEvent;
import com.concord.core.events.EventBus;
import com.concord.core.model.ExecutionResult;
import com.concord.core.model.PlanStatus;
import com.concord.core.model.TaskPlan;
import com.concord.core.model.TaskStatus;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Caller's view of a running plan: progress events, live status and the completion
 * future of the final {@link ExecutionResult}.
 */
public class ExecutionHandle {

    private final PlanExecution execution;
    private final EventBus eventBus;

    ExecutionHandle(PlanExecution execution, EventBus eventBus) {
        this.execution = execution;
        this.eventBus = eventBus;
    }

    public String planId() {
        return execution.planId();
    }

    /** Receives the plan's task- and plan-level events from now on. */
    public EventBus.Subscription subscribe(Consumer<CoordinationEvent> listener) {
        return eventBus.subscribe(execution.planId(), listener);
    }

    /** Completes with the result once the plan is COMPLETED, FAILED or CANCELLED. Never completes exceptionally. */
    public CompletableFuture<ExecutionResult> completion() {
        return execution.completion();
    }

    public Optional<ExecutionResult> result() {
        CompletableFuture<ExecutionResult> f = execution.completion();
        return f.isDone() ? Optional.of(f.join()) : Optional.empty();
    }

    public PlanStatus status() {
        return execution.status();
    }

    public Map<String, TaskStatus> taskStatuses() {
        return execution.taskStatuses();
    }

    /** The plan revision in effect, which changes when contingencies are substituted. */
    public TaskPlan currentPlan() {
        return execution.currentPlan();
    }

    public boolean isDone() {
        return execution.completion().isDone();
    }

    public void cancel() {
        execution.cancel();
    }
}
