package com.concord.core.engine;

import com.concord.core.model.DependencyEdge;
import com.concord.core.model.TaskPlan;
import com.concord.core.model.TaskStatus;
import com.concord.core.model.TaskUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Computes which task units of a plan can be dispatched next, and which can never run
 * because a predecessor they depend on did not succeed.
 * <p>
 * SEQUENTIAL and PARALLEL_SAFE edges need their source COMPLETED; a CONDITIONAL edge
 * only needs its source to be terminal.
 */
@Service
public class DependencyScheduler {

    private static final Logger log = LoggerFactory.getLogger(DependencyScheduler.class);

    /**
     * Compute the units that are still PENDING and whose incoming edges are all satisfied.
     *
     * @param plan     the plan revision in effect
     * @param statuses current status per task id; absent means PENDING
     * @param limit    maximum number of units to return
     * @return ready units in plan order; empty when nothing can start now
     */
    public List<TaskUnit> computeReady(TaskPlan plan, Map<String, TaskStatus> statuses, int limit) {
        var ready = new ArrayList<TaskUnit>();
        for (TaskUnit unit : plan.tasks()) {
            if (ready.size() >= limit) break;
            if (statusOf(statuses, unit.id()) != TaskStatus.PENDING) {
                continue;
            }
            if (!dependenciesSatisfied(plan, unit.id(), statuses)) {
                log.debug("  {} [{}] waiting on {}", unit.id(), unit.phase(), plan.incoming(unit.id()));
                continue;
            }
            ready.add(unit);
        }
        if (!ready.isEmpty()) {
            log.debug("computeReady: {} of {} task(s) ready", ready.size(), plan.tasks().size());
        }
        return ready;
    }

    /**
     * Units that can no longer start: PENDING or QUEUED with a success-requiring edge from
     * a predecessor that ended FAILED, BLOCKED or CANCELLED.
     */
    public List<String> computeBlocked(TaskPlan plan, Map<String, TaskStatus> statuses) {
        var blocked = new ArrayList<String>();
        for (TaskUnit unit : plan.tasks()) {
            TaskStatus status = statusOf(statuses, unit.id());
            if (status != TaskStatus.PENDING && status != TaskStatus.QUEUED) {
                continue;
            }
            for (DependencyEdge edge : plan.incoming(unit.id())) {
                TaskStatus source = statusOf(statuses, edge.fromTaskId());
                if (edge.kind().requiresSuccess() && source.terminal() && source != TaskStatus.COMPLETED) {
                    blocked.add(unit.id());
                    break;
                }
            }
        }
        return blocked;
    }

    private boolean dependenciesSatisfied(TaskPlan plan, String taskId, Map<String, TaskStatus> statuses) {
        for (DependencyEdge edge : plan.incoming(taskId)) {
            TaskStatus source = statusOf(statuses, edge.fromTaskId());
            if (edge.kind().requiresSuccess() ? source != TaskStatus.COMPLETED : !source.terminal()) {
                return false;
            }
        }
        return true;
    }

    private static TaskStatus statusOf(Map<String, TaskStatus> statuses, String taskId) {
        return statuses.getOrDefault(taskId, TaskStatus.PENDING);
    }
}
