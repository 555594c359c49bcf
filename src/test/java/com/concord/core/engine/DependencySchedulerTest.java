package com.concord.core.engine;

import com.concord.core.model.ComplexityClass;
import com.concord.core.model.DependencyEdge;
import com.concord.core.model.DependencyKind;
import com.concord.core.model.RiskAssessment;
import com.concord.core.model.RiskLevel;
import com.concord.core.model.TaskPlan;
import com.concord.core.model.TaskStatus;
import com.concord.core.model.TaskUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencySchedulerTest {

    private final DependencyScheduler scheduler = new DependencyScheduler();

    private static TaskUnit unit(String id) {
        return new TaskUnit(id, "P", "execute", id, Set.of("general"), Duration.ofMinutes(1), List.of(), null);
    }

    // a -> b (sequential), a -> c (parallel-safe), b -> d (conditional)
    private static TaskPlan plan() {
        return new TaskPlan("P", "o", ComplexityClass.MODERATE,
                List.of(unit("a"), unit("b"), unit("c"), unit("d")),
                List.of(new DependencyEdge("a", "b", DependencyKind.SEQUENTIAL),
                        new DependencyEdge("a", "c", DependencyKind.PARALLEL_SAFE),
                        new DependencyEdge("b", "d", DependencyKind.CONDITIONAL)),
                Duration.ofMinutes(3), new RiskAssessment(0, 0, 0, 0, 0, Map.of(), RiskLevel.LOW), List.of(), 0,
                Instant.now());
    }

    private static List<String> ids(List<TaskUnit> units) {
        return units.stream().map(TaskUnit::id).toList();
    }

    @Test
    @DisplayName("only roots are ready at the start")
    void rootsFirst() {
        assertEquals(List.of("a"), ids(scheduler.computeReady(plan(), Map.of(), 10)));
    }

    @Test
    @DisplayName("successors become ready once their source completes, up to the limit")
    void successorsAfterCompletion() {
        var statuses = Map.of("a", TaskStatus.COMPLETED);
        assertEquals(List.of("b", "c"), ids(scheduler.computeReady(plan(), statuses, 10)));
        assertEquals(List.of("b"), ids(scheduler.computeReady(plan(), statuses, 1)));
    }

    @Test
    @DisplayName("running or queued units are not offered again")
    void notOfferedTwice() {
        var statuses = Map.of("a", TaskStatus.COMPLETED, "b", TaskStatus.RUNNING, "c", TaskStatus.QUEUED);
        assertTrue(scheduler.computeReady(plan(), statuses, 10).isEmpty());
    }

    @Test
    @DisplayName("a conditional edge is satisfied by any terminal source")
    void conditionalEdge() {
        var statuses = Map.of("a", TaskStatus.COMPLETED, "b", TaskStatus.FAILED, "c", TaskStatus.COMPLETED);
        assertEquals(List.of("d"), ids(scheduler.computeReady(plan(), statuses, 10)));
        assertTrue(scheduler.computeBlocked(plan(), statuses).isEmpty());
    }

    @Test
    @DisplayName("a failed source blocks the units that need its success")
    void blocked() {
        var statuses = Map.of("a", TaskStatus.FAILED);
        assertEquals(List.of("b", "c"), scheduler.computeBlocked(plan(), statuses));
        assertTrue(scheduler.computeReady(plan(), statuses, 10).isEmpty());
    }
}
