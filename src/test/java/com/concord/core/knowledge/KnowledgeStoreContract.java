package com.concord.core.knowledge;

import com.concord.core.model.ActionKind;
import com.concord.core.model.AgentInstance;
import com.concord.core.model.AgentStatus;
import com.concord.core.model.CandidateAction;
import com.concord.core.model.ComplexityClass;
import com.concord.core.model.Conflict;
import com.concord.core.model.ConflictingValue;
import com.concord.core.model.ContingencyPlan;
import com.concord.core.model.Decision;
import com.concord.core.model.DecisionKind;
import com.concord.core.model.DecisionType;
import com.concord.core.model.DependencyEdge;
import com.concord.core.model.DependencyKind;
import com.concord.core.model.HistoricalPattern;
import com.concord.core.model.Objective;
import com.concord.core.model.PatternOutcome;
import com.concord.core.model.Priority;
import com.concord.core.model.Resolution;
import com.concord.core.model.ResolutionStrategy;
import com.concord.core.model.RiskAssessment;
import com.concord.core.model.RiskLevel;
import com.concord.core.model.Severity;
import com.concord.core.model.TaskPlan;
import com.concord.core.model.TaskUnit;
import com.concord.core.planner.DecisionPlanner;
import com.concord.core.planner.PlannerProperties;
import com.concord.core.registry.RegistrySnapshot;
import com.concord.core.strategy.StrategyCatalog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link KnowledgeStore} shares.
 */
abstract class KnowledgeStoreContract {

    protected abstract KnowledgeStore store();

    static TaskPlan samplePlan(String id, int revision) {
        var prepare = new TaskUnit(id + "-T001", id, "prepare", "prepare: migrate files", Set.of("file-write"),
                Duration.ofMinutes(5), List.of(), "prepare completed");
        var execute = new TaskUnit(id + "-T002", id, "execute", "execute: migrate files", Set.of("file-write"),
                Duration.ofMinutes(20), List.of("source readable"), "3 files migrated");
        var fallback = new TaskUnit(id + "-T002-F", id, "execute", "fallback: migrate files", Set.of("general"),
                Duration.ofMinutes(30), List.of(), "3 files migrated");
        var risk = new RiskAssessment(0.55, 0.4, 0, 0.2, 0.1,
                Map.of(prepare.id(), 0.3, execute.id(), 0.6), RiskLevel.MEDIUM);
        return new TaskPlan(id, "obj-1", ComplexityClass.MODERATE, List.of(prepare, execute),
                List.of(new DependencyEdge(prepare.id(), execute.id(), DependencyKind.SEQUENTIAL)),
                Duration.ofMinutes(25), risk,
                List.of(new ContingencyPlan("C-1", execute.id(), "execute fails", fallback)),
                revision, Instant.now().truncatedTo(ChronoUnit.MILLIS));
    }

    static Decision decision(String capability, String patternId) {
        var action = new CandidateAction("a-" + patternId, patternId, ActionKind.SEQUENTIAL, capability,
                0.9, 1.0, 1.0, 0.8);
        return new Decision(UUID.randomUUID().toString(), "T001", Instant.now(), DecisionType.TACTICAL,
                DecisionKind.CHOICE, 0, action, 0.9, List.of(), "best score", null);
    }

    @Test
    @DisplayName("a saved plan loads back equal, with its contingencies")
    void planRoundTrip() {
        TaskPlan plan = samplePlan("PLAN-RT-1", 0);
        store().savePlan(plan);

        TaskPlan loaded = store().loadPlan("PLAN-RT-1").orElseThrow();
        assertEquals(plan, loaded);
        assertEquals("3 files migrated", loaded.contingencyFor("PLAN-RT-1-T002").orElseThrow()
                .fallback().expectedOutcome());
    }

    @Test
    @DisplayName("saving a plan again replaces the earlier revision")
    void planRevisionReplaced() {
        store().savePlan(samplePlan("PLAN-RT-2", 0));
        store().savePlan(samplePlan("PLAN-RT-2", 1));
        assertEquals(1, store().loadPlan("PLAN-RT-2").orElseThrow().revision());
    }

    @Test
    @DisplayName("plans from two planner instances, as after a restart, are stored side by side")
    void plansAcrossPlannerInstances() {
        var properties = new PlannerProperties();
        var clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        var pool = RegistrySnapshot.of(List.of(new AgentInstance("alpha", Map.of("file-write", 0.9,
                "validate", 0.9, "general", 0.6), AgentStatus.AVAILABLE, 0, 2, 0, 0, null)));
        var objective = new Objective("obj-restart", "Migrate 3 files with validation", Priority.NORMAL, null,
                List.of(), List.of(), List.of());

        TaskPlan before = new DecisionPlanner(StrategyCatalog.defaults(properties), properties, null, store(), null,
                clock).plan(objective, pool);
        store().savePlan(before);
        TaskPlan after = new DecisionPlanner(StrategyCatalog.defaults(properties), properties, null, store(), null,
                clock).plan(objective, pool);
        store().savePlan(after);

        assertNotEquals(before.id(), after.id());
        assertEquals(before, store().loadPlan(before.id()).orElseThrow());
        assertEquals(after, store().loadPlan(after.id()).orElseThrow());
    }

    @Test
    @DisplayName("unknown plans load as empty")
    void unknownPlan() {
        assertTrue(store().loadPlan("PLAN-MISSING").isEmpty());
    }

    @Test
    @DisplayName("decision outcomes aggregate into per-pattern history, most sampled first")
    void historicalPatterns() {
        for (int i = 0; i < 3; i++) {
            store().saveDecisionOutcome(decision("file-write", "file-write.sequential"),
                    i < 2 ? PatternOutcome.succeeded(Map.of(), Duration.ofMillis(10))
                            : PatternOutcome.failed("disk full", Duration.ofMillis(10)));
        }
        store().saveDecisionOutcome(decision("file-write", "file-write.parallel"),
                PatternOutcome.succeeded(Map.of(), Duration.ofMillis(5)));
        store().saveDecisionOutcome(decision("validate", "validate.sequential"),
                PatternOutcome.failed("mismatch", Duration.ofMillis(5)));

        List<HistoricalPattern> history = store().queryHistoricalPatterns("file-write");
        assertEquals(2, history.size());
        assertEquals("file-write.sequential", history.get(0).patternId());
        assertEquals(3, history.get(0).samples());
        assertEquals(2.0 / 3, history.get(0).successRate(), 1e-9);
        assertEquals(1.0, history.get(1).successRate(), 1e-9);
        assertTrue(store().queryHistoricalPatterns("deploy").isEmpty());
    }

    @Test
    @DisplayName("terminal decisions without a selected action are not recorded")
    void terminalDecisionIgnored() {
        var terminal = new Decision("d", "T009", Instant.now(), DecisionType.REACTIVE, DecisionKind.FAILED, -1,
                null, 0.0, List.of(), "gave up", null);
        store().saveDecisionOutcome(terminal, PatternOutcome.failed("x", Duration.ZERO));
        assertTrue(store().queryHistoricalPatterns("report").isEmpty());
    }

    @Test
    @DisplayName("resolutions are stored by conflict id")
    void resolutions() {
        var conflict = new Conflict("c-1", Severity.MEDIUM, "task.T1",
                List.of(new ConflictingValue("a", Map.of("count", 3), Instant.now()),
                        new ConflictingValue("b", Map.of("count", 4), Instant.now())),
                Instant.now());
        var resolution = new Resolution("c-1", ResolutionStrategy.MERGE, Map.of("count", 4), 0.75,
                "consensus 2/2", List.of("count"), Instant.now().truncatedTo(ChronoUnit.MILLIS));
        store().saveResolution(conflict, resolution);
        assertEquals(resolution, loadResolution("c-1"));
    }

    protected abstract Resolution loadResolution(String conflictId);
}
