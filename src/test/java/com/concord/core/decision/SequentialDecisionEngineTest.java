package com.concord.core.decision;

import com.concord.core.concurrent.CancellationToken;
import com.concord.core.engine.CoordinationProperties;
import com.concord.core.error.AgentUnavailableException;
import com.concord.core.knowledge.InMemoryKnowledgeStore;
import com.concord.core.knowledge.KnowledgeStore;
import com.concord.core.model.ActionKind;
import com.concord.core.model.AgentInstance;
import com.concord.core.model.AgentStatus;
import com.concord.core.model.CandidateAction;
import com.concord.core.model.Decision;
import com.concord.core.model.DecisionKind;
import com.concord.core.model.DecisionType;
import com.concord.core.model.PatternOutcome;
import com.concord.core.model.Priority;
import com.concord.core.model.TaskAssignment;
import com.concord.core.model.TaskOutcome;
import com.concord.core.model.TaskStatus;
import com.concord.core.model.TaskUnit;
import com.concord.core.planner.PlannerProperties;
import com.concord.core.strategy.StrategyCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class SequentialDecisionEngineTest {

    private CoordinationProperties properties;
    private PlannerProperties plannerProperties;
    private final AgentInstance agent = new AgentInstance("alpha", Map.of("file-write", 0.9),
            AgentStatus.AVAILABLE, 0.0, 2, 0, 0, null);
    private final List<String> dispatched = Collections.synchronizedList(new ArrayList<>());
    private final List<Map<String, Object>> contexts = Collections.synchronizedList(new ArrayList<>());

    @BeforeEach
    void setUp() {
        properties = new CoordinationProperties();
        properties.getExecution().setTaskTimeout(Duration.ofHours(1));
        plannerProperties = new PlannerProperties();
    }

    private SequentialDecisionEngine engine(ActionDispatcher dispatcher, KnowledgeStore store) {
        return new SequentialDecisionEngine(StrategyCatalog.defaults(plannerProperties), plannerProperties,
                properties, dispatcher, store, null, Clock.systemUTC());
    }

    /** Dispatcher that fails the listed patterns and succeeds everything else. */
    private ActionDispatcher failing(Set<String> failingPatterns) {
        return (assignment, unit, action, context, timeout) -> {
            dispatched.add(action.patternId());
            contexts.add(context);
            return failingPatterns.contains(action.patternId())
                    ? PatternOutcome.failed("boom", Duration.ofMillis(1))
                    : PatternOutcome.succeeded(Map.of("pattern", action.patternId()), Duration.ofMillis(1));
        };
    }

    private static TaskUnit unit(List<String> preconditions, String... capabilities) {
        return new TaskUnit("PLAN-1-T001", "PLAN-1", "execute", "execute: migrate files", Set.of(capabilities),
                Duration.ofMinutes(5), preconditions, "3 files migrated");
    }

    private TaskOutcome run(SequentialDecisionEngine engine, TaskUnit unit, CancellationToken token) {
        var assignment = new TaskAssignment(unit.id(), agent.id(), Priority.NORMAL, unit.estimatedDuration(),
                Instant.now());
        return engine.execute(unit, assignment, agent, null, token);
    }

    private static List<DecisionKind> kinds(TaskOutcome outcome) {
        return outcome.decisions().stream().map(Decision::kind).toList();
    }

    @Nested
    @DisplayName("Selection")
    class SelectionTests {

        @Test
        @DisplayName("dispatches the best scored pattern and records the rest as alternatives")
        void selectsBest() {
            TaskOutcome outcome = run(engine(failing(Set.of()), null), unit(List.of(), "file-write"),
                    CancellationToken.none());

            assertEquals(TaskStatus.COMPLETED, outcome.status());
            assertEquals(List.of(DecisionKind.CHOICE, DecisionKind.COMPLETED), kinds(outcome));
            Decision choice = outcome.decisions().get(0);
            assertEquals(DecisionType.TACTICAL, choice.type());
            assertEquals("file-write.sequential", choice.selected().patternId());
            assertEquals(2, choice.rejectedAlternatives().size());
            for (CandidateAction alternative : choice.rejectedAlternatives()) {
                assertTrue(choice.selected().score() >= alternative.score());
            }
            Decision terminal = outcome.decisions().get(1);
            assertEquals(-1, terminal.step());
            assertEquals(choice.id(), terminal.parentId());
            assertEquals(Map.of("pattern", "file-write.sequential"), outcome.output());
        }

        @Test
        @DisplayName("recorded failures steer the choice away from a pattern")
        void historyInfluencesChoice() {
            var store = new InMemoryKnowledgeStore();
            var past = new Decision("d0", "old", Instant.now(), DecisionType.TACTICAL, DecisionKind.CHOICE, 0,
                    new CandidateAction("x", "file-write.sequential", ActionKind.SEQUENTIAL, "file-write",
                            0.9, 1.0, 1.0, 0.5),
                    0.9, List.of(), "", null);
            for (int i = 0; i < 10; i++) {
                store.saveDecisionOutcome(past, PatternOutcome.failed("broken", Duration.ZERO));
            }

            TaskOutcome outcome = run(engine(failing(Set.of()), store), unit(List.of(), "file-write"),
                    CancellationToken.none());

            assertEquals("file-write.parallel", outcome.decisions().get(0).selected().patternId());
            assertEquals(11, store.queryHistoricalPatterns("file-write").stream()
                    .mapToInt(h -> h.samples()).sum());
        }

        @Test
        @DisplayName("preconditions run first as operational steps and pass their output on")
        void preconditionsFirst() {
            TaskOutcome outcome = run(engine(failing(Set.of()), null),
                    unit(List.of("source readable"), "file-write"), CancellationToken.none());

            assertEquals(TaskStatus.COMPLETED, outcome.status());
            assertEquals(DecisionType.OPERATIONAL, outcome.decisions().get(0).type());
            assertEquals(DecisionType.TACTICAL, outcome.decisions().get(1).type());
            assertEquals("source readable", contexts.get(0).get("step"));
            assertEquals(SequentialDecisionEngine.MAIN_STEP, contexts.get(1).get("step"));
            assertEquals(Map.of("pattern", "file-write.sequential"), contexts.get(1).get("previousOutput"));
            assertEquals("3 files migrated", contexts.get(1).get("expectedOutcome"));
        }

        @Test
        @DisplayName("fails without dispatching when the agent declares none of the required capabilities")
        void noCandidates() {
            TaskOutcome outcome = run(engine(failing(Set.of()), null), unit(List.of(), "deploy"),
                    CancellationToken.none());

            assertEquals(TaskStatus.FAILED, outcome.status());
            assertTrue(outcome.error().contains("No candidate action"));
            assertTrue(dispatched.isEmpty());
        }
    }

    @Nested
    @DisplayName("Backtracking")
    class BacktrackTests {

        @Test
        @DisplayName("a failed pattern backtracks to the next alternative")
        void backtracksToAlternative() {
            TaskOutcome outcome = run(engine(failing(Set.of("file-write.sequential")), null),
                    unit(List.of(), "file-write"), CancellationToken.none());

            assertEquals(TaskStatus.COMPLETED, outcome.status());
            assertEquals(List.of(DecisionKind.CHOICE, DecisionKind.BACKTRACK, DecisionKind.CHOICE,
                    DecisionKind.COMPLETED), kinds(outcome));
            Decision backtrack = outcome.decisions().get(1);
            assertEquals(DecisionType.REACTIVE, backtrack.type());
            assertEquals(0, backtrack.step());
            assertEquals(List.of("file-write.sequential", "file-write.parallel"), dispatched);
            for (int i = 1; i < outcome.decisions().size(); i++) {
                assertEquals(outcome.decisions().get(i - 1).id(), outcome.decisions().get(i).parentId());
            }
        }

        @Test
        @DisplayName("fails once every alternative is exhausted")
        void exhausted() {
            TaskOutcome outcome = run(engine(failing(Set.of("file-write.sequential", "file-write.parallel",
                    "file-write.adaptive")), null), unit(List.of(), "file-write"), CancellationToken.none());

            assertEquals(TaskStatus.FAILED, outcome.status());
            assertTrue(outcome.error().startsWith("Alternatives exhausted"));
            assertEquals(3, dispatched.size());
            assertEquals(6, outcome.decisions().size());
            assertEquals(DecisionKind.FAILED, outcome.decisions().get(5).kind());
        }

        @Test
        @DisplayName("stops at the backtrack limit")
        void backtrackLimit() {
            properties.getExecution().setMaxBacktracks(1);
            TaskOutcome outcome = run(engine(failing(Set.of("file-write.sequential", "file-write.parallel",
                    "file-write.adaptive")), null), unit(List.of(), "file-write"), CancellationToken.none());

            assertEquals(TaskStatus.FAILED, outcome.status());
            assertTrue(outcome.error().startsWith("Backtrack limit 1 reached"));
            assertEquals(2, dispatched.size());
        }

        @Test
        @DisplayName("an unreachable agent counts as a failed step")
        void dispatchErrorsAreStepFailures() {
            ActionDispatcher flaky = (assignment, unit, action, context, timeout) -> {
                dispatched.add(action.patternId());
                if (dispatched.size() == 1) {
                    throw new AgentUnavailableException("alpha down");
                }
                return PatternOutcome.succeeded(Map.of(), Duration.ZERO);
            };
            TaskOutcome outcome = run(engine(flaky, null), unit(List.of(), "file-write"), CancellationToken.none());

            assertEquals(TaskStatus.COMPLETED, outcome.status());
            assertTrue(kinds(outcome).contains(DecisionKind.BACKTRACK));
        }

        @Test
        @DisplayName("times out when the task runs past its timeout")
        void timeout() {
            properties.getExecution().setTaskTimeout(Duration.ofMillis(20));
            ActionDispatcher slow = (assignment, unit, action, context, timeout) -> {
                try {
                    Thread.sleep(50);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return PatternOutcome.failed("slow", Duration.ofMillis(50));
            };
            TaskOutcome outcome = run(engine(slow, null), unit(List.of(), "file-write"), CancellationToken.none());

            assertEquals(TaskStatus.FAILED, outcome.status());
            assertTrue(outcome.error().startsWith("Timed out"));
        }

        @Test
        @DisplayName("a unit's declared timeout bounds its run instead of the configured default")
        void declaredTimeout() {
            var seenBudgets = new ArrayList<Duration>();
            ActionDispatcher slow = (assignment, unit, action, context, timeout) -> {
                seenBudgets.add(timeout);
                try {
                    Thread.sleep(50);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return PatternOutcome.failed("slow", Duration.ofMillis(50));
            };
            TaskUnit base = unit(List.of(), "file-write");
            var bounded = new TaskUnit(base.id(), base.planId(), base.phase(), base.description(),
                    base.requiredCapabilities(), base.estimatedDuration(), base.preconditions(),
                    base.expectedOutcome(), Duration.ofMillis(20));

            TaskOutcome outcome = run(engine(slow, null), bounded, CancellationToken.none());

            assertEquals(TaskStatus.FAILED, outcome.status());
            assertEquals("Timed out after PT0.02S", outcome.error());
            assertTrue(seenBudgets.get(0).compareTo(Duration.ofMillis(20)) <= 0);
        }

        @Test
        @DisplayName("a declared timeout longer than the default lets a slow step finish")
        void declaredTimeoutExtendsDefault() {
            properties.getExecution().setTaskTimeout(Duration.ofMillis(20));
            ActionDispatcher slowButFine = (assignment, unit, action, context, timeout) -> {
                try {
                    Thread.sleep(50);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return PatternOutcome.succeeded(Map.of(), Duration.ofMillis(50));
            };
            TaskUnit base = unit(List.of(), "file-write");
            var generous = new TaskUnit(base.id(), base.planId(), base.phase(), base.description(),
                    base.requiredCapabilities(), base.estimatedDuration(), base.preconditions(),
                    base.expectedOutcome(), Duration.ofSeconds(5));

            TaskOutcome outcome = run(engine(slowButFine, null), generous, CancellationToken.none());

            assertEquals(TaskStatus.COMPLETED, outcome.status());
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class CancellationTests {

        @Test
        @DisplayName("a cancelled token stops before the first step")
        void cancelledBeforeStart() {
            var token = new CancellationToken();
            token.cancel();
            TaskOutcome outcome = run(engine(failing(Set.of()), null), unit(List.of(), "file-write"), token);

            assertEquals(TaskStatus.CANCELLED, outcome.status());
            assertEquals(List.of(DecisionKind.CANCELLED), kinds(outcome));
            assertTrue(dispatched.isEmpty());
        }

        @Test
        @DisplayName("cancellation while waiting on the agent ends the task as CANCELLED")
        void cancelledDuringDispatch() {
            ActionDispatcher interrupted = (assignment, unit, action, context, timeout) -> {
                throw new CancellationException("interrupted");
            };
            TaskOutcome outcome = run(engine(interrupted, null), unit(List.of(), "file-write"),
                    CancellationToken.none());

            assertEquals(TaskStatus.CANCELLED, outcome.status());
            assertEquals(List.of(DecisionKind.CHOICE, DecisionKind.CANCELLED), kinds(outcome));
        }
    }

    @Test
    @DisplayName("deadline fit shrinks as the deadline approaches")
    void deadlineFit() {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        assertEquals(1.0, SequentialDecisionEngine.deadlineFit(Duration.ofMinutes(5), null, now));
        assertEquals(0.05, SequentialDecisionEngine.deadlineFit(Duration.ofMinutes(5), now.minusSeconds(1), now));
        assertEquals(1.0, SequentialDecisionEngine.deadlineFit(Duration.ZERO, now.plusSeconds(10), now));
        assertEquals(0.5, SequentialDecisionEngine.deadlineFit(Duration.ofMinutes(2), now.plusSeconds(60), now),
                1e-9);
        assertEquals(1.0, SequentialDecisionEngine.deadlineFit(Duration.ofMinutes(2), now.plusSeconds(600), now));
    }
}
