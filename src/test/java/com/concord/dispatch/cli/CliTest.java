package com.concord.dispatch.cli;

import com.concord.core.engine.CoordinationOrchestrator;
import com.concord.core.engine.ExecutionHandle;
import com.concord.core.error.PlanningException;
import com.concord.core.events.CoordinationEvent;
import com.concord.core.health.HealthCheckService;
import com.concord.core.health.HealthStatus;
import com.concord.core.model.AgentInstance;
import com.concord.core.model.AgentStatus;
import com.concord.core.model.ComplexityClass;
import com.concord.core.model.ConstraintKind;
import com.concord.core.model.ContingencyPlan;
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
import com.concord.core.registry.AgentRegistry;
import com.concord.core.registry.RegistrySnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the Concord CLI command structure.
 * These tests exercise picocli directly without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private final CoordinationOrchestrator orchestrator = mock(CoordinationOrchestrator.class);
    private final AgentRegistry registry = mock(AgentRegistry.class);
    private final HealthCheckService healthCheckService = mock(HealthCheckService.class);

    private static TaskPlan samplePlan() {
        var prepare = new TaskUnit("PLAN-T1", "PLAN-2026-0001", "prepare", "Prepare: migrate files",
                Set.of("file-write"), Duration.ofMinutes(10), List.of(), null);
        var execute = new TaskUnit("PLAN-T2", "PLAN-2026-0001", "execute", "Execute: migrate files",
                Set.of("file-write"), Duration.ofMinutes(15), List.of(), null);
        var fallback = new TaskUnit("PLAN-T2-FB", "PLAN-2026-0001", "execute", "Fallback: migrate files",
                Set.of("general"), Duration.ofMinutes(20), List.of(), null);
        var risk = new RiskAssessment(0.62, 0.5, 0, 0.4, 0, Map.of("PLAN-T2", 0.7), RiskLevel.HIGH);
        return new TaskPlan("PLAN-2026-0001", "obj-1", ComplexityClass.MODERATE, List.of(prepare, execute),
                List.of(new DependencyEdge("PLAN-T1", "PLAN-T2", DependencyKind.SEQUENTIAL)),
                Duration.ofMinutes(25), risk,
                List.of(new ContingencyPlan("C1", "PLAN-T2", "failure or no capable agent", fallback)), 0,
                Instant.now());
    }

    private static ExecutionResult result(PlanStatus status, List<String> errors) {
        var outcome = new TaskOutcome("PLAN-T1", "alpha", TaskStatus.COMPLETED, List.of(), Map.of(), null,
                Duration.ofMillis(1500));
        return new ExecutionResult("PLAN-2026-0001", 0, status,
                Map.of("PLAN-T1", TaskStatus.COMPLETED, "PLAN-T2",
                        status == PlanStatus.COMPLETED ? TaskStatus.COMPLETED : TaskStatus.FAILED),
                List.of(outcome), List.of(), errors, Duration.ofSeconds(2));
    }

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == PlanCommand.class) {
                    return (K) new PlanCommand(orchestrator);
                }
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(orchestrator);
                }
                if (cls == AgentsCommand.class) {
                    return (K) new AgentsCommand(registry);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand();
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            int exitCode = new CommandLine(new ConcordCommand(), factory()).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            for (String sub : List.of("plan", "run", "agents", "health", "serve", "help")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "'");
            }
            assertTrue(result.output().contains("Decision planning and multi-agent coordination"));
        }

        @Test
        @DisplayName("--version shows the version")
        void version() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Concord 0.1.0"));
        }

        @Test
        @DisplayName("no subcommand prints banner and usage")
        void noSubcommand() {
            CliResult result = execute();

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("CONCORD v0.1.0"));
            assertTrue(result.output().contains("Usage"));
        }

        @Test
        @DisplayName("plan without an objective is a usage error")
        void planNeedsObjective() {
            CliResult result = execute("plan");

            assertNotEquals(0, result.exitCode());
            verify(orchestrator, never()).planObjective(any());
        }
    }

    @Nested
    @DisplayName("plan")
    class PlanTests {

        @Test
        @DisplayName("prints tasks, dependencies and contingencies")
        void printsPlan() {
            when(orchestrator.planObjective(any())).thenReturn(samplePlan());

            CliResult result = execute("plan", "Migrate 3 files with validation");

            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("PLAN PLAN-2026-0001 (revision 0)"));
            assertTrue(output.contains("Complexity: MODERATE"));
            assertTrue(output.contains("<- PLAN-T1"));
            assertTrue(output.contains("CONTINGENCIES:"));
            assertTrue(output.contains("PLAN-T2-FB"));
            assertTrue(output.contains("Planned 2 task(s)."));
        }

        @Test
        @DisplayName("options become priority, deadline and constraints")
        void optionsBecomeConstraints() {
            when(orchestrator.planObjective(any())).thenReturn(samplePlan());

            execute("plan", "Migrate files", "--priority", "high", "--within", "PT30M",
                    "--require", "file-write", "--require", "validate", "--max-tasks", "4");

            var captor = ArgumentCaptor.forClass(Objective.class);
            verify(orchestrator).planObjective(captor.capture());
            Objective objective = captor.getValue();
            assertEquals("Migrate files", objective.description());
            assertEquals(Priority.HIGH, objective.priority());
            assertNotNull(objective.deadline());
            assertEquals(List.of(ConstraintKind.REQUIRED_CAPABILITY, ConstraintKind.REQUIRED_CAPABILITY,
                    ConstraintKind.MAX_TASKS), objective.constraints().stream().map(c -> c.kind()).toList());
            assertEquals("4", objective.constraints().get(2).value());
        }

        @Test
        @DisplayName("an invalid priority is reported without planning")
        void invalidPriority() {
            CliResult result = execute("plan", "Migrate files", "--priority", "urgent");

            assertTrue(result.output().contains("VALIDATION: Invalid priority: urgent"));
            verify(orchestrator, never()).planObjective(any());
        }

        @Test
        @DisplayName("infeasible objectives print their diagnostics")
        void infeasible() {
            when(orchestrator.planObjective(any())).thenThrow(new PlanningException(
                    PlanningException.Reason.INFEASIBLE, "No feasible plan",
                    List.of("capability deploy is declared by no agent")));

            CliResult result = execute("plan", "Deploy the service");

            assertTrue(result.output().contains("FEASIBILITY: No feasible plan"));
            assertTrue(result.output().contains("capability deploy is declared by no agent"));
        }
    }

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("prints the result of a completed execution")
        void completed() {
            TaskPlan plan = samplePlan();
            ExecutionHandle handle = mock(ExecutionHandle.class);
            when(handle.completion()).thenReturn(CompletableFuture.completedFuture(
                    result(PlanStatus.COMPLETED, List.of())));
            when(orchestrator.planObjective(any())).thenReturn(plan);
            when(orchestrator.distributeAndExecute(any(TaskPlan.class), isNull())).thenReturn(handle);

            CliResult result = execute("run", "Migrate files", "--quiet");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Execution of PLAN-2026-0001"));
            assertTrue(result.output().contains("2 completed"));
            assertTrue(result.output().contains("on alpha"));
            assertTrue(result.output().contains("Objective achieved."));
        }

        @Test
        @DisplayName("a failed execution prints its errors")
        void failed() {
            ExecutionHandle handle = mock(ExecutionHandle.class);
            when(handle.completion()).thenReturn(CompletableFuture.completedFuture(
                    result(PlanStatus.FAILED, List.of("PLAN-T2: Pattern file-write.adaptive failed"))));
            when(orchestrator.planObjective(any())).thenReturn(samplePlan());
            when(orchestrator.distributeAndExecute(any(TaskPlan.class), any())).thenReturn(handle);

            CliResult result = execute("run", "Migrate files");

            assertTrue(result.output().contains("Pattern file-write.adaptive failed"));
            assertTrue(result.output().contains("Execution failed."));
        }

        @Test
        @DisplayName("progress events are printed unless --quiet")
        void streamsEvents() {
            ExecutionHandle handle = mock(ExecutionHandle.class);
            when(handle.completion()).thenReturn(CompletableFuture.completedFuture(
                    result(PlanStatus.COMPLETED, List.of())));
            when(orchestrator.planObjective(any())).thenReturn(samplePlan());
            when(orchestrator.distributeAndExecute(any(TaskPlan.class), any())).thenAnswer(invocation -> {
                Consumer<CoordinationEvent> listener = invocation.getArgument(1);
                listener.accept(CoordinationEvent.task("task.running", "PLAN-2026-0001", "PLAN-T1",
                        Map.of("agentId", "alpha")));
                return handle;
            });

            CliResult result = execute("run", "Migrate files");

            assertTrue(result.output().contains("[TASK] task.running PLAN-T1"));
        }

        @Test
        @DisplayName("durations are printed compactly")
        void formatsDurations() {
            assertEquals("40ms", ConsoleOutput.formatDuration(40));
            assertEquals("1s", ConsoleOutput.formatDuration(1500));
            assertEquals("2m 5s", ConsoleOutput.formatDuration(125_000));
        }
    }

    @Nested
    @DisplayName("agents and health")
    class StatusTests {

        @Test
        @DisplayName("agents prints one row per registered agent")
        void agents() {
            when(registry.snapshot()).thenReturn(RegistrySnapshot.of(List.of(
                    new AgentInstance("alpha", Map.of("file-write", 0.9), AgentStatus.AVAILABLE, 0.5, 2, 1, 0, null),
                    new AgentInstance("beta", Map.of("validate", 0.9), AgentStatus.UNREACHABLE, 0, 2, 0, 3, null))));

            CliResult result = execute("agents");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("AGENT"));
            assertTrue(result.output().contains("alpha"));
            assertTrue(result.output().contains("UNREACHABLE"));
            assertTrue(result.output().contains("1/2"));
        }

        @Test
        @DisplayName("agents with an empty registry says so")
        void noAgents() {
            when(registry.snapshot()).thenReturn(RegistrySnapshot.of(List.of()));

            assertTrue(execute("agents").output().contains("No agents registered."));
        }

        @Test
        @DisplayName("health prints each component and the overall status")
        void health() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("agents", HealthStatus.Status.UP, "3 assignable agent(s)", Map.of()),
                    new HealthStatus("circuits", HealthStatus.Status.DEGRADED, "1 of 3 circuit(s) open", Map.of())));

            CliResult result = execute("health");

            assertTrue(result.output().contains("agents: 3 assignable agent(s)"));
            assertTrue(result.output().contains("circuits: 1 of 3 circuit(s) open"));
            assertTrue(result.output().contains("Overall: DEGRADED"));
        }

        @Test
        @DisplayName("serve prints where the API listens")
        void serve() {
            CliResult result = execute("serve");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("/api/v1/health"));
            assertTrue(result.output().contains("/api/v1/plans/{id}/events"));
        }
    }

    @Nested
    @DisplayName("Serve mode")
    class ServeModeTests {

        @Test
        @DisplayName("only a leading serve selects serve mode")
        void leadingServeOnly() {
            assertTrue(ServeCommand.requested("serve"));
            assertTrue(ServeCommand.requested("serve", "--help"));
            assertFalse(ServeCommand.requested());
            assertFalse(ServeCommand.requested("plan", "serve"));
            assertFalse(ServeCommand.requested("run", "Migrate files", "--require", "serve"));
        }

        @Test
        @DisplayName("the runner leaves serve to the web server and runs everything else")
        void runnerSkipsServe() {
            when(orchestrator.planObjective(any())).thenReturn(samplePlan());
            var runner = new CliRunner(new ConcordCommand(), factory());

            runner.run("serve");
            verify(orchestrator, never()).planObjective(any());
            assertEquals(0, runner.getExitCode());

            PrintStream originalOut = System.out;
            System.setOut(new PrintStream(new ByteArrayOutputStream(), true));
            try {
                runner.run("plan", "serve");
            } finally {
                System.setOut(originalOut);
            }
            verify(orchestrator).planObjective(any());
            assertEquals(0, runner.getExitCode());
        }
    }
}
