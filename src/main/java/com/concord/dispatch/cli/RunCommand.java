package com.concord.dispatch.cli;

import com.concord.core.engine.CoordinationOrchestrator;
import com.concord.core.engine.ExecutionHandle;
import com.concord.core.error.CoordinationException;
import com.concord.core.model.ExecutionResult;
import com.concord.core.model.PlanStatus;
import com.concord.core.model.TaskPlan;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * CLI command: concord run "&lt;objective&gt;"
 * <p>
 * Plans the objective, executes the plan across the agent pool while streaming
 * progress events, and prints the execution result.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Plan and execute an objective")
@Component
public class RunCommand implements Runnable {

    @Mixin
    ObjectiveOptions objective;

    @Option(names = {"--timeout", "-t"}, description = "Give up and cancel after this long", defaultValue = "PT10M")
    Duration timeout;

    @Option(names = {"--quiet", "-q"}, description = "Do not print progress events")
    boolean quiet;

    private static final Duration EVENT_DRAIN = Duration.ofSeconds(2);

    private final CoordinationOrchestrator orchestrator;

    public RunCommand(CoordinationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        TaskPlan plan;
        ExecutionHandle handle;
        var eventsDone = new CountDownLatch(quiet ? 0 : 1);
        try {
            plan = orchestrator.planObjective(objective.toObjective());
            ConsoleOutput.plan(plan);
            System.out.println();
            handle = orchestrator.distributeAndExecute(plan, quiet ? null : event -> {
                ConsoleOutput.event(event);
                if (event.terminal()) {
                    eventsDone.countDown();
                }
            });
        } catch (CoordinationException e) {
            PlanCommand.report(e);
            return;
        }

        ExecutionResult result;
        try {
            result = handle.completion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            ConsoleOutput.error("Execution did not finish within " + timeout + "; cancelling");
            handle.cancel();
            result = handle.completion().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.cancel();
            ConsoleOutput.error("Interrupted");
            return;
        } catch (ExecutionException e) {
            ConsoleOutput.error("Execution failed: " + e.getCause().getMessage());
            return;
        }

        awaitEvents(eventsDone);
        ConsoleOutput.result(result);
        System.out.println();
        if (result.status() == PlanStatus.COMPLETED) {
            ConsoleOutput.success("Objective achieved.");
        } else if (result.status() == PlanStatus.CANCELLED) {
            ConsoleOutput.warn("Execution cancelled.");
        } else {
            ConsoleOutput.error("Execution " + result.status().name().toLowerCase() + ".");
        }
    }

    // progress events are delivered asynchronously; let the last ones print first
    private static void awaitEvents(CountDownLatch eventsDone) {
        try {
            eventsDone.await(EVENT_DRAIN.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
