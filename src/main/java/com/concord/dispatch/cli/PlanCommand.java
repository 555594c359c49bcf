package com.concord.dispatch.cli;

import com.concord.core.engine.CoordinationOrchestrator;
import com.concord.core.error.CoordinationException;
import com.concord.core.error.PlanningException;
import com.concord.core.model.TaskPlan;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command: concord plan "&lt;objective&gt;"
 * <p>
 * Plans the objective against the registered agents and prints the resulting plan
 * without executing it.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Plan an objective without executing it")
@Component
public class PlanCommand implements Runnable {

    @Mixin
    ObjectiveOptions objective;

    private final CoordinationOrchestrator orchestrator;

    public PlanCommand(CoordinationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            TaskPlan plan = orchestrator.planObjective(objective.toObjective());
            ConsoleOutput.plan(plan);
            System.out.println();
            ConsoleOutput.success("Planned " + plan.tasks().size() + " task(s).");
        } catch (CoordinationException e) {
            report(e);
        }
    }

    static void report(CoordinationException e) {
        ConsoleOutput.error(e.getCategory() + ": " + e.getMessage());
        if (e instanceof PlanningException p && p.getDiagnostics() != null) {
            p.getDiagnostics().forEach(d -> ConsoleOutput.error("  " + d));
        }
    }
}
