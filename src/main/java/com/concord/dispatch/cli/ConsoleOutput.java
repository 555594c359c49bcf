package com.concord.dispatch.cli;

import com.concord.core.events.CoordinationEvent;
import com.concord.core.model.DependencyEdge;
import com.concord.core.model.ExecutionResult;
import com.concord.core.model.TaskOutcome;
import com.concord.core.model.TaskPlan;
import com.concord.core.model.TaskUnit;
import picocli.CommandLine;

import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for the Concord CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CONCORD v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CONCORD]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void plan(TaskPlan plan) {
        System.out.println();
        System.out.println("PLAN " + plan.id() + " (revision " + plan.revision() + ")");
        System.out.println("Complexity: " + plan.complexity() + " | Risk: " + plan.risk().level()
                + String.format(" (%.2f)", plan.risk().overallRisk())
                + " | Estimate: " + formatDuration(plan.estimatedDuration().toMillis()));
        System.out.println();
        System.out.println("TASKS:");
        for (TaskUnit unit : plan.tasks()) {
            String deps = plan.incoming(unit.id()).stream()
                    .map(DependencyEdge::fromTaskId)
                    .collect(Collectors.joining(", "));
            System.out.printf("  %-12s [%-9s] %s%s%n", unit.id(), unit.phase(), unit.description(),
                    deps.isEmpty() ? "" : "  <- " + deps);
        }
        if (!plan.contingencies().isEmpty()) {
            System.out.println();
            System.out.println("CONTINGENCIES:");
            plan.contingencies().forEach(c -> System.out.printf("  %-12s -> %s (%s)%n",
                    c.taskId(), c.fallback().id(), c.triggerCondition()));
        }
    }

    public static void event(CoordinationEvent event) {
        String type = event.eventType();
        String prefix;
        if (type.startsWith("plan.")) {
            prefix = "@|bold,fg(yellow) [PLAN]|@";
        } else if (type.equals("task.completed")) {
            prefix = "@|fg(green) [TASK]|@";
        } else if (type.equals("task.failed") || type.equals("task.blocked")) {
            prefix = "@|fg(red) [TASK]|@";
        } else if (type.startsWith("task.")) {
            prefix = "@|fg(blue) [TASK]|@";
        } else if (type.startsWith("conflict.") || type.startsWith("consensus.")) {
            prefix = "@|fg(magenta) [CONSENSUS]|@";
        } else {
            prefix = "@|fg(white) [" + type + "]|@";
        }
        String subject = event.taskId() != null ? event.taskId() : event.planId();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + type + " " + subject
                + (event.payload().isEmpty() ? "" : " " + event.payload())));
    }

    public static void result(ExecutionResult result) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Execution of " + result.planId() + "|@"));
        long completed = result.taskStatuses().values().stream().filter(s -> s.name().equals("COMPLETED")).count();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tasks: @|fg(green) " + completed + " completed|@ of " + result.taskStatuses().size()));
        for (TaskOutcome outcome : result.outcomes()) {
            System.out.printf("  %-12s %-10s on %s (%d decisions, %s)%n", outcome.taskId(), outcome.status(),
                    outcome.agentId(), outcome.decisions().size(),
                    formatDuration(outcome.elapsed() != null ? outcome.elapsed().toMillis() : 0));
        }
        if (!result.resolutions().isEmpty()) {
            System.out.println("  Conflicts resolved: " + result.resolutions().size());
        }
        for (String error : result.errors()) {
            error("  " + error);
        }
        System.out.println("  Duration: " + formatDuration(result.elapsed() != null ? result.elapsed().toMillis() : 0));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
