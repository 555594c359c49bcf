package com.concord.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Concord.
 * Routes to subcommands: plan, run, agents, health, serve.
 */
@Command(
        name = "concord",
        mixinStandardHelpOptions = true,
        version = "Concord 0.1.0",
        description = "Decision planning and multi-agent coordination",
        subcommands = {
                PlanCommand.class,
                RunCommand.class,
                AgentsCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ConcordCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
