package com.concord.dispatch.cli;

import com.concord.core.model.AgentInstance;
import com.concord.core.registry.AgentRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.Collection;

/**
 * CLI command: concord agents
 */
@Command(name = "agents", mixinStandardHelpOptions = true, description = "List registered agents")
@Component
public class AgentsCommand implements Runnable {

    private final AgentRegistry registry;

    public AgentsCommand(AgentRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        Collection<AgentInstance> agents = registry.snapshot().agents().values();
        if (agents.isEmpty()) {
            ConsoleOutput.info("No agents registered.");
            return;
        }
        System.out.printf("%-16s %-12s %-6s %-9s %s%n", "AGENT", "STATUS", "LOAD", "SLOTS", "CAPABILITIES");
        for (AgentInstance agent : agents) {
            System.out.printf("%-16s %-12s %-6.2f %-9s %s%n", agent.id(), agent.status(), agent.load(),
                    agent.activeTasks() + "/" + agent.capacity(), agent.capabilities());
        }
    }
}
