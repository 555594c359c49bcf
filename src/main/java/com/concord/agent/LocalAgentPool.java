package com.concord.agent;

import com.concord.core.error.ValidationException;
import com.concord.core.messaging.BusProperties;
import com.concord.core.messaging.CommunicationBus;
import com.concord.core.registry.AgentRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Starts the configured in-process agents, subscribes each to the bus and registers it
 * with the {@link AgentRegistry}.
 */
@Component
public class LocalAgentPool {

    private static final Logger log = LoggerFactory.getLogger(LocalAgentPool.class);

    private final AgentPoolProperties properties;
    private final CommunicationBus bus;
    private final BusProperties busProperties;
    private final AgentRegistry registry;
    private final Map<String, LocalAgent> agents = Collections.synchronizedMap(new LinkedHashMap<>());

    public LocalAgentPool(AgentPoolProperties properties, CommunicationBus bus, BusProperties busProperties,
                          AgentRegistry registry) {
        this.properties = properties;
        this.bus = bus;
        this.busProperties = busProperties;
        this.registry = registry;
    }

    @PostConstruct
    public void start() {
        if (!properties.isEnabled()) {
            log.info("Local agent pool disabled");
            return;
        }
        for (AgentPoolProperties.Definition definition : properties.getPool()) {
            try {
                add(new LocalAgent(definition.getId(), definition.getCapabilities(), definition.getCapacity(), bus,
                        new SimulatedPatternExecutor(definition.getLatency(), definition.getFailingPatterns()),
                        busProperties.getDedupWindow()));
            } catch (ValidationException | IllegalStateException e) {
                log.error("Skipping agent {}: {}", definition.getId(), e.getMessage());
            }
        }
        log.info("Local agent pool started with {} agent(s)", agents.size());
    }

    /**
     * Subscribes and registers {@code agent}.
     *
     * @throws ValidationException   if the registry rejects the agent
     * @throws IllegalStateException if its address is already taken on the bus
     */
    public LocalAgent add(LocalAgent agent) {
        agent.start();
        try {
            registry.register(agent.descriptor());
        } catch (ValidationException e) {
            agent.stop();
            throw e;
        }
        agents.put(agent.id(), agent);
        return agent;
    }

    public boolean remove(String agentId) {
        LocalAgent agent = agents.remove(agentId);
        if (agent == null) {
            return false;
        }
        registry.unregister(agentId);
        agent.stop();
        return true;
    }

    public Optional<LocalAgent> find(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public Collection<LocalAgent> agents() {
        synchronized (agents) {
            return new ArrayList<>(agents.values());
        }
    }

    @PreDestroy
    public void stop() {
        for (LocalAgent agent : agents()) {
            agent.stop();
        }
        agents.clear();
    }
}
