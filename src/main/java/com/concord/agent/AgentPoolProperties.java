package com.concord.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-process worker agents started with the application.
 */
@Component
@ConfigurationProperties(prefix = "concord.agents")
public class AgentPoolProperties {

    private boolean enabled = true;
    private List<Definition> pool = defaultPool();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<Definition> getPool() {
        return pool;
    }

    public void setPool(List<Definition> pool) {
        this.pool = pool;
    }

    private static List<Definition> defaultPool() {
        var pool = new ArrayList<Definition>();
        pool.add(definition("agent-alpha", Map.of("file-write", 0.9, "general", 0.6)));
        pool.add(definition("agent-beta", Map.of("file-write", 0.8, "validate", 0.9, "general", 0.5)));
        pool.add(definition("agent-gamma", Map.of("analyze", 0.9, "report", 0.9, "validate", 0.7, "general", 0.5)));
        return pool;
    }

    private static Definition definition(String id, Map<String, Double> capabilities) {
        var d = new Definition();
        d.setId(id);
        d.setCapabilities(new LinkedHashMap<>(capabilities));
        return d;
    }

    public static class Definition {
        private String id;
        /** Capability tag to confidence, 0..1. */
        private Map<String, Double> capabilities = new LinkedHashMap<>();
        private int capacity = 2;
        /** Simulated time each pattern takes. */
        private Duration latency = Duration.ofMillis(200);
        /** Pattern ids, or capability prefixes, that always fail on this agent. */
        private Set<String> failingPatterns = new LinkedHashSet<>();

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public Map<String, Double> getCapabilities() {
            return capabilities;
        }

        public void setCapabilities(Map<String, Double> capabilities) {
            this.capabilities = capabilities;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public Duration getLatency() {
            return latency;
        }

        public void setLatency(Duration latency) {
            this.latency = latency;
        }

        public Set<String> getFailingPatterns() {
            return failingPatterns;
        }

        public void setFailingPatterns(Set<String> failingPatterns) {
            this.failingPatterns = failingPatterns;
        }
    }
}
