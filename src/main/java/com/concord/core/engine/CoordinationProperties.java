package com.concord.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Timeouts and limits of the coordination runtime, one section per component.
 */
@Component
@ConfigurationProperties(prefix = "concord.coordination")
public class CoordinationProperties {

    /** Round-trip timeout for a single coordinator to agent request. */
    private Duration messageTimeout = Duration.ofSeconds(5);
    private Registry registry = new Registry();
    private Distributor distributor = new Distributor();
    private Consensus consensus = new Consensus();
    private Execution execution = new Execution();
    private Retention retention = new Retention();

    public Duration getMessageTimeout() {
        return messageTimeout;
    }

    public void setMessageTimeout(Duration messageTimeout) {
        this.messageTimeout = messageTimeout;
    }

    public Registry getRegistry() {
        return registry;
    }

    public void setRegistry(Registry registry) {
        this.registry = registry;
    }

    public Distributor getDistributor() {
        return distributor;
    }

    public void setDistributor(Distributor distributor) {
        this.distributor = distributor;
    }

    public Consensus getConsensus() {
        return consensus;
    }

    public void setConsensus(Consensus consensus) {
        this.consensus = consensus;
    }

    public Execution getExecution() {
        return execution;
    }

    public void setExecution(Execution execution) {
        this.execution = execution;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    public static class Registry {
        /** Consecutive unanswered heartbeat rounds before an agent is UNREACHABLE. */
        private int maxMissedHeartbeats = 3;
        private Duration heartbeatInterval = Duration.ofSeconds(5);
        private Duration heartbeatTimeout = Duration.ofSeconds(1);

        public int getMaxMissedHeartbeats() { return maxMissedHeartbeats; }
        public void setMaxMissedHeartbeats(int maxMissedHeartbeats) { this.maxMissedHeartbeats = maxMissedHeartbeats; }
        public Duration getHeartbeatInterval() { return heartbeatInterval; }
        public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }
        public Duration getHeartbeatTimeout() { return heartbeatTimeout; }
        public void setHeartbeatTimeout(Duration heartbeatTimeout) { this.heartbeatTimeout = heartbeatTimeout; }
    }

    public static class Distributor {
        /** Assignment costs above this are treated as infeasible. */
        private double feasibilityCeiling = 100.0;

        public double getFeasibilityCeiling() { return feasibilityCeiling; }
        public void setFeasibilityCeiling(double feasibilityCeiling) { this.feasibilityCeiling = feasibilityCeiling; }
    }

    public static class Consensus {
        private Duration phaseTimeout = Duration.ofSeconds(2);

        public Duration getPhaseTimeout() { return phaseTimeout; }
        public void setPhaseTimeout(Duration phaseTimeout) { this.phaseTimeout = phaseTimeout; }
    }

    public static class Execution {
        private Duration taskTimeout = Duration.ofSeconds(60);
        private int maxConcurrentPlans = 4;
        private int taskPoolSize = 8;
        private int maxBacktracks = 5;
        /** How often a plan execution re-checks queued work while nothing completes. */
        private Duration pollInterval = Duration.ofMillis(100);

        public Duration getTaskTimeout() { return taskTimeout; }
        public void setTaskTimeout(Duration taskTimeout) { this.taskTimeout = taskTimeout; }
        public int getMaxConcurrentPlans() { return maxConcurrentPlans; }
        public void setMaxConcurrentPlans(int maxConcurrentPlans) { this.maxConcurrentPlans = maxConcurrentPlans; }
        public int getTaskPoolSize() { return taskPoolSize; }
        public void setTaskPoolSize(int taskPoolSize) { this.taskPoolSize = taskPoolSize; }
        public int getMaxBacktracks() { return maxBacktracks; }
        public void setMaxBacktracks(int maxBacktracks) { this.maxBacktracks = maxBacktracks; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    }

    /**
     * How much finished work stays in memory. Plans evicted here can still be loaded from
     * the knowledge store.
     */
    public static class Retention {
        private int finishedExecutions = 256;
        private int plans = 1024;
        private Duration ttl = Duration.ofHours(1);

        public int getFinishedExecutions() { return finishedExecutions; }
        public void setFinishedExecutions(int finishedExecutions) { this.finishedExecutions = finishedExecutions; }
        public int getPlans() { return plans; }
        public void setPlans(int plans) { this.plans = plans; }
        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }
    }
}
