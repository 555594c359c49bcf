package com.concord.core.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scoped MDC keys for the plan, task and agent a thread is working on, used by the
 * console log pattern.
 * <p>
 * Each method returns a {@link Scope} for try-with-resources; closing it puts back
 * whatever the keys held before, so scopes nest on one thread.
 */
public final class MdcContext {

    public static final String PLAN_ID = "planId";
    public static final String TASK_ID = "taskId";
    public static final String AGENT_ID = "agentId";

    private MdcContext() {}

    public static Scope plan(String planId) {
        return new Scope().put(PLAN_ID, planId);
    }

    public static Scope agent(String agentId) {
        return new Scope().put(AGENT_ID, agentId);
    }

    /** A null {@code agentId} leaves the agent key as it is. */
    public static Scope task(String planId, String taskId, String agentId) {
        Scope scope = new Scope().put(PLAN_ID, planId).put(TASK_ID, taskId);
        return agentId != null ? scope.put(AGENT_ID, agentId) : scope;
    }

    public static final class Scope implements AutoCloseable {

        private final Map<String, String> previous = new LinkedHashMap<>();

        private Scope() {}

        private Scope put(String key, String value) {
            previous.putIfAbsent(key, MDC.get(key));
            if (value != null) {
                MDC.put(key, value);
            } else {
                MDC.remove(key);
            }
            return this;
        }

        @Override
        public void close() {
            previous.forEach((key, value) -> {
                if (value != null) {
                    MDC.put(key, value);
                } else {
                    MDC.remove(key);
                }
            });
        }
    }
}
