package com.concord.core.decision;

/**
 * Payload keys of the pattern execution exchange between the coordinator and agents.
 */
public final class PatternProtocol {

    private PatternProtocol() {}

    public static final String OPERATION = "operation";
    public static final String EXECUTE_PATTERN = "execute-pattern";
    public static final String PING = "ping";
    public static final String TASK_REPORT = "task-report";

    public static final String PLAN_ID = "planId";
    public static final String TASK_ID = "taskId";
    public static final String PATTERN_ID = "patternId";
    public static final String ACTION_KIND = "actionKind";
    public static final String CAPABILITY = "capability";
    public static final String CONTEXT = "context";

    public static final String SUCCESS = "success";
    public static final String OUTPUT = "output";
    public static final String ERROR = "error";
    public static final String ELAPSED_MS = "elapsedMs";
    public static final String LOAD = "load";
    public static final String TASKS = "tasks";
}
