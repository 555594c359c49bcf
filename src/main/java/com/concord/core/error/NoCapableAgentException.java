package com.concord.core.error;

import java.util.Set;

/**
 * Thrown when no registered agent declares the capabilities a task unit requires.
 */
public class NoCapableAgentException extends CoordinationException {

    private final String taskId;

    public NoCapableAgentException(String taskId, Set<String> requiredCapabilities) {
        super(ErrorCategory.FEASIBILITY,
                "No registered agent can take task " + taskId + " (requires " + requiredCapabilities + ")");
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
