package com.concord.core.error;

/**
 * Thrown when an agent cannot be reached or is not accepting work.
 */
public class AgentUnavailableException extends CoordinationException {

    public AgentUnavailableException(String message) {
        super(ErrorCategory.TRANSIENT, message);
    }
}
