package com.concord.core.error;

/**
 * Base class for errors raised by the coordination core.
 */
public class CoordinationException extends RuntimeException {

    private final ErrorCategory category;

    public CoordinationException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public CoordinationException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
