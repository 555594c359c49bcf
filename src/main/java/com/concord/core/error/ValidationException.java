package com.concord.core.error;

import java.util.List;

/**
 * Thrown when an objective, constraint or request is malformed.
 */
public class ValidationException extends CoordinationException {

    private final List<String> violations;

    public ValidationException(String message) {
        this(message, List.of(message));
    }

    public ValidationException(String message, List<String> violations) {
        super(ErrorCategory.VALIDATION, message);
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
