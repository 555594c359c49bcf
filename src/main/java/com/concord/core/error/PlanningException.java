package com.concord.core.error;

import java.util.List;

/**
 * Thrown when no decomposition of an objective satisfies its mandatory constraints.
 */
public class PlanningException extends CoordinationException {

    public enum Reason { INFEASIBLE }

    private final Reason reason;
    private final List<String> diagnostics;

    public PlanningException(Reason reason, String message, List<String> diagnostics) {
        super(ErrorCategory.FEASIBILITY, message);
        this.reason = reason;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public Reason getReason() {
        return reason;
    }

    public List<String> getDiagnostics() {
        return diagnostics;
    }
}
