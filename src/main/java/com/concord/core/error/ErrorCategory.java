package com.concord.core.error;

/**
 * Error taxonomy used to decide retry and reporting behaviour.
 */
public enum ErrorCategory {
    /** Malformed input; rejected immediately, never retried. */
    VALIDATION,
    /** No plan or agent can satisfy the request; surfaced with diagnostics, not retried. */
    FEASIBILITY,
    /** Delivery failure, timeout or unreachable agent; retried up to policy limits. */
    TRANSIENT,
    /** A circuit is open; the dependency is currently degraded. */
    DEGRADED
}
