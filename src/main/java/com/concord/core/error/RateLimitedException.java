package com.concord.core.error;

/**
 * Thrown when no call permit for a call site frees up within the rate limit timeout.
 * The protected operation is not invoked.
 */
public class RateLimitedException extends CoordinationException {

    private final String callSite;

    public RateLimitedException(String callSite) {
        super(ErrorCategory.TRANSIENT, "Rate limit of '" + callSite + "' exceeded");
        this.callSite = callSite;
    }

    public String getCallSite() {
        return callSite;
    }
}
