package com.concord.core.error;

/**
 * Thrown without invoking the protected operation while its circuit is open.
 */
public class CircuitOpenException extends CoordinationException {

    private final String callSite;

    public CircuitOpenException(String callSite, Throwable cause) {
        super(ErrorCategory.DEGRADED, "Circuit '" + callSite + "' is open", cause);
        this.callSite = callSite;
    }

    public String getCallSite() {
        return callSite;
    }
}
