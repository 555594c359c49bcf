package com.concord.core.error;

/**
 * Thrown when a request gets no response within its round-trip timeout.
 */
public class MessageTimeoutException extends CoordinationException {

    public MessageTimeoutException(String message) {
        super(ErrorCategory.TRANSIENT, message);
    }
}
