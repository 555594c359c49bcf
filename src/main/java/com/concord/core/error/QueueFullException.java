package com.concord.core.error;

/**
 * Thrown when a recipient's mailbox stays full for the whole send timeout.
 */
public class QueueFullException extends CoordinationException {

    private final String recipient;

    public QueueFullException(String recipient, int depth) {
        super(ErrorCategory.TRANSIENT, "Mailbox of " + recipient + " is full (depth " + depth + ")");
        this.recipient = recipient;
    }

    public String getRecipient() {
        return recipient;
    }
}
