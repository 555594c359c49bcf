package com.concord.core.messaging;

import com.concord.core.model.AgentMessage;

/**
 * Receives messages from a mailbox. Throwing triggers redelivery of the same message.
 */
@FunctionalInterface
public interface MessageHandler {
    void handle(AgentMessage message);
}
