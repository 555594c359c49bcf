package com.concord.core.messaging;

import com.concord.core.model.AgentMessage;
import com.concord.core.model.MessageType;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Remembers the ids of up to {@code window} processed messages, together with the
 * reply sent for each, so a redelivered request is answered again without being
 * processed twice. Past the window the least valuable ids are evicted; the most
 * recently processed one is always kept.
 */
public class MessageDeduplicator {

    private static final AgentMessage NO_REPLY = AgentMessage.of(MessageType.STATUS, "", List.of(), Map.of());

    private final Cache<String, AgentMessage> processed;

    public MessageDeduplicator(int window) {
        this.processed = Caffeine.newBuilder()
                .maximumSize(Math.max(1, window))
                .executor(Runnable::run)
                .build();
    }

    public boolean isDuplicate(String messageId) {
        return processed.getIfPresent(messageId) != null;
    }

    /** The reply recorded for an already processed message, if it had one. */
    public Optional<AgentMessage> replyFor(String messageId) {
        AgentMessage reply = processed.getIfPresent(messageId);
        return reply == null || reply == NO_REPLY ? Optional.empty() : Optional.of(reply);
    }

    public void markProcessed(String messageId, AgentMessage reply) {
        processed.put(messageId, reply != null ? reply : NO_REPLY);
    }

    public long size() {
        processed.cleanUp();
        return processed.estimatedSize();
    }
}
