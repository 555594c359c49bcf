package com.concord.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A message carried by the communication bus. Receivers de-duplicate by {@link #id()}.
 *
 * @param id               unique message id
 * @param type             message type
 * @param sender           sender address
 * @param recipients       one or many recipient addresses
 * @param payload          message body
 * @param priority         delivery priority (informational; ordering is FIFO per sender)
 * @param timestamp        creation time
 * @param requiresResponse whether the sender awaits a {@link MessageType#RESPONSE}
 * @param correlationId    for responses, the id of the request answered (nullable)
 */
public record AgentMessage(
    String id,
    MessageType type,
    String sender,
    List<String> recipients,
    Map<String, Object> payload,
    Priority priority,
    Instant timestamp,
    boolean requiresResponse,
    String correlationId
) implements Serializable {

    public AgentMessage {
        recipients = recipients != null ? List.copyOf(recipients) : List.of();
        payload = payload != null ? Map.copyOf(payload) : Map.of();
        priority = priority != null ? priority : Priority.NORMAL;
    }

    public static AgentMessage of(MessageType type, String sender, List<String> recipients,
                                  Map<String, Object> payload) {
        return new AgentMessage(UUID.randomUUID().toString(), type, sender, recipients, payload,
                Priority.NORMAL, Instant.now(), false, null);
    }

    public static AgentMessage request(MessageType type, String sender, String recipient,
                                       Map<String, Object> payload) {
        return new AgentMessage(UUID.randomUUID().toString(), type, sender, List.of(recipient), payload,
                Priority.NORMAL, Instant.now(), true, null);
    }

    /**
     * Builds the response to this message, addressed back to its sender.
     */
    public AgentMessage reply(String from, Map<String, Object> body) {
        return new AgentMessage(UUID.randomUUID().toString(), MessageType.RESPONSE, from, List.of(sender), body,
                priority, Instant.now(), false, id);
    }

    public String payloadString(String key) {
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }
}
