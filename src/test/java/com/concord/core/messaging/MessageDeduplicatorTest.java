package com.concord.core.messaging;

import com.concord.core.model.AgentMessage;
import com.concord.core.model.MessageType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessageDeduplicatorTest {

    @Test
    @DisplayName("remembers processed ids and the reply sent for each")
    void remembersReplies() {
        var dedup = new MessageDeduplicator(10);
        AgentMessage request = AgentMessage.request(MessageType.REQUEST, "coordinator", "a", Map.of());
        AgentMessage reply = request.reply("a", Map.of("ok", true));

        assertFalse(dedup.isDuplicate(request.id()));
        dedup.markProcessed(request.id(), reply);
        assertTrue(dedup.isDuplicate(request.id()));
        assertEquals(reply, dedup.replyFor(request.id()).orElseThrow());
    }

    @Test
    @DisplayName("a message processed without reply is a duplicate with no reply")
    void noReply() {
        var dedup = new MessageDeduplicator(10);
        dedup.markProcessed("m1", null);
        assertTrue(dedup.isDuplicate("m1"));
        assertTrue(dedup.replyFor("m1").isEmpty());
    }

    @Test
    @DisplayName("holds no more ids than the window and keeps the latest one")
    void boundedWindow() {
        var dedup = new MessageDeduplicator(2);
        dedup.markProcessed("m1", null);
        dedup.markProcessed("m2", null);
        AgentMessage reply = AgentMessage.of(MessageType.STATUS, "a", List.of("b"), Map.of());
        dedup.markProcessed("m3", reply);

        assertEquals(2, dedup.size());
        assertTrue(dedup.isDuplicate("m3"));
        assertEquals(reply, dedup.replyFor("m3").orElseThrow());
    }

    @Test
    @DisplayName("a long stream of messages never grows past the window")
    void longStream() {
        var dedup = new MessageDeduplicator(100);
        for (int i = 0; i < 5_000; i++) {
            dedup.markProcessed("m" + i, null);
        }
        assertTrue(dedup.size() <= 100);
        assertTrue(dedup.isDuplicate("m4999"));
    }
}
