package com.concord.core.messaging;

import com.concord.core.error.AgentUnavailableException;
import com.concord.core.error.MessageTimeoutException;
import com.concord.core.model.AgentMessage;
import com.concord.core.model.MessageType;
import com.concord.core.resilience.ResilienceGuard;
import com.concord.core.resilience.ResilienceProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ResilientMessengerTest {

    private CommunicationBus bus;
    private ResilientMessenger messenger;

    @BeforeEach
    void setUp() {
        var busProperties = new BusProperties();
        busProperties.setSendTimeout(Duration.ofMillis(100));
        bus = new CommunicationBus(busProperties);

        var resilience = new ResilienceProperties();
        resilience.getRetry().setMaxAttempts(3);
        resilience.getRetry().setInitialBackoff(Duration.ofMillis(50));
        messenger = new ResilientMessenger(bus, new ResilienceGuard(resilience));
    }

    @AfterEach
    void tearDown() {
        bus.shutdown();
    }

    private static AgentMessage ask(String to) {
        return AgentMessage.request(MessageType.REQUEST, CommunicationBus.COORDINATOR, to, Map.of("q", 1));
    }

    @Nested
    @DisplayName("Request timeout")
    class TimeoutTests {

        @Test
        @DisplayName("a silent agent is asked once and the caller waits no longer than the timeout")
        void silentAgentAskedOnce() {
            var deliveries = new AtomicInteger();
            bus.subscribe("quiet", m -> deliveries.incrementAndGet());
            long start = System.nanoTime();

            assertThrows(MessageTimeoutException.class,
                    () -> messenger.request("quiet", ask("quiet"), Duration.ofMillis(300)));

            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            assertTrue(elapsedMs >= 250, "elapsed: " + elapsedMs);
            assertTrue(elapsedMs < 700, "elapsed: " + elapsedMs);
            assertEquals(1, deliveries.get());
            assertEquals(0, bus.pendingRequests());
        }

        @Test
        @DisplayName("a failed delivery is retried and succeeds once the agent is back")
        void undeliveredIsRetried() throws InterruptedException {
            var subscriber = new Thread(() -> {
                try {
                    Thread.sleep(5);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                bus.subscribe("late", m -> bus.send(m.sender(), m.reply("late", Map.of("ok", true))));
            });
            subscriber.start();

            AgentMessage reply = messenger.request("late", ask("late"), Duration.ofSeconds(2));

            subscriber.join();
            assertEquals(Boolean.TRUE, reply.payload().get("ok"));
        }

        @Test
        @DisplayName("an agent that never subscribes fails with AgentUnavailableException")
        void unreachable() {
            assertThrows(AgentUnavailableException.class,
                    () -> messenger.request("nobody", ask("nobody"), Duration.ofMillis(500)));
        }

        @Test
        @DisplayName("a reply within the timeout is returned")
        void replyReturned() {
            bus.subscribe("echo", m -> bus.send(m.sender(), m.reply("echo", Map.of("ok", true))));

            AgentMessage reply = messenger.request("echo", ask("echo"), Duration.ofSeconds(2));

            assertEquals(MessageType.RESPONSE, reply.type());
            assertEquals(Boolean.TRUE, reply.payload().get("ok"));
        }
    }
}
