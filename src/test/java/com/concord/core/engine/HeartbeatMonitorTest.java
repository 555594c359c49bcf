package com.concord.core.engine;

import com.concord.core.distribution.TaskDistributor;
import com.concord.core.messaging.BusProperties;
import com.concord.core.messaging.CommunicationBus;
import com.concord.core.messaging.ResilientMessenger;
import com.concord.core.model.AgentInstance;
import com.concord.core.model.AgentStatus;
import com.concord.core.model.TaskUnit;
import com.concord.core.registry.AgentRegistry;
import com.concord.core.resilience.ResilienceGuard;
import com.concord.core.resilience.ResilienceProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.concord.core.decision.PatternProtocol.LOAD;
import static org.junit.jupiter.api.Assertions.*;

class HeartbeatMonitorTest {

    private CommunicationBus bus;
    private AgentRegistry registry;
    private TaskDistributor distributor;
    private HeartbeatMonitor monitor;
    private final List<String> lostEvents = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        var properties = new CoordinationProperties();
        properties.getRegistry().setHeartbeatTimeout(Duration.ofMillis(100));
        bus = new CommunicationBus(new BusProperties());
        registry = new AgentRegistry(properties);
        distributor = new TaskDistributor(registry, properties);
        var messenger = new ResilientMessenger(bus, new ResilienceGuard(new ResilienceProperties()));
        monitor = new HeartbeatMonitor(registry, messenger, distributor, properties, null);
        monitor.addLostAgentListener((agentId, requeued) -> lostEvents.add(agentId + ":" + requeued));

        registry.register(new AgentInstance("live", Map.of("general", 0.9), null, 0.0, 1, 0, 0, null));
        registry.register(new AgentInstance("silent", Map.of("general", 0.9), null, 0.0, 1, 0, 0, null));
        bus.subscribe("live", m -> bus.send(m.sender(), m.reply("live", Map.of(LOAD, 0.3))));
        bus.subscribe("silent", m -> { });
    }

    @AfterEach
    void tearDown() {
        bus.shutdown();
    }

    @Test
    @DisplayName("an agent missing three rounds becomes UNREACHABLE and its tasks are requeued")
    void lostAfterThreeRounds() {
        var unit = new TaskUnit("T1", "P", "execute", "work", Set.of("general"), Duration.ofMinutes(1),
                List.of(), null);
        registry.drain("live");
        assertEquals("silent", distributor.distribute(List.of(unit), registry.snapshot()).get(0).agentId());

        var lostPerRound = new ArrayList<List<String>>();
        for (int round = 0; round < 3; round++) {
            lostPerRound.add(monitor.runRound());
        }

        assertEquals(List.of(List.of(), List.of(), List.of("silent")), lostPerRound);
        assertEquals(AgentStatus.UNREACHABLE, registry.find("silent").orElseThrow().status());
        assertEquals(List.of("silent:[T1]"), lostEvents);
        assertTrue(distributor.isPending("T1"));
        assertTrue(distributor.assignmentFor("T1").isEmpty());
    }

    @Test
    @DisplayName("replies record the reported load and keep the agent live")
    void repliesRecordLoad() {
        for (int round = 0; round < 4; round++) {
            monitor.runRound();
        }
        AgentInstance live = registry.find("live").orElseThrow();
        assertEquals(0.3, live.load(), 1e-9);
        assertEquals(0, live.missedHeartbeats());
        assertNotNull(live.lastHeartbeat());
        assertEquals(AgentStatus.AVAILABLE, live.status());
    }
}
