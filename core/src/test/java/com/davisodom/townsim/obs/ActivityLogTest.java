package com.davisodom.townsim.obs;

import com.davisodom.townsim.core.EventBus;
import com.davisodom.townsim.core.SimulationEvent;
import com.davisodom.townsim.model.ActionId;
import com.davisodom.townsim.model.WorldTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ActivityLogTest {

    private EventBus events;
    private ActivityLog log;

    @BeforeEach
    void setUp() {
        events = new EventBus();
        log = new ActivityLog(3, () -> new WorldTime(9, 5, 2), () -> 1234L);
        log.attach(events);
    }

    @Test
    @DisplayName("Events become timestamped entries")
    void testEntriesFromEvents() {
        events.publish(SimulationEvent.actionStarted("alice", ActionId.EAT, "cafe-counter"));
        events.publish(SimulationEvent.navigationStarted("bob", "town", "town-2-2"));

        List<ActivityLog.Entry> entries = log.getEntries();
        assertEquals(2, entries.size());
        assertEquals(new ActivityLog.Entry(1234L, 2, "09:05", "alice", ActivityLog.Type.ACTION_STARTED,
                "eat @ cafe-counter"), entries.get(0));
        assertEquals("town/town-2-2", entries.get(1).detail());
        assertEquals(1, log.getEntries("bob").size());
    }

    @Test
    @DisplayName("Thinking placeholders and unrelated events are not logged")
    void testIgnored() {
        events.publish(SimulationEvent.actionStarted("alice", ActionId.THINKING, null));
        events.publish(SimulationEvent.dayChanged(3));
        events.publish(SimulationEvent.decisionApplied("alice", "idle"));

        assertEquals(0, log.size());
    }

    @Test
    @DisplayName("Oldest entries are dropped past capacity")
    void testCapacity() {
        for (int i = 0; i < 5; i++) {
            log.record("alice", ActivityLog.Type.MOVE, "step " + i);
        }

        assertEquals(3, log.size());
        assertEquals("step 2", log.getEntries().get(0).detail());
    }

    @Test
    @DisplayName("Listeners see each entry and a failing one is contained")
    void testListeners() {
        List<ActivityLog.Entry> seen = new ArrayList<>();
        log.addListener(entry -> {
            throw new IllegalStateException("listener bug");
        });
        ActivityLog.Listener recorder = seen::add;
        log.addListener(recorder);

        events.publish(SimulationEvent.mapChanged("alice", "cafe", "cafe-1-0"));
        assertEquals(1, seen.size());
        assertEquals(ActivityLog.Type.MAP_CHANGED, seen.get(0).type());

        assertTrue(log.removeListener(recorder));
        log.record("alice", ActivityLog.Type.MOVE, "x");
        assertEquals(1, seen.size());
    }

    @Test
    @DisplayName("Capacity must be positive")
    void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ActivityLog(0, () -> null, () -> 0L));
    }
}
