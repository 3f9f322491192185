package com.davisodom.townsim.action;

import com.davisodom.townsim.MutableClock;
import com.davisodom.townsim.TestWorlds;
import com.davisodom.townsim.config.SimulationConfig;
import com.davisodom.townsim.core.EventBus;
import com.davisodom.townsim.core.SimulationEvent;
import com.davisodom.townsim.core.SimulationEventType;
import com.davisodom.townsim.model.*;
import com.davisodom.townsim.world.SimCharacter;
import com.davisodom.townsim.world.WorldState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class DefaultActionExecutorTest {

    private static final long MINUTE = 60_000L;

    private WorldState world;
    private MutableClock clock;
    private List<SimulationEvent> published;
    private DefaultActionExecutor executor;

    @BeforeEach
    void setUp() {
        world = TestWorlds.threeMapWorld();
        world.addMap(TestWorlds.grid("office", 1, 2, Set.of(), Map.of())
                .addObstacle(TestWorlds.building("office-desk", 1, 0, TestWorlds.facility(FacilityTag.WORKSPACE)))
                .addObstacle(TestWorlds.building("office-sofa", 1, 1,
                        new FacilityInfo(List.of(FacilityTag.PUBLIC), 0, 0, "bob")))
                .build());
        world.setTime(new WorldTime(10, 0, 1));
        clock = new MutableClock(1_700_000_000_000L);
        EventBus events = new EventBus();
        published = new ArrayList<>();
        events.register(published::add);
        executor = new DefaultActionExecutor(world, events, new SimulationConfig(), FacilityActionMapping.defaults(),
                new FacilityLocator(), clock);
    }

    private long count(SimulationEventType type) {
        return published.stream().filter(e -> e.getType() == type).count();
    }

    @Test
    @DisplayName("Fixed action applies its effects once on completion")
    void testFixedToilet() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-2-0",
                NeedValues.full().with(NeedType.BLADDER, 8.0), 0, null);

        assertTrue(executor.startAction("alice", ActionId.TOILET, null, null, null, "urgent"));
        ActionState action = alice.getCurrentAction();
        assertEquals(ActionId.TOILET, action.actionId());
        assertEquals("town-toilet", action.facilityId());
        assertEquals(clock.millis() + 5 * MINUTE, action.targetEndTime());
        assertNull(executor.getActivePerMinuteEffects("alice"), "Fixed actions have no running rates");

        clock.advance(4 * MINUTE);
        executor.tick(clock.millis());
        assertEquals(8.0, alice.getNeed(NeedType.BLADDER), 1e-9, "Effects apply only on completion");

        clock.advance(MINUTE);
        executor.tick(clock.millis());
        assertEquals(100.0, alice.getNeed(NeedType.BLADDER), 1e-9);
        assertNull(alice.getCurrentAction());
        assertEquals(1, count(SimulationEventType.ACTION_STARTED));
        assertEquals(1, count(SimulationEventType.ACTION_COMPLETED));
    }

    @Test
    @DisplayName("An action whose completion throws still ends and reports completion")
    void testCompletionFailureStillReported() {
        WorldState failingWorld = spy(TestWorlds.threeMapWorld());
        EventBus events = new EventBus();
        List<SimulationEvent> seen = new ArrayList<>();
        events.register(seen::add, SimulationEventType.ACTION_COMPLETED);
        DefaultActionExecutor failing = new DefaultActionExecutor(failingWorld, events, new SimulationConfig(),
                FacilityActionMapping.defaults(), new FacilityLocator(), clock);
        SimCharacter alice = TestWorlds.character(failingWorld, "alice", "town", "town-2-0",
                NeedValues.full().with(NeedType.BLADDER, 8.0), 0, null);
        assertTrue(failing.startAction("alice", ActionId.TOILET, null, null, null, "urgent"));
        doThrow(new IllegalStateException("store offline")).when(failingWorld).updateNeeds(eq("alice"), any());

        clock.advance(5 * MINUTE);
        failing.tick(clock.millis());

        assertNull(alice.getCurrentAction(), "Broken action is cleared");
        assertEquals(8.0, alice.getNeed(NeedType.BLADDER), 1e-9, "Effects are skipped");
        assertEquals(1, seen.size(), "Listeners hear the action ended");
        assertEquals(ActionId.TOILET, seen.get(0).getActionId());
    }

    @Test
    @DisplayName("Facility actions need the agent at a matching facility")
    void testRequiresFacility() {
        TestWorlds.character(world, "alice", "town", "town-0-0");

        ActionCheck check = executor.canExecuteAction("alice", ActionId.TOILET, null, null);

        assertFalse(check.allowed());
        assertTrue(check.reason().contains("requires facility"));
        assertFalse(executor.startAction("alice", ActionId.TOILET, null, null, null, null));
        assertFalse(executor.canExecuteAction("alice", ActionId.TOILET, "cafe-counter", null).allowed(),
                "Naming a facility the agent is not at is refused");
    }

    @Test
    @DisplayName("Paid facilities charge their cost on start")
    void testCostAndRates() {
        SimCharacter alice = TestWorlds.character(world, "alice", "cafe", "cafe-0-2",
                NeedValues.full(), 20, null);

        assertTrue(executor.startAction("alice", ActionId.EAT, "cafe-counter", null, 500, "lunch"));

        assertEquals(15, alice.getMoney());
        assertEquals(60, alice.getCurrentAction().durationMinutes(), "Duration clamps to the range max");
        assertEquals(2.0, executor.getActivePerMinuteEffects("alice").get(NeedType.SATIETY), 1e-9);
        assertNotNull(alice.getDisplayEmoji(), "Action emoji is shown while eating");
    }

    @Test
    @DisplayName("Insufficient money is refused")
    void testNotEnoughMoney() {
        TestWorlds.character(world, "alice", "cafe", "cafe-1-2", NeedValues.full(), 3, null);

        ActionCheck check = executor.canExecuteAction("alice", ActionId.EAT, null, null);

        assertFalse(check.allowed());
        assertTrue(check.reason().contains("not enough money"));
    }

    @Test
    @DisplayName("Work pays the hourly wage during shift hours")
    void testWorkPaysWage() {
        SimCharacter alice = TestWorlds.character(world, "alice", "office", "office-0-0", NeedValues.full(), 0,
                new Employment("office-desk", "09:00", "17:00", 12));

        assertTrue(executor.startAction("alice", ActionId.WORK, "office-desk", null, 90, "shift"));
        clock.advance(90 * MINUTE);
        executor.tick(clock.millis());

        assertEquals(18, alice.getMoney(), "90 minutes at 12/hour");
        assertNull(alice.getCurrentAction());
    }

    @Test
    @DisplayName("Work outside shift hours or elsewhere is refused")
    void testWorkRules() {
        TestWorlds.character(world, "alice", "office", "office-0-0", NeedValues.full(), 0,
                new Employment("office-desk", "09:00", "17:00", 12));
        TestWorlds.character(world, "carol", "office", "office-0-0");

        assertFalse(executor.canExecuteAction("carol", ActionId.WORK, "office-desk", null).allowed(),
                "No employment");

        world.setTime(new WorldTime(18, 30, 1));
        ActionCheck check = executor.canExecuteAction("alice", ActionId.WORK, "office-desk", null);
        assertFalse(check.allowed());
        assertTrue(check.reason().contains("outside work hours"));
    }

    @Test
    @DisplayName("Owned facilities are reserved for their owner")
    void testOwnership() {
        TestWorlds.character(world, "alice", "office", "office-0-1");

        ActionCheck check = executor.canExecuteAction("alice", ActionId.REST, "office-sofa", null);

        assertFalse(check.allowed());
        assertTrue(check.reason().contains("owned by bob"));
    }

    @Test
    @DisplayName("Talk holds both sides in conversation until it ends")
    void testTalk() {
        SimCharacter alice = TestWorlds.character(world, "alice", "cafe", "cafe-1-1");
        TestWorlds.character(world, "bob", "cafe", "cafe-2-1");
        TestWorlds.npc(world, "barista", "cafe", "cafe-2-2");

        assertTrue(executor.startAction("alice", ActionId.TALK, null, "barista", 5, "chat"));
        assertTrue(alice.isInConversation());
        assertTrue(world.getNpc("barista").isInConversation());
        assertFalse(executor.canExecuteAction("bob", ActionId.TALK, null, "barista").allowed(),
                "NPC is busy");

        clock.advance(5 * MINUTE);
        executor.tick(clock.millis());

        assertFalse(alice.isInConversation());
        assertFalse(world.getNpc("barista").isInConversation());
        assertTrue(alice.getNeed(NeedType.MOOD) <= 100.0);
    }

    @Test
    @DisplayName("Talk without an NPC on the map is refused")
    void testTalkWithoutNpc() {
        TestWorlds.character(world, "alice", "town", "town-1-1");

        assertFalse(executor.canExecuteAction("alice", ActionId.TALK, null, null).allowed());
    }

    @Test
    @DisplayName("Thinking never completes on its own and stands aside for a real action")
    void testThinkingPlaceholder() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-2-0");

        assertTrue(executor.startAction("alice", ActionId.THINKING, null, null, null, "deciding"));
        assertTrue(executor.isExecutingAction("alice"));
        assertFalse(executor.startAction("alice", ActionId.THINKING, null, null, null, null),
                "Only one placeholder at a time");

        clock.advance(600 * MINUTE);
        executor.tick(clock.millis());
        assertTrue(alice.getCurrentAction().isThinking());
        assertTrue(executor.canExecuteAction("alice", ActionId.TOILET, null, null).allowed());

        executor.forceCompleteAction("alice");
        assertNull(alice.getCurrentAction());
        assertEquals(0, count(SimulationEventType.ACTION_COMPLETED), "Placeholder completion is silent");
    }

    @Test
    @DisplayName("Busy agents cannot start another action")
    void testBusyAgents() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-2-0");
        TestWorlds.character(world, "bob", "town", "town-2-1");

        executor.startAction("alice", ActionId.TOILET, null, null, null, null);
        ActionCheck check = executor.canExecuteAction("alice", ActionId.TOILET, null, null);
        assertFalse(check.allowed());
        assertTrue(check.reason().startsWith("already executing"));

        world.startNavigation("bob", List.of("town-2-1", "town-2-2"), new Position(0, 0), new Position(32, 0));
        assertEquals("navigating", executor.canExecuteAction("bob", ActionId.TOILET, null, null).reason());

        assertEquals("character not found", executor.canExecuteAction("nobody", ActionId.REST, null, null).reason());
        assertNotNull(alice.getCurrentAction());
    }

    @Test
    @DisplayName("Force completion applies effects immediately")
    void testForceComplete() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-2-1",
                NeedValues.full().with(NeedType.BLADDER, 20.0), 0, null);
        executor.startAction("alice", ActionId.TOILET, null, null, null, null);

        executor.forceCompleteAction("alice");

        assertEquals(100.0, alice.getNeed(NeedType.BLADDER), 1e-9);
        assertFalse(executor.isExecutingAction("alice"));
        assertEquals(1, count(SimulationEventType.ACTION_COMPLETED));
    }

    @Test
    @DisplayName("Available actions reflect the agent's facility")
    void testAvailableActions() {
        TestWorlds.character(world, "alice", "town", "town-2-0");

        List<ActionId> available = executor.getAvailableActions("alice");

        assertTrue(available.contains(ActionId.TOILET));
        assertFalse(available.contains(ActionId.SLEEP));
        assertFalse(available.contains(ActionId.TALK));
        assertFalse(available.contains(ActionId.THINKING));
        assertEquals("town-toilet", executor.getCurrentFacility("alice").getId());
    }
}
