package com.davisodom.townsim.navigation;

import com.davisodom.townsim.DebugFlags;
import com.davisodom.townsim.TestWorlds;
import com.davisodom.townsim.config.SimulationConfig;
import com.davisodom.townsim.core.EventBus;
import com.davisodom.townsim.core.SimulationEvent;
import com.davisodom.townsim.core.SimulationEventType;
import com.davisodom.townsim.model.TransitionState;
import com.davisodom.townsim.world.SimCharacter;
import com.davisodom.townsim.world.WorldState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class NavigationStateMachineTest {

    private static final double DT = 0.1;

    private WorldState world;
    private EventBus events;
    private List<SimulationEvent> published;
    private NavigationStateMachine navigation;

    @BeforeEach
    void setUp() {
        world = TestWorlds.threeMapWorld();
        events = new EventBus();
        published = new ArrayList<>();
        events.register(published::add);
        Pathfinder pathfinder = new Pathfinder();
        navigation = new NavigationStateMachine(world, pathfinder, new CrossMapRouter(pathfinder), events,
                new SimulationConfig.Movement(), DebugFlags.disabled());
    }

    private int tickUntilIdle(String agentId) {
        int ticks = 0;
        while (navigation.isNavigating(agentId)) {
            navigation.tick(DT);
            ticks++;
            assertTrue(ticks < 500, "Navigation should finish");
        }
        return ticks;
    }

    private long count(SimulationEventType type) {
        return published.stream().filter(e -> e.getType() == type).count();
    }

    @Test
    @DisplayName("Walks a same-map path node by node")
    void testSameMapWalk() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-0-0");

        assertTrue(navigation.navigateToNode("alice", "town-2-2"));
        assertTrue(alice.isNavigating());
        assertEquals(1, count(SimulationEventType.NAVIGATION_STARTED));

        navigation.tick(DT);
        assertTrue(alice.getNavigation().progress() > 0.0, "First tick should make progress");
        assertEquals("town-0-0", alice.getCurrentNodeId(), "Node changes only on arrival");

        tickUntilIdle("alice");

        assertEquals("town-2-2", alice.getCurrentNodeId());
        assertEquals(world.getMap("town").getNode("town-2-2").position(), alice.getPosition());
        assertFalse(alice.getNavigation().moving());
        assertEquals(1, count(SimulationEventType.NAVIGATION_COMPLETED));
    }

    @Test
    @DisplayName("Cross-map trip fades out, changes map, fades in and completes once")
    void testCrossMapTrip() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-1-1");

        assertTrue(navigation.navigateToMap("alice", "cafe", "cafe-1-1"));
        assertTrue(alice.getCrossMapNavigation().active());

        boolean sawFadeOut = false;
        boolean sawFadeIn = false;
        int ticks = 0;
        while (navigation.isNavigating("alice")) {
            navigation.tick(DT);
            TransitionState transition = alice.getTransition();
            if (transition != null) {
                if (transition.phase() == TransitionState.Phase.FADE_OUT) {
                    sawFadeOut = true;
                    assertEquals("town", alice.getCurrentMapId(), "Map changes only after fade out");
                } else {
                    sawFadeIn = true;
                    assertEquals("cafe", alice.getCurrentMapId());
                }
            }
            assertTrue(++ticks < 500, "Trip should finish");
        }

        assertTrue(sawFadeOut, "Should fade out at the exit entrance");
        assertTrue(sawFadeIn, "Should fade in on the new map");
        assertEquals("cafe", alice.getCurrentMapId());
        assertEquals("cafe-1-1", alice.getCurrentNodeId());
        assertFalse(alice.getCrossMapNavigation().active());
        assertNull(alice.getTransition());
        assertEquals(1, count(SimulationEventType.MAP_TRANSITION_STARTED));
        assertEquals(1, count(SimulationEventType.MAP_CHANGED));
        assertEquals(1, count(SimulationEventType.NAVIGATION_COMPLETED),
                "Completion is reported once per trip, not per segment");
    }

    @Test
    @DisplayName("Trip ending on the entry node completes after the fade in")
    void testCrossMapTripToEntryNode() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-1-1");

        assertTrue(navigation.navigateToMap("alice", "cafe", "cafe-1-0"));
        tickUntilIdle("alice");

        assertEquals("cafe", alice.getCurrentMapId());
        assertEquals("cafe-1-0", alice.getCurrentNodeId());
        assertFalse(alice.getCrossMapNavigation().active());
        assertEquals(1, count(SimulationEventType.NAVIGATION_COMPLETED));
        SimulationEvent completed = published.stream()
                .filter(e -> e.getType() == SimulationEventType.NAVIGATION_COMPLETED)
                .findFirst().orElseThrow();
        assertEquals("cafe", completed.getMapId());
        assertEquals("cafe-1-0", completed.getNodeId());
    }

    @Test
    @DisplayName("Two hop trip crosses both entrances")
    void testTwoHopTrip() {
        SimCharacter alice = TestWorlds.character(world, "alice", "home", "home-0-1");

        assertTrue(navigation.navigateToMap("alice", "cafe", "cafe-2-2"));
        tickUntilIdle("alice");

        assertEquals("cafe", alice.getCurrentMapId());
        assertEquals("cafe-2-2", alice.getCurrentNodeId());
        List<String> mapChanges = published.stream()
                .filter(e -> e.getType() == SimulationEventType.MAP_CHANGED)
                .map(SimulationEvent::getMapId)
                .collect(Collectors.toList());
        assertEquals(List.of("town", "cafe"), mapChanges);
        assertEquals(1, count(SimulationEventType.NAVIGATION_COMPLETED));
    }

    @Test
    @DisplayName("Walking onto a linked entrance transitions to the linked map")
    void testLocalWalkOntoEntrance() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-1-1");

        assertTrue(navigation.navigateToNode("alice", "town-1-0"));
        tickUntilIdle("alice");

        assertEquals("home", alice.getCurrentMapId());
        assertEquals("home-0-0", alice.getCurrentNodeId());
        assertEquals(1, count(SimulationEventType.NAVIGATION_COMPLETED));
    }

    @Test
    @DisplayName("Paths avoid nodes occupied by NPCs")
    void testAvoidsNpcNodes() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-0-1");
        TestWorlds.npc(world, "mayor", "town", "town-1-1");

        assertTrue(navigation.navigateToNode("alice", "town-2-1"));
        assertFalse(alice.getNavigation().path().contains("town-1-1"));
        assertEquals(5, alice.getNavigation().path().size());

        assertFalse(navigation.navigateToNode("alice", "town-1-1"), "Already navigating");
    }

    @Test
    @DisplayName("Commands that cannot move the agent are refused")
    void testRefusedCommands() {
        TestWorlds.character(world, "alice", "town", "town-1-1");
        TestWorlds.npc(world, "mayor", "town", "town-2-2");

        assertFalse(navigation.navigateToNode("nobody", "town-0-0"), "Unknown agent");
        assertFalse(navigation.navigateToNode("alice", "town-9-9"), "Unknown node");
        assertFalse(navigation.navigateToNode("alice", "town-1-1"), "Already there");
        assertFalse(navigation.navigateToNode("alice", "town-2-2"), "Destination occupied");
        assertFalse(navigation.navigateToMap("alice", "moon", "moon-0-0"), "Unknown map");
        assertFalse(navigation.isNavigating("alice"));
        assertEquals(0, count(SimulationEventType.NAVIGATION_STARTED));
    }

    @Test
    @DisplayName("Navigating set tracks agents in motion")
    void testNavigatingAgents() {
        TestWorlds.character(world, "alice", "town", "town-0-0");
        TestWorlds.character(world, "bob", "town", "town-2-2");

        navigation.navigateToNode("alice", "town-0-2");

        assertEquals(List.of("alice"), new ArrayList<>(navigation.getNavigatingAgents()));
        List<String> completed = new ArrayList<>();
        while (navigation.isNavigating("alice")) {
            completed.addAll(navigation.tick(DT));
        }
        assertEquals(List.of("alice"), completed);
        assertTrue(navigation.getNavigatingAgents().isEmpty());
    }
}
