package com.davisodom.townsim.behavior;

import com.davisodom.townsim.DebugFlags;
import com.davisodom.townsim.MutableClock;
import com.davisodom.townsim.TestWorlds;
import com.davisodom.townsim.action.ActionExecutor;
import com.davisodom.townsim.action.DefaultActionExecutor;
import com.davisodom.townsim.action.FacilityActionMapping;
import com.davisodom.townsim.action.FacilityLocator;
import com.davisodom.townsim.config.SimulationConfig;
import com.davisodom.townsim.core.EventBus;
import com.davisodom.townsim.core.SimulationEvent;
import com.davisodom.townsim.model.*;
import com.davisodom.townsim.navigation.CrossMapRouter;
import com.davisodom.townsim.navigation.NavigationStateMachine;
import com.davisodom.townsim.navigation.Pathfinder;
import com.davisodom.townsim.obs.Metrics;
import com.davisodom.townsim.persistence.AsyncStore;
import com.davisodom.townsim.world.SimCharacter;
import com.davisodom.townsim.world.WorldState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BehaviorOrchestratorTest {

    @Mock
    private BehaviorDecider decider;

    private WorldState world;
    private EventBus events;
    private MutableClock clock;
    private SimulationConfig config;
    private Metrics metrics;
    private ScheduleManager schedules;
    private ActionHistory history;
    private NavigationStateMachine navigation;
    private BehaviorOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        world = TestWorlds.threeMapWorld();
        world.setTime(new WorldTime(12, 0, 1));
        events = new EventBus();
        clock = new MutableClock(1_700_000_000_000L);
        config = new SimulationConfig();
        metrics = new Metrics(Logger.getLogger("test"));
        AsyncStore store = AsyncStore.disabled(metrics);
        schedules = new ScheduleManager(Map.of(), store);
        history = new ActionHistory(store);

        FacilityLocator locator = new FacilityLocator();
        DebugFlags debug = DebugFlags.disabled();
        DefaultActionExecutor actions = new DefaultActionExecutor(world, events, config,
                FacilityActionMapping.defaults(), locator, clock);
        Pathfinder pathfinder = new Pathfinder();
        navigation = new NavigationStateMachine(world, pathfinder, new CrossMapRouter(pathfinder), events,
                config.movement, debug);
        BehaviorContextBuilder contextBuilder = new BehaviorContextBuilder(world, actions, schedules, history, 10);
        orchestrator = new BehaviorOrchestrator(world, actions, navigation, decider, contextBuilder, schedules,
                history, config, locator, metrics, clock, new Random(42), debug);
        orchestrator.attach(events);
    }

    private static CompletableFuture<BehaviorDecision> done(BehaviorDecision decision) {
        return CompletableFuture.completedFuture(decision);
    }

    /**
     * Tick navigation, pending actions and decisions until the condition holds.
     */
    private void runUntil(BooleanSupplier condition) {
        for (int i = 0; i < 500 && !condition.getAsBoolean(); i++) {
            navigation.tick(0.1);
            orchestrator.resolvePendingActions();
            orchestrator.tick(clock.millis());
        }
        assertTrue(condition.getAsBoolean(), "Condition should be reached");
    }

    @Test
    @DisplayName("Only one decision is in flight per agent")
    void testSingleFlight() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-1-1");
        when(decider.decide(any())).thenReturn(new CompletableFuture<>());

        assertTrue(orchestrator.requestDecision("alice"));
        assertFalse(orchestrator.requestDecision("alice"), "Second request must be refused");

        verify(decider, times(1)).decide(any());
        assertTrue(orchestrator.isDecisionPending("alice"));
        assertEquals(1, orchestrator.getPendingDecisionCount());
        assertNotNull(orchestrator.getInFlightDecision("alice"));
        assertTrue(alice.getCurrentAction().isThinking(), "Agent shows the thinking placeholder");
        assertEquals(1, metrics.getCounter("decisions.requested"));
    }

    @Test
    @DisplayName("Resolved decisions apply on the next tick")
    void testDecisionAppliedOnTick() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-2-0");
        when(decider.decide(any())).thenReturn(done(BehaviorDecision.action(ActionId.TOILET, "town-toilet", null, "need to go")));

        orchestrator.requestDecision("alice");
        assertTrue(alice.getCurrentAction().isThinking(), "Nothing applies before the tick");

        orchestrator.tick(clock.millis());

        assertEquals(ActionId.TOILET, alice.getCurrentAction().actionId());
        assertFalse(orchestrator.isDecisionPending("alice"));
        assertNull(orchestrator.getInFlightDecision("alice"));
        assertEquals(1, metrics.getCounter("decisions.applied"));
        List<ActionHistoryEntry> recent = history.recent("alice", 1, 10);
        assertEquals(1, recent.size());
        assertEquals(ActionId.TOILET, recent.get(0).actionId());
        assertEquals("need to go", recent.get(0).reason());
    }

    @Test
    @DisplayName("A decision for an agent that got busy is discarded")
    void testStaleDecisionDiscarded() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-1-1");
        CompletableFuture<BehaviorDecision> future = new CompletableFuture<>();
        when(decider.decide(any())).thenReturn(future);

        orchestrator.requestDecision("alice");
        assertTrue(navigation.navigateToNode("alice", "town-0-0"));
        future.complete(BehaviorDecision.action(ActionId.REST, null, null, "late"));
        orchestrator.tick(clock.millis());

        assertNull(alice.getCurrentAction());
        assertTrue(alice.isNavigating());
        assertEquals(1, metrics.getCounter("decisions.discarded"));
        assertEquals(0, metrics.getCounter("decisions.applied"));
        assertFalse(orchestrator.isDecisionPending("alice"));
    }

    @Test
    @DisplayName("Decider failures are counted and not retried")
    void testFailureNotRetried() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-1-1");
        when(decider.decide(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("offline")));

        orchestrator.requestDecision("alice");
        orchestrator.tick(clock.millis());
        clock.advance(60_000);
        orchestrator.tick(clock.millis());

        assertEquals(1, metrics.getCounter("decisions.failed"));
        assertFalse(orchestrator.hasScheduledDecision("alice"));
        assertFalse(orchestrator.isDecisionPending("alice"));
        assertNull(alice.getCurrentAction(), "Placeholder is cleared");
        verify(decider, times(1)).decide(any());
    }

    @Test
    @DisplayName("A decider that throws is treated as a failed decision")
    void testSynchronousThrow() {
        TestWorlds.character(world, "alice", "town", "town-1-1");
        when(decider.decide(any())).thenThrow(new RuntimeException("boom"));

        assertTrue(orchestrator.requestDecision("alice"));
        orchestrator.tick(clock.millis());

        assertEquals(1, metrics.getCounter("decisions.failed"));
        assertFalse(orchestrator.isDecisionPending("alice"));
    }

    @Test
    @DisplayName("Interrupt asks only for a facility for the forced action")
    void testInterrupt() {
        TestWorlds.character(world, "alice", "town", "town-0-0");
        when(decider.decideInterruptFacility(eq(ActionId.TOILET), any()))
                .thenReturn(done(BehaviorDecision.action(ActionId.TOILET, "town-toilet", null, "urgent")));

        events.publish(SimulationEvent.needThresholdCrossed("alice", NeedType.BLADDER));

        ArgumentCaptor<BehaviorContext> context = ArgumentCaptor.forClass(BehaviorContext.class);
        verify(decider).decideInterruptFacility(eq(ActionId.TOILET), context.capture());
        verify(decider, never()).decide(any());
        assertEquals(ActionId.TOILET, context.getValue().forcedAction());
        assertTrue(context.getValue().isInterrupt());
        assertEquals(1, metrics.getCounter("interrupts.fired"));

        orchestrator.tick(clock.millis());
        assertNotNull(world.getCharacter("alice").getPendingAction());
        assertFalse(orchestrator.triggerInterrupt("alice", NeedType.MOOD), "Mood never interrupts");
    }

    @Test
    @DisplayName("Interrupts are skipped while the agent is busy")
    void testInterruptSkippedWhenBusy() {
        TestWorlds.character(world, "alice", "town", "town-0-0");
        navigation.navigateToNode("alice", "town-0-2");

        assertFalse(orchestrator.triggerInterrupt("alice", NeedType.BLADDER));
        verifyNoInteractions(decider);
        assertEquals(0, metrics.getCounter("interrupts.fired"));
    }

    @Test
    @DisplayName("Facility decision walks there and starts the action on arrival")
    void testFacilityNavigationThenPendingAction() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-0-0");
        when(decider.decide(any())).thenReturn(done(BehaviorDecision.action(ActionId.TOILET, "town-toilet", null, "later")));

        orchestrator.requestDecision("alice");
        orchestrator.tick(clock.millis());

        PendingAction pending = alice.getPendingAction();
        assertNotNull(pending);
        assertEquals(ActionId.TOILET, pending.actionId());
        assertEquals("town-toilet", pending.facilityId());
        assertTrue(alice.isNavigating());

        runUntil(() -> alice.getCurrentAction() != null);

        assertEquals(ActionId.TOILET, alice.getCurrentAction().actionId());
        assertEquals("town-2-0", alice.getCurrentNodeId());
        assertNull(alice.getPendingAction());
        verify(decider, times(1)).decide(any());
    }

    @Test
    @DisplayName("Facility on another map is reached through a cross-map trip")
    void testCrossMapFacility() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-1-1");
        when(decider.decide(any())).thenReturn(done(BehaviorDecision.action(ActionId.EAT, "cafe-counter", 20, "lunch")));

        orchestrator.requestDecision("alice");
        orchestrator.tick(clock.millis());
        assertEquals("cafe", alice.getPendingAction().facilityMapId());

        runUntil(() -> alice.getCurrentAction() != null);

        assertEquals("cafe", alice.getCurrentMapId());
        assertEquals(ActionId.EAT, alice.getCurrentAction().actionId());
        assertEquals(20, alice.getCurrentAction().durationMinutes());
        assertEquals(95, alice.getMoney(), "Cafe charges 5");
    }

    @Test
    @DisplayName("Unknown facility schedules a re-decision")
    void testUnknownFacility() {
        TestWorlds.character(world, "alice", "town", "town-1-1");
        when(decider.decide(any())).thenReturn(
                done(BehaviorDecision.action(ActionId.EAT, "nowhere", null, "hungry")),
                new CompletableFuture<>());

        orchestrator.requestDecision("alice");
        orchestrator.tick(clock.millis());
        assertTrue(orchestrator.hasScheduledDecision("alice"));

        clock.advance(config.behavior.redecisionDelayMs);
        orchestrator.tick(clock.millis());
        verify(decider, times(2)).decide(any());
    }

    @Test
    @DisplayName("Talk with an adjacent NPC starts at once")
    void testTalkAdjacent() {
        SimCharacter alice = TestWorlds.character(world, "alice", "cafe", "cafe-2-1");
        TestWorlds.npc(world, "barista", "cafe", "cafe-2-2");
        when(decider.decide(any())).thenReturn(done(BehaviorDecision.talk("barista", "say hi")));

        orchestrator.requestDecision("alice");
        orchestrator.tick(clock.millis());

        assertEquals(ActionId.TALK, alice.getCurrentAction().actionId());
        assertEquals("barista", alice.getCurrentAction().targetNpcId());
        assertTrue(world.getNpc("barista").isInConversation());
    }

    @Test
    @DisplayName("Talk with a distant NPC walks to a free neighbor first")
    void testTalkWalksToNpc() {
        SimCharacter alice = TestWorlds.character(world, "alice", "cafe", "cafe-0-0");
        TestWorlds.npc(world, "barista", "cafe", "cafe-2-2");
        when(decider.decide(any())).thenReturn(done(BehaviorDecision.talk("barista", "say hi")));

        orchestrator.requestDecision("alice");
        orchestrator.tick(clock.millis());
        assertEquals("barista", alice.getPendingAction().targetNpcId());

        runUntil(() -> alice.getCurrentAction() != null);

        assertEquals(ActionId.TALK, alice.getCurrentAction().actionId());
        assertTrue(world.getMap("cafe").getNode("cafe-2-2").getConnectedTo().contains(alice.getCurrentNodeId()));
        assertTrue(alice.isInConversation());
    }

    @Test
    @DisplayName("Talk with an NPC on another map is re-decided")
    void testTalkOtherMap() {
        TestWorlds.character(world, "alice", "town", "town-1-1");
        TestWorlds.npc(world, "barista", "cafe", "cafe-2-2");
        when(decider.decide(any())).thenReturn(done(BehaviorDecision.talk("barista", "say hi")));

        orchestrator.requestDecision("alice");
        orchestrator.tick(clock.millis());

        assertNull(world.getCharacter("alice").getCurrentAction());
        assertTrue(orchestrator.hasScheduledDecision("alice"));
    }

    @Test
    @DisplayName("Idle decision retries after the idle delay")
    void testIdleRetry() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-1-1");
        when(decider.decide(any())).thenReturn(done(BehaviorDecision.idle("nothing to do")));

        orchestrator.requestDecision("alice");
        orchestrator.tick(clock.millis());

        assertEquals(config.behavior.idleEmoji, alice.getDisplayEmoji());
        assertTrue(orchestrator.hasScheduledDecision("alice"));
        clock.advance(config.behavior.idleRetryMs - 1);
        orchestrator.tick(clock.millis());
        verify(decider, times(1)).decide(any());

        clock.advance(1);
        orchestrator.tick(clock.millis());
        verify(decider, times(2)).decide(any());

        orchestrator.tick(clock.millis());
        assertEquals(1, history.recent("alice", 1, 10).size(), "Repeated idles collapse");
    }

    @Test
    @DisplayName("Interrupt with no facility sends the agent to the safe map")
    void testInterruptIdleGoesToSafeMap() {
        SimCharacter alice = TestWorlds.character(world, "alice", "cafe", "cafe-1-1");
        when(decider.decideInterruptFacility(eq(ActionId.SLEEP), any()))
                .thenReturn(done(BehaviorDecision.idle("no bed")));

        orchestrator.triggerInterrupt("alice", NeedType.ENERGY);
        orchestrator.tick(clock.millis());

        assertTrue(alice.isNavigating());
        assertEquals("home", alice.getCrossMapNavigation().targetMapId());
        assertFalse(orchestrator.hasScheduledDecision("alice"));
    }

    @Test
    @DisplayName("Interrupt with no facility on the safe map retries later")
    void testInterruptIdleOnSafeMap() {
        SimCharacter alice = TestWorlds.character(world, "alice", "home", "home-0-1");
        when(decider.decideInterruptFacility(eq(ActionId.TOILET), any()))
                .thenReturn(done(BehaviorDecision.idle("no toilet")));

        orchestrator.triggerInterrupt("alice", NeedType.BLADDER);
        orchestrator.tick(clock.millis());

        assertFalse(alice.isNavigating());
        assertTrue(orchestrator.hasScheduledDecision("alice"));
    }

    @Test
    @DisplayName("Move decision navigates to the map's spawn node")
    void testMoveDecision() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-1-1");
        when(decider.decide(any())).thenReturn(done(BehaviorDecision.move("home", null, "go home")));

        orchestrator.requestDecision("alice");
        orchestrator.tick(clock.millis());

        assertTrue(alice.isNavigating());
        List<ActionHistoryEntry> recent = history.recent("alice", 1, 10);
        assertEquals(ActionHistoryEntry.Kind.MOVE, recent.get(0).kind());
        assertEquals("home:home-0-1", recent.get(0).target());
    }

    @Test
    @DisplayName("Impossible move retries after the move delay")
    void testMoveFailure() {
        TestWorlds.character(world, "alice", "town", "town-1-1");
        when(decider.decide(any())).thenReturn(done(BehaviorDecision.move("moon", "moon-0-0", "explore")));

        orchestrator.requestDecision("alice");
        orchestrator.tick(clock.millis());

        assertTrue(orchestrator.hasScheduledDecision("alice"));
    }

    @Test
    @DisplayName("Arrival without a pending action asks for the next decision")
    void testNavigationCompleteTriggersDecision() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-1-1");
        when(decider.decide(any())).thenReturn(
                done(BehaviorDecision.move(null, "town-0-1", "stroll")),
                new CompletableFuture<>());

        orchestrator.requestDecision("alice");
        orchestrator.tick(clock.millis());
        runUntil(() -> !alice.isNavigating());

        verify(decider, times(2)).decide(any());
    }

    @Test
    @DisplayName("Every few completed actions the agent wanders instead of deciding")
    void testWander() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-1-1");
        world.setActionCounter("alice", config.behavior.wanderEveryActions - 1);

        orchestrator.onActionComplete("alice", ActionId.EAT);

        assertTrue(alice.isNavigating());
        assertEquals(0, alice.getActionCounter());
        assertEquals(1, metrics.getCounter("wander.started"));
        verify(decider, never()).decide(any());
        assertEquals("wandering", history.recent("alice", 1, 10).get(0).reason());
    }

    @Test
    @DisplayName("Low needs skip wandering")
    void testNoWanderWhenNeedsLow() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-1-1",
                NeedValues.full().with(NeedType.HYGIENE, 5.0), 0, null);
        world.setActionCounter("alice", config.behavior.wanderEveryActions - 1);
        when(decider.decide(any())).thenReturn(new CompletableFuture<>());

        orchestrator.onActionComplete("alice", ActionId.EAT);

        assertEquals(config.behavior.wanderEveryActions, alice.getActionCounter());
        assertEquals(0, metrics.getCounter("wander.started"));
        verify(decider).decide(any());
    }

    @Test
    @DisplayName("Low mood alone does not stop wandering")
    void testWanderWithLowMood() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-1-1",
                NeedValues.full().with(NeedType.MOOD, 5.0), 0, null);
        world.setActionCounter("alice", config.behavior.wanderEveryActions - 1);

        orchestrator.onActionComplete("alice", ActionId.EAT);

        assertTrue(alice.isNavigating(), "Mood never interrupts, so it never holds the agent back");
        assertEquals(0, alice.getActionCounter());
        assertEquals(1, metrics.getCounter("wander.started"));
        verify(decider, never()).decide(any());
    }

    @Test
    @DisplayName("Action counter stops at the wander count while needs are low")
    void testActionCounterCapped() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-1-1",
                NeedValues.full().with(NeedType.SATIETY, 5.0), 0, null);
        world.setActionCounter("alice", config.behavior.wanderEveryActions - 1);
        when(decider.decide(any())).thenReturn(new CompletableFuture<>());

        for (int i = 0; i < 5; i++) {
            orchestrator.onActionComplete("alice", ActionId.REST);
        }

        assertEquals(config.behavior.wanderEveryActions, alice.getActionCounter());
        assertEquals(0, metrics.getCounter("wander.started"));
    }

    @Test
    @DisplayName("A pending action whose start throws schedules a re-decision")
    void testPendingActionStartThrows() {
        ActionExecutor failing = mock(ActionExecutor.class);
        when(failing.startAction(any(), any(), any(), any(), any(), any()))
                .thenThrow(new IllegalStateException("facility vanished"));
        BehaviorOrchestrator failingOrchestrator = new BehaviorOrchestrator(world, failing, navigation, decider,
                new BehaviorContextBuilder(world, failing, schedules, history, 10), schedules, history, config,
                new FacilityLocator(), metrics, clock, new Random(42), DebugFlags.disabled());
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-2-0");
        world.setPendingAction("alice", PendingAction.forFacility(ActionId.TOILET, "town-toilet", "town", "urgent", null));

        failingOrchestrator.resolvePendingActions();

        assertNull(alice.getPendingAction(), "Failed intent is dropped");
        assertTrue(failingOrchestrator.hasScheduledDecision("alice"), "Agent must not be left inert");
    }

    @Test
    @DisplayName("Completed actions below the wander count ask for a decision")
    void testActionCompleteCounts() {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-1-1");
        when(decider.decide(any())).thenReturn(new CompletableFuture<>());

        orchestrator.onActionComplete("alice", ActionId.REST);
        orchestrator.onActionComplete("alice", ActionId.THINKING);

        assertEquals(1, alice.getActionCounter(), "Thinking does not count");
        verify(decider, times(1)).decide(any());
    }

    @Test
    @DisplayName("Initial decisions go to idle characters only")
    void testInitialDecisions() {
        TestWorlds.character(world, "alice", "town", "town-1-1");
        TestWorlds.character(world, "bob", "town", "town-0-0");
        navigation.navigateToNode("bob", "town-0-2");
        when(decider.decide(any())).thenReturn(new CompletableFuture<>());

        assertEquals(1, orchestrator.triggerInitialDecisions());
        assertTrue(orchestrator.isDecisionPending("alice"));
        assertFalse(orchestrator.isDecisionPending("bob"));
    }

    @Test
    @DisplayName("Schedule updates carried by a decision are applied")
    void testScheduleUpdate() {
        TestWorlds.character(world, "alice", "town", "town-1-1");
        ScheduleEntry entry = new ScheduleEntry("15:00", "nap", "home", null);
        when(decider.decide(any())).thenReturn(done(BehaviorDecision.idle("plan")
                .withScheduleUpdate(new ScheduleUpdate(ScheduleUpdate.Type.ADD, entry))));

        orchestrator.requestDecision("alice");
        orchestrator.tick(clock.millis());

        DailySchedule schedule = schedules.getSchedule("alice", 1);
        assertNotNull(schedule);
        assertEquals(List.of(entry), schedule.entries());
    }

    @Test
    @DisplayName("Decisions resolved on another thread apply on the tick thread")
    void testAsyncDecider() throws InterruptedException {
        SimCharacter alice = TestWorlds.character(world, "alice", "town", "town-2-1");
        when(decider.decide(any())).thenAnswer(invocation -> CompletableFuture.supplyAsync(
                () -> BehaviorDecision.action(ActionId.TOILET, null, null, "async")));

        orchestrator.requestDecision("alice");
        orchestrator.getInFlightDecision("alice").join();
        // whenComplete callbacks may still be running on the pool thread
        for (int i = 0; i < 100 && alice.getCurrentAction() != null && alice.getCurrentAction().isThinking(); i++) {
            orchestrator.tick(clock.millis());
            Thread.sleep(5);
        }

        assertEquals(ActionId.TOILET, alice.getCurrentAction().actionId());
    }
}
