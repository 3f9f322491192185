package com.davisodom.townsim.behavior;

import com.davisodom.townsim.DebugFlags;
import com.davisodom.townsim.action.ActionExecutor;
import com.davisodom.townsim.action.FacilityLocator;
import com.davisodom.townsim.config.SimulationConfig;
import com.davisodom.townsim.core.EventBus;
import com.davisodom.townsim.core.SimulationEvent;
import com.davisodom.townsim.core.SimulationEventType;
import com.davisodom.townsim.model.*;
import com.davisodom.townsim.navigation.MapGraph;
import com.davisodom.townsim.navigation.NavigationStateMachine;
import com.davisodom.townsim.needs.NeedDecayModel;
import com.davisodom.townsim.obs.Metrics;
import com.davisodom.townsim.world.Npc;
import com.davisodom.townsim.world.SimCharacter;
import com.davisodom.townsim.world.WorldState;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives agent decisions: asks the {@link BehaviorDecider} what to do and turns the answer into
 * actions and navigation.
 *
 * <p>At most one decision is in flight per agent. While it is, the agent holds the {@code thinking}
 * placeholder action. Decider futures may complete on any thread; their results are queued and
 * applied in {@link #tick(long)} on the tick thread, after re-checking that the agent is still idle.
 * A result for an agent that got busy meanwhile is discarded.
 *
 * <p>Failed intents never retry themselves inline. They schedule a re-decision for a later tick.
 */
public class BehaviorOrchestrator {

    private static final Logger LOGGER = Logger.getLogger(BehaviorOrchestrator.class.getName());

    private static final Map<NeedType, ActionId> INTERRUPT_ACTIONS = Map.of(
            NeedType.BLADDER, ActionId.TOILET,
            NeedType.SATIETY, ActionId.EAT,
            NeedType.ENERGY, ActionId.SLEEP,
            NeedType.HYGIENE, ActionId.BATHE);

    // Mood never interrupts and never holds back wandering
    private static final NeedType[] INTERRUPT_NEEDS = NeedDecayModel.INTERRUPT_PRIORITY.toArray(new NeedType[0]);

    private record Resolution(String agentId, BehaviorDecision decision, Throwable failure, ActionId forcedAction) {}

    private final WorldState world;
    private final ActionExecutor actions;
    private final NavigationStateMachine navigation;
    private final BehaviorDecider decider;
    private final BehaviorContextBuilder contextBuilder;
    private final ScheduleManager schedules;
    private final ActionHistory history;
    private final SimulationConfig config;
    private final FacilityLocator locator;
    private final Metrics metrics;
    private final Clock clock;
    private final Random random;
    private final DebugFlags debug;

    private final Set<String> pendingDecisions = ConcurrentHashMap.newKeySet();
    private final Map<String, CompletableFuture<BehaviorDecision>> inFlight = new ConcurrentHashMap<>();
    private final Queue<Resolution> resolved = new ConcurrentLinkedQueue<>();
    private final Map<String, Long> scheduled = new ConcurrentHashMap<>();

    private EventBus events;

    public BehaviorOrchestrator(WorldState world, ActionExecutor actions, NavigationStateMachine navigation,
                                BehaviorDecider decider, BehaviorContextBuilder contextBuilder,
                                ScheduleManager schedules, ActionHistory history, SimulationConfig config,
                                FacilityLocator locator, Metrics metrics, Clock clock, Random random,
                                DebugFlags debug) {
        this.world = world;
        this.actions = actions;
        this.navigation = navigation;
        this.decider = decider;
        this.contextBuilder = contextBuilder;
        this.schedules = schedules;
        this.history = history;
        this.config = config;
        this.locator = locator;
        this.metrics = metrics;
        this.clock = clock;
        this.random = random;
        this.debug = debug;
    }

    /**
     * The action an interrupt for the given need forces, or null for needs that never interrupt.
     */
    public static ActionId forcedActionFor(NeedType need) {
        return INTERRUPT_ACTIONS.get(need);
    }

    /**
     * Subscribe to the events that drive decisions and publish applied decisions on the same bus.
     */
    public EventBus.Registration attach(EventBus bus) {
        this.events = bus;
        return bus.register(this::onEvent,
                SimulationEventType.ACTION_STARTED,
                SimulationEventType.ACTION_COMPLETED,
                SimulationEventType.NAVIGATION_COMPLETED,
                SimulationEventType.NEED_THRESHOLD_CROSSED);
    }

    private void onEvent(SimulationEvent event) {
        switch (event.getType()) {
            case ACTION_STARTED:
                onActionStarted(event.getAgentId(), event.getActionId(), event.getDetail());
                break;
            case ACTION_COMPLETED:
                onActionComplete(event.getAgentId(), event.getActionId());
                break;
            case NAVIGATION_COMPLETED:
                onNavigationComplete(event.getAgentId());
                break;
            case NEED_THRESHOLD_CROSSED:
                triggerInterrupt(event.getAgentId(), event.getNeed());
                break;
            default:
                break;
        }
    }

    // ==================== Entry points ====================

    /**
     * Ask the decider for the agent's next step.
     *
     * @return false when refused: unknown agent, decision already pending, or agent not idle
     */
    public boolean requestDecision(String agentId) {
        return dispatch(agentId, null);
    }

    /**
     * Decide where to satisfy a need that just crossed the interrupt threshold.
     * Only the facility choice goes to the decider; the action is fixed by the need.
     */
    public boolean triggerInterrupt(String agentId, NeedType need) {
        ActionId forced = forcedActionFor(need);
        if (forced == null) {
            return false;
        }
        boolean dispatched = dispatch(agentId, forced);
        if (dispatched) {
            metrics.increment("interrupts.fired");
            LOGGER.info(String.format("[DECIDE] %s interrupt: %s -> %s", agentId,
                    need.name().toLowerCase(Locale.ROOT), forced.id()));
        } else {
            debug.debugDecision(String.format("%s interrupt for %s skipped, agent busy", agentId, need));
        }
        return dispatched;
    }

    /**
     * Request a decision for every idle character.
     *
     * @return number of decisions dispatched
     */
    public int triggerInitialDecisions() {
        int count = 0;
        for (SimCharacter c : new ArrayList<>(world.getCharacters())) {
            if (requestDecision(c.getId())) {
                count++;
            }
        }
        LOGGER.info(String.format("[DECIDE] Initial decisions requested for %d characters", count));
        return count;
    }

    /**
     * Request a decision for the agent once {@code delayMs} has passed. A later call replaces an earlier one.
     */
    public void scheduleDecision(String agentId, long delayMs) {
        scheduled.put(agentId, clock.millis() + Math.max(0, delayMs));
    }

    /**
     * Apply every resolved decision, then fire the scheduled re-decisions that are due.
     */
    public void tick(long nowMillis) {
        Resolution resolution;
        while ((resolution = resolved.poll()) != null) {
            applyResolution(resolution);
        }

        List<String> due = new ArrayList<>();
        for (Map.Entry<String, Long> entry : scheduled.entrySet()) {
            if (entry.getValue() <= nowMillis) {
                due.add(entry.getKey());
            }
        }
        for (String agentId : due) {
            scheduled.remove(agentId);
            requestDecision(agentId);
        }
    }

    /**
     * Start pending actions for agents that have arrived: not navigating and not acting.
     */
    public void resolvePendingActions() {
        for (SimCharacter c : new ArrayList<>(world.getCharacters())) {
            PendingAction pending = c.getPendingAction();
            if (pending == null || c.isNavigating() || c.getCurrentAction() != null) {
                continue;
            }
            try {
                boolean started = actions.startAction(c.getId(), pending.actionId(), pending.facilityId(),
                        pending.targetNpcId(), pending.durationMinutes(), pending.reason());
                world.clearPendingAction(c.getId());
                if (!started) {
                    LOGGER.warning(String.format("[ACTION] %s could not start pending %s on arrival",
                            c.getId(), pending.actionId().id()));
                    scheduleDecision(c.getId(), config.behavior.redecisionDelayMs);
                }
            } catch (RuntimeException e) {
                LOGGER.log(Level.SEVERE, "[ACTION] Pending action failed for " + c.getId(), e);
                world.clearPendingAction(c.getId());
                scheduleDecision(c.getId(), config.behavior.redecisionDelayMs);
            }
        }
    }

    public boolean isDecisionPending(String agentId) {
        return pendingDecisions.contains(agentId);
    }

    public int getPendingDecisionCount() {
        return pendingDecisions.size();
    }

    /**
     * The decider future for the agent's pending decision, or null when none is pending.
     */
    public CompletableFuture<BehaviorDecision> getInFlightDecision(String agentId) {
        return inFlight.get(agentId);
    }

    public boolean hasScheduledDecision(String agentId) {
        return scheduled.containsKey(agentId);
    }

    // ==================== Dispatch ====================

    private boolean dispatch(String agentId, ActionId forcedAction) {
        SimCharacter c = world.getCharacter(agentId);
        if (c == null || !c.isIdle() || !pendingDecisions.add(agentId)) {
            return false;
        }
        metrics.increment("decisions.requested");

        CompletableFuture<BehaviorDecision> future;
        try {
            actions.startAction(agentId, ActionId.THINKING, null, null, null,
                    forcedAction != null ? "interrupt: " + forcedAction.id() : "deciding");
            BehaviorContext context = contextBuilder.build(agentId, forcedAction);
            future = forcedAction != null
                    ? decider.decideInterruptFacility(forcedAction, context)
                    : decider.decide(context);
            if (future == null) {
                future = CompletableFuture.failedFuture(new IllegalStateException("Decider returned no future"));
            }
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        debug.debugDecision(String.format("%s decision dispatched%s", agentId,
                forcedAction != null ? " (forced " + forcedAction.id() + ")" : ""));
        inFlight.put(agentId, future);
        future.whenComplete((decision, failure) ->
                resolved.add(new Resolution(agentId, decision, failure, forcedAction)));
        return true;
    }

    private void applyResolution(Resolution resolution) {
        String agentId = resolution.agentId();
        try {
            inFlight.remove(agentId);
            SimCharacter c = world.getCharacter(agentId);
            if (c == null) {
                return;
            }
            ActionState current = c.getCurrentAction();
            if (current != null && current.isThinking()) {
                actions.forceCompleteAction(agentId);
            }

            Throwable failure = resolution.failure();
            if (failure == null && resolution.decision() == null) {
                failure = new IllegalStateException("Decider resolved without a decision");
            }
            if (failure != null) {
                Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                        ? failure.getCause() : failure;
                LOGGER.log(Level.WARNING, "[DECIDE] Decision failed for " + agentId, cause);
                metrics.increment("decisions.failed");
                return;
            }

            if (!c.isIdle()) {
                LOGGER.info(String.format("[DECIDE] %s is busy, discarding stale decision %s",
                        agentId, resolution.decision()));
                metrics.increment("decisions.discarded");
                return;
            }

            BehaviorDecision decision = resolution.decision();
            if (decision.getScheduleUpdate() != null) {
                schedules.applyUpdate(agentId, world.getTime().day(), decision.getScheduleUpdate());
            }
            LOGGER.info(String.format("[DECIDE] %s: %s", agentId, decision));
            apply(c, decision, resolution.forcedAction());
            metrics.increment("decisions.applied");
            if (events != null) {
                events.publish(SimulationEvent.decisionApplied(agentId, decision.toString()));
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "[DECIDE] Applying decision failed for " + agentId, e);
        } finally {
            pendingDecisions.remove(agentId);
        }
    }

    private void apply(SimCharacter c, BehaviorDecision decision, ActionId forcedAction) {
        switch (decision.getKind()) {
            case IDLE:
                applyIdle(c, decision, forcedAction);
                break;
            case MOVE:
                applyMove(c, decision);
                break;
            case ACTION:
                if (decision.getActionId() == ActionId.TALK) {
                    applyTalk(c, decision);
                } else {
                    applyAction(c, decision);
                }
                break;
            default:
                break;
        }
    }

    private void applyIdle(SimCharacter c, BehaviorDecision decision, ActionId forcedAction) {
        String agentId = c.getId();
        world.setDisplayEmoji(agentId, config.behavior.idleEmoji);
        record(c, ActionHistoryEntry.Kind.IDLE, null, null, null, decision.getReason());
        if (forcedAction == null) {
            scheduleDecision(agentId, config.behavior.idleRetryMs);
            return;
        }
        // Nowhere to satisfy the need here; head for the safe map
        WorldMap safeMap = world.getMap(config.behavior.safeMapId);
        if (safeMap != null && !safeMap.getId().equals(c.getCurrentMapId())
                && navigation.navigateToMap(agentId, safeMap.getId(), safeMap.getSpawnNodeId())) {
            LOGGER.info(String.format("[DECIDE] %s has no %s facility, heading to %s",
                    agentId, forcedAction.id(), safeMap.getId()));
            world.setDisplayEmoji(agentId, null);
            return;
        }
        LOGGER.warning(String.format("[DECIDE] %s is stuck without a %s facility", agentId, forcedAction.id()));
        scheduleDecision(agentId, config.behavior.interruptIdleRetryMs);
    }

    private void applyMove(SimCharacter c, BehaviorDecision decision) {
        String agentId = c.getId();
        String mapId = decision.getTargetMapId() != null ? decision.getTargetMapId() : c.getCurrentMapId();
        WorldMap map = world.getMap(mapId);
        String nodeId = decision.getTargetNodeId() != null
                ? decision.getTargetNodeId()
                : map != null ? map.getSpawnNodeId() : null;
        if (map != null && nodeId != null && navigation.navigateToMap(agentId, mapId, nodeId)) {
            world.setDisplayEmoji(agentId, null);
            record(c, ActionHistoryEntry.Kind.MOVE, null, mapId + ":" + nodeId, null, decision.getReason());
            return;
        }
        LOGGER.warning(String.format("[NAV] %s could not move to %s:%s, retrying", agentId, mapId, nodeId));
        scheduleDecision(agentId, config.behavior.moveRetryMs);
    }

    private void applyAction(SimCharacter c, BehaviorDecision decision) {
        String agentId = c.getId();
        ActionId actionId = decision.getActionId();
        String facilityId = decision.getTargetFacilityId();
        if (actionId == null) {
            redecide(agentId, "decision named no action");
            return;
        }
        if (facilityId == null) {
            startNow(agentId, actionId, null, null, decision);
            return;
        }

        String facilityMapId = world.findFacilityMapId(facilityId);
        if (facilityMapId == null) {
            redecide(agentId, "unknown facility " + facilityId);
            return;
        }
        WorldMap map = world.getMap(facilityMapId);
        Obstacle obstacle = map.findObstacle(facilityId).orElse(null);
        if (obstacle == null) {
            redecide(agentId, "unknown facility " + facilityId);
            return;
        }
        if (facilityMapId.equals(c.getCurrentMapId()) && locator.isNodeAtFacility(map, c.getCurrentNodeId(), obstacle)) {
            startNow(agentId, actionId, facilityId, null, decision);
            return;
        }

        String targetNode = locator.findFacilityTargetNode(map, obstacle, world.getBlockedNodes(facilityMapId));
        if (targetNode == null) {
            redecide(agentId, "no free node at " + facilityId);
            return;
        }
        world.setPendingAction(agentId, PendingAction.forFacility(actionId, facilityId, facilityMapId,
                decision.getReason(), decision.getDurationMinutes()));
        if (!navigation.navigateToMap(agentId, facilityMapId, targetNode)) {
            world.clearPendingAction(agentId);
            redecide(agentId, "no route to " + facilityId);
            return;
        }
        world.setDisplayEmoji(agentId, null);
        debug.debugDecision(String.format("%s walking to %s for %s", agentId, facilityId, actionId.id()));
    }

    private void applyTalk(SimCharacter c, BehaviorDecision decision) {
        String agentId = c.getId();
        String npcId = decision.getTargetNpcId();
        Npc npc = npcId != null ? world.getNpc(npcId) : null;
        if (npc == null || !npc.getMapId().equals(c.getCurrentMapId())) {
            redecide(agentId, "npc " + npcId + " is not on " + c.getCurrentMapId());
            return;
        }
        WorldMap map = world.getMap(c.getCurrentMapId());
        PathNode npcNode = map != null ? map.getNode(npc.getNodeId()) : null;
        if (npcNode == null) {
            redecide(agentId, "npc " + npcId + " stands on an unknown node");
            return;
        }
        if (npcNode.getConnectedTo().contains(c.getCurrentNodeId())) {
            startNow(agentId, ActionId.TALK, null, npcId, decision);
            return;
        }

        world.setPendingAction(agentId, PendingAction.forNpc(npcId, map.getId(), decision.getReason()));
        Set<String> blocked = world.getBlockedNodes(map.getId());
        for (String neighbor : npcNode.getConnectedTo()) {
            if (blocked.contains(neighbor) || occupiedByOther(agentId, map.getId(), neighbor)) {
                continue;
            }
            if (navigation.navigateToNode(agentId, neighbor)) {
                world.setDisplayEmoji(agentId, null);
                return;
            }
        }
        world.clearPendingAction(agentId);
        redecide(agentId, "no free node next to " + npcId);
    }

    private void startNow(String agentId, ActionId actionId, String facilityId, String npcId, BehaviorDecision decision) {
        if (!actions.startAction(agentId, actionId, facilityId, npcId, decision.getDurationMinutes(), decision.getReason())) {
            redecide(agentId, "could not start " + actionId.id());
        }
    }

    private void redecide(String agentId, String why) {
        LOGGER.warning(String.format("[DECIDE] %s: %s, deciding again", agentId, why));
        scheduleDecision(agentId, config.behavior.redecisionDelayMs);
    }

    private boolean occupiedByOther(String agentId, String mapId, String nodeId) {
        for (SimCharacter other : world.getCharacters()) {
            if (!other.getId().equals(agentId) && other.getCurrentMapId().equals(mapId)
                    && nodeId.equals(other.getCurrentNodeId())) {
                return true;
            }
        }
        return false;
    }

    // ==================== Completion handlers ====================

    private void onActionStarted(String agentId, ActionId actionId, String target) {
        if (actionId == null || actionId == ActionId.THINKING) {
            return;
        }
        SimCharacter c = world.getCharacter(agentId);
        if (c == null) {
            return;
        }
        ActionState state = c.getCurrentAction();
        Integer minutes = state != null && state.actionId() == actionId ? state.durationMinutes() : null;
        String reason = state != null ? state.reason() : null;
        record(c, ActionHistoryEntry.Kind.ACTION, actionId, target, minutes, reason);
    }

    /**
     * Count completed actions and either wander or ask for the next decision.
     */
    void onActionComplete(String agentId, ActionId actionId) {
        if (actionId == ActionId.THINKING) {
            return;
        }
        SimCharacter c = world.getCharacter(agentId);
        if (c == null) {
            return;
        }
        int counter = Math.min(c.getActionCounter() + 1, config.behavior.wanderEveryActions);
        boolean needsLow = c.getNeeds().anyBelow(config.needs.interruptThreshold, INTERRUPT_NEEDS);
        if (counter >= config.behavior.wanderEveryActions && !needsLow) {
            world.setActionCounter(agentId, 0);
            if (wander(c)) {
                return;
            }
        } else {
            // Held at the limit until needs recover
            world.setActionCounter(agentId, counter);
        }
        requestDecision(agentId);
    }

    void onNavigationComplete(String agentId) {
        SimCharacter c = world.getCharacter(agentId);
        if (c == null || c.getPendingAction() != null) {
            return;
        }
        requestDecision(agentId);
    }

    /**
     * Walk to the spawn node of a random map within the wander radius, without asking the decider.
     */
    private boolean wander(SimCharacter c) {
        Map<String, Integer> hops = MapGraph.build(world.getMaps())
                .hopDistances(c.getCurrentMapId(), config.behavior.wanderHopRadius);
        List<String> candidates = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : hops.entrySet()) {
            if (entry.getValue() > 0) {
                candidates.add(entry.getKey());
            }
        }
        Collections.shuffle(candidates, random);
        for (String mapId : candidates) {
            WorldMap map = world.getMap(mapId);
            if (map.getSpawnNodeId() != null && navigation.navigateToMap(c.getId(), mapId, map.getSpawnNodeId())) {
                metrics.increment("wander.started");
                LOGGER.info(String.format("[DECIDE] %s wanders to %s", c.getId(), mapId));
                world.setDisplayEmoji(c.getId(), null);
                record(c, ActionHistoryEntry.Kind.MOVE, null, mapId + ":" + map.getSpawnNodeId(), null, "wandering");
                return true;
            }
        }
        return false;
    }

    private void record(SimCharacter c, ActionHistoryEntry.Kind kind, ActionId actionId, String target,
                        Integer minutes, String reason) {
        WorldTime time = world.getTime();
        history.record(new ActionHistoryEntry(c.getId(), time.day(), time.format(), kind, actionId, target,
                minutes, reason));
    }
}
