package com.davisodom.townsim.navigation;

import com.davisodom.townsim.DebugFlags;
import com.davisodom.townsim.config.SimulationConfig;
import com.davisodom.townsim.core.EventBus;
import com.davisodom.townsim.core.SimulationEvent;
import com.davisodom.townsim.model.*;
import com.davisodom.townsim.world.SimCharacter;
import com.davisodom.townsim.world.WorldState;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Moves characters along paths, chains nodes, plays map transitions and follows cross-map routes.
 *
 * States per agent: idle, moving, transitioning (fade out then fade in). A cross-map route
 * overlays these: each segment is walked, its exit entrance triggers a transition, and the
 * transition's end starts the next segment.
 *
 * Completion is edge-triggered. The set of navigating agents is captured when a tick starts and
 * compared with the set when it ends; each agent that dropped out gets exactly one
 * {@code NAVIGATION_COMPLETED} event, however many segments and transitions its trip had.
 */
public class NavigationStateMachine {

    private static final Logger LOGGER = Logger.getLogger(NavigationStateMachine.class.getName());

    private final WorldState world;
    private final Pathfinder pathfinder;
    private final CrossMapRouter router;
    private final EventBus events;
    private final double speed;
    private final double fadeSpeed;
    private final DebugFlags debug;

    public NavigationStateMachine(WorldState world, Pathfinder pathfinder, CrossMapRouter router, EventBus events,
                                  SimulationConfig.Movement movement, DebugFlags debug) {
        this.world = world;
        this.pathfinder = pathfinder;
        this.router = router;
        this.events = events;
        this.speed = movement.speed;
        this.fadeSpeed = movement.transitionFadeSpeed;
        this.debug = debug;
    }

    // ------------------------------------------------------------------
    // Commands
    // ------------------------------------------------------------------

    /**
     * Walk to a node on the agent's current map, avoiding nodes occupied by NPCs.
     *
     * @return false when the agent is unknown or already navigating, the target is unknown,
     *         or there is nothing to walk (no path, or already standing on the target)
     */
    public boolean navigateToNode(String agentId, String targetNodeId) {
        SimCharacter c = world.getCharacter(agentId);
        if (c == null) {
            LOGGER.warning("[NAV] Unknown character: " + agentId);
            return false;
        }
        if (c.isNavigating()) {
            debug.debugNavigation(agentId + " already navigating, ignoring target " + targetNodeId);
            return false;
        }
        WorldMap map = world.getMap(c.getCurrentMapId());
        if (map == null || !map.hasNode(targetNodeId)) {
            LOGGER.warning(String.format("[NAV] %s: unknown target %s/%s", agentId, c.getCurrentMapId(), targetNodeId));
            return false;
        }
        List<String> path = pathfinder.findPath(map, c.getCurrentNodeId(), targetNodeId,
                world.getBlockedNodes(map.getId()));
        if (path.size() < 2) {
            debug.debugNavigation(String.format("%s: no walkable path %s -> %s",
                    agentId, c.getCurrentNodeId(), targetNodeId));
            return false;
        }
        startPath(c, map, path);
        return true;
    }

    /**
     * Travel to a node on any map. Same-map targets behave like {@link #navigateToNode}.
     */
    public boolean navigateToMap(String agentId, String targetMapId, String targetNodeId) {
        SimCharacter c = world.getCharacter(agentId);
        if (c == null) {
            LOGGER.warning("[NAV] Unknown character: " + agentId);
            return false;
        }
        if (c.isNavigating()) {
            debug.debugNavigation(agentId + " already navigating, ignoring map target " + targetMapId);
            return false;
        }
        if (targetMapId.equals(c.getCurrentMapId())) {
            return navigateToNode(agentId, targetNodeId);
        }
        if (world.getMap(targetMapId) == null) {
            LOGGER.warning(String.format("[NAV] %s: unknown target map %s", agentId, targetMapId));
            return false;
        }

        CrossMapRoute route = router.planRoute(world.getMaps(), c.getCurrentMapId(), c.getCurrentNodeId(),
                targetMapId, targetNodeId, world.getBlockedNodesPerMap());
        if (route == null || route.segments().isEmpty()) {
            LOGGER.info(String.format("[NAV] %s: no route to %s/%s", agentId, targetMapId, targetNodeId));
            return false;
        }

        world.startCrossMapNavigation(agentId, targetMapId, targetNodeId, route);
        LOGGER.info(String.format("[NAV] %s: route to %s/%s over %d segments",
                agentId, targetMapId, targetNodeId, route.segments().size()));
        startSegment(c, route.segment(0));
        if (!c.isNavigating()) {
            // The route collapsed without ever moving (bad first segment)
            return false;
        }
        events.publish(SimulationEvent.navigationStarted(agentId, targetMapId, targetNodeId));
        return true;
    }

    public boolean isNavigating(String agentId) {
        SimCharacter c = world.getCharacter(agentId);
        return c != null && c.isNavigating();
    }

    public Set<String> getNavigatingAgents() {
        Set<String> navigating = new LinkedHashSet<>();
        for (SimCharacter c : world.getCharacters()) {
            if (c.isNavigating()) {
                navigating.add(c.getId());
            }
        }
        return navigating;
    }

    // ------------------------------------------------------------------
    // Tick
    // ------------------------------------------------------------------

    /**
     * Advance every moving or transitioning agent by {@code deltaSeconds}.
     *
     * @return agents whose navigation completed during this tick, in world order
     */
    public List<String> tick(double deltaSeconds) {
        Set<String> before = getNavigatingAgents();

        for (SimCharacter c : world.getCharacters()) {
            try {
                if (c.getTransition() != null) {
                    updateTransition(c, deltaSeconds);
                } else if (c.getNavigation().moving()) {
                    updateMovement(c, deltaSeconds);
                }
            } catch (RuntimeException e) {
                LOGGER.log(Level.SEVERE, "[NAV] Navigation update failed for " + c.getId(), e);
                abort(c);
            }
        }

        List<String> completed = new ArrayList<>();
        for (String agentId : before) {
            SimCharacter c = world.getCharacter(agentId);
            if (c != null && !c.isNavigating()) {
                completed.add(agentId);
            }
        }
        for (String agentId : completed) {
            SimCharacter c = world.getCharacter(agentId);
            debug.debugNavigation(String.format("%s arrived at %s/%s", agentId, c.getCurrentMapId(), c.getCurrentNodeId()));
            events.publish(SimulationEvent.navigationCompleted(agentId, c.getCurrentMapId(), c.getCurrentNodeId()));
        }
        return completed;
    }

    private void updateMovement(SimCharacter c, double deltaSeconds) {
        NavigationState nav = c.getNavigation();
        if (nav.startPosition() == null || nav.targetPosition() == null) {
            abort(c);
            return;
        }
        double distance = nav.startPosition().distanceTo(nav.targetPosition());
        double progress = distance <= 0
                ? 1.0
                : Math.min(1.0, nav.progress() + deltaSeconds / (distance / speed));
        Position position = nav.startPosition().lerp(nav.targetPosition(), progress);

        if (progress < 1.0) {
            world.updateNavigationProgress(c.getId(), progress, position);
            return;
        }
        if (nav.isFinalStep()) {
            arrive(c);
        } else {
            advance(c);
        }
    }

    private void advance(SimCharacter c) {
        NavigationState nav = c.getNavigation();
        WorldMap map = world.getMap(c.getCurrentMapId());
        String nextNodeId = nav.path().get(nav.currentPathIndex() + 1);
        PathNode next = map != null ? map.getNode(nextNodeId) : null;
        if (next == null) {
            LOGGER.warning(String.format("[NAV] %s: path node %s vanished from %s", c.getId(), nextNodeId, c.getCurrentMapId()));
            abort(c);
            return;
        }
        Position reached = nav.targetPosition();
        world.advanceToNextNode(c.getId(), next.position());
        world.updateCharacterDirection(c.getId(), Direction.facing(reached, next.position()));
    }

    private void arrive(SimCharacter c) {
        NavigationState nav = c.getNavigation();
        String nodeId = nav.targetNodeId();
        Position target = nav.targetPosition();

        world.updateCharacterPosition(c.getId(), target, nodeId);
        if (!nav.startPosition().equals(target)) {
            world.updateCharacterDirection(c.getId(), Direction.facing(nav.startPosition(), target));
        }
        world.completeNavigation(c.getId());

        CrossMapNavigationState cross = c.getCrossMapNavigation();
        if (cross.active()) {
            if (cross.hasMoreSegments()) {
                world.advanceCrossMapSegment(c.getId());
                RouteSegment next = c.getCrossMapNavigation().currentSegment();
                if (!beginTransition(c, next.mapId(), next.firstNodeId())) {
                    world.completeCrossMapNavigation(c.getId());
                }
            } else {
                world.completeCrossMapNavigation(c.getId());
            }
            return;
        }

        WorldMap map = world.getMap(c.getCurrentMapId());
        PathNode node = map != null ? map.getNode(nodeId) : null;
        if (node != null && node.isLinkedEntrance()) {
            beginTransition(c, node.getLeadsTo().mapId(), node.getLeadsTo().nodeId());
        }
    }

    // ------------------------------------------------------------------
    // Transitions and segments
    // ------------------------------------------------------------------

    private boolean beginTransition(SimCharacter c, String targetMapId, String targetNodeId) {
        WorldMap targetMap = world.getMap(targetMapId);
        PathNode targetNode = targetMap != null ? targetMap.getNode(targetNodeId) : null;
        if (targetNode == null) {
            LOGGER.warning(String.format("[NAV] %s: transition target %s/%s does not exist",
                    c.getId(), targetMapId, targetNodeId));
            return false;
        }
        LOGGER.info(String.format("[NAV] %s: transition %s -> %s", c.getId(), c.getCurrentMapId(), targetMapId));
        world.startTransition(c.getId(), targetMapId, targetNodeId, targetNode.position());
        events.publish(SimulationEvent.transitionStarted(c.getId(), targetMapId, targetNodeId));
        return true;
    }

    private void updateTransition(SimCharacter c, double deltaSeconds) {
        TransitionState transition = c.getTransition();
        double step = fadeSpeed * deltaSeconds;

        if (transition.phase() == TransitionState.Phase.FADE_OUT) {
            double progress = transition.progress() + step;
            if (progress < 1.0) {
                world.updateTransitionProgress(c.getId(), TransitionState.Phase.FADE_OUT, progress);
                return;
            }
            world.setCharacterMap(c.getId(), transition.targetMapId(), transition.targetNodeId(),
                    transition.targetPosition());
            world.updateTransitionProgress(c.getId(), TransitionState.Phase.FADE_IN, 1.0);
            events.publish(SimulationEvent.mapChanged(c.getId(), transition.targetMapId(), transition.targetNodeId()));
            return;
        }

        double progress = transition.progress() - step;
        if (progress > 0.0) {
            world.updateTransitionProgress(c.getId(), TransitionState.Phase.FADE_IN, progress);
            return;
        }
        world.endTransition(c.getId());
        CrossMapNavigationState cross = c.getCrossMapNavigation();
        if (cross.active()) {
            startSegment(c, cross.currentSegment());
        }
    }

    private void startSegment(SimCharacter c, RouteSegment segment) {
        if (segment == null || !segment.mapId().equals(c.getCurrentMapId())) {
            LOGGER.warning(String.format("[NAV] %s: route segment %s does not match current map %s",
                    c.getId(), segment != null ? segment.mapId() : null, c.getCurrentMapId()));
            world.completeCrossMapNavigation(c.getId());
            return;
        }
        WorldMap map = world.getMap(segment.mapId());

        if (segment.isStub()) {
            // Already standing on this segment's only node
            CrossMapNavigationState cross = c.getCrossMapNavigation();
            if (cross.hasMoreSegments()) {
                world.advanceCrossMapSegment(c.getId());
                RouteSegment next = c.getCrossMapNavigation().currentSegment();
                if (!beginTransition(c, next.mapId(), next.firstNodeId())) {
                    world.completeCrossMapNavigation(c.getId());
                }
            } else {
                world.completeCrossMapNavigation(c.getId());
            }
            return;
        }

        if (map == null || map.getNode(segment.path().get(1)) == null) {
            LOGGER.warning(String.format("[NAV] %s: segment on %s has unknown nodes", c.getId(), segment.mapId()));
            world.completeCrossMapNavigation(c.getId());
            return;
        }
        debug.debugNavigation(String.format("%s: segment on %s, path %s", c.getId(), segment.mapId(), segment.path()));
        startPath(c, map, segment.path());
    }

    private void startPath(SimCharacter c, WorldMap map, List<String> path) {
        Position from = c.getPosition();
        Position to = map.getNode(path.get(1)).position();
        world.startNavigation(c.getId(), path, from, to);
        world.updateCharacterDirection(c.getId(), Direction.facing(from, to));
        if (!c.getCrossMapNavigation().active()) {
            events.publish(SimulationEvent.navigationStarted(c.getId(), map.getId(), path.get(path.size() - 1)));
        }
        debug.debugNavigation(String.format("%s: walking %s", c.getId(), path));
    }

    /**
     * Drop every piece of motion state, leaving the agent where it stands.
     */
    private void abort(SimCharacter c) {
        world.completeNavigation(c.getId());
        world.endTransition(c.getId());
        world.completeCrossMapNavigation(c.getId());
    }
}
