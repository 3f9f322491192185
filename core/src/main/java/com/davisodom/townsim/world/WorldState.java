package com.davisodom.townsim.world;

import com.davisodom.townsim.model.*;

import java.util.*;
import java.util.logging.Logger;

/**
 * Authoritative mutable world: maps, characters, NPCs, per-map blocked nodes,
 * simulated time and the pause flag.
 *
 * All writes go through the methods of this class. Not thread-safe: the tick thread owns it,
 * and asynchronous work re-enters through that thread before touching it.
 */
public class WorldState {

    private static final Logger LOGGER = Logger.getLogger(WorldState.class.getName());

    private final Map<String, WorldMap> maps = new LinkedHashMap<>();
    private final Map<String, SimCharacter> characters = new LinkedHashMap<>();
    private final Map<String, Npc> npcs = new LinkedHashMap<>();
    private final Map<String, Set<String>> npcBlockedNodes = new HashMap<>();

    private String currentMapId;
    private WorldTime time = new WorldTime(0, 0, 1);
    private long tick = 0;
    private volatile boolean paused = false;
    private long serverStartTime = System.currentTimeMillis();

    // ------------------------------------------------------------------
    // Setup
    // ------------------------------------------------------------------

    public void addMap(WorldMap map) {
        maps.put(map.getId(), map);
    }

    public void addCharacter(SimCharacter character) {
        if (!maps.containsKey(character.getCurrentMapId())) {
            throw new IllegalArgumentException("Unknown map for character " + character.getId()
                    + ": " + character.getCurrentMapId());
        }
        characters.put(character.getId(), character);
    }

    /**
     * Adds an NPC and marks its node as blocked on its map.
     */
    public void addNpc(Npc npc) {
        npcs.put(npc.getId(), npc);
        npcBlockedNodes.computeIfAbsent(npc.getMapId(), k -> new HashSet<>()).add(npc.getNodeId());
    }

    /**
     * Replaces the blocked-node set of one map.
     */
    public void setNpcBlockedNodes(String mapId, Set<String> nodeIds) {
        npcBlockedNodes.put(mapId, new HashSet<>(nodeIds));
    }

    /**
     * Drops all characters and NPCs, keeping maps.
     */
    public void clearAgents() {
        characters.clear();
        npcs.clear();
        npcBlockedNodes.clear();
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    public WorldMap getMap(String mapId) {
        return mapId == null ? null : maps.get(mapId);
    }

    public Map<String, WorldMap> getMaps() {
        return Collections.unmodifiableMap(maps);
    }

    public SimCharacter getCharacter(String characterId) {
        return characterId == null ? null : characters.get(characterId);
    }

    public Collection<SimCharacter> getCharacters() {
        return Collections.unmodifiableCollection(characters.values());
    }

    public Npc getNpc(String npcId) {
        return npcId == null ? null : npcs.get(npcId);
    }

    public Collection<Npc> getNpcs() {
        return Collections.unmodifiableCollection(npcs.values());
    }

    public List<Npc> getNpcsOnMap(String mapId) {
        List<Npc> result = new ArrayList<>();
        for (Npc npc : npcs.values()) {
            if (npc.getMapId().equals(mapId)) {
                result.add(npc);
            }
        }
        return result;
    }

    public Set<String> getBlockedNodes(String mapId) {
        Set<String> blocked = npcBlockedNodes.get(mapId);
        return blocked != null ? Collections.unmodifiableSet(blocked) : Collections.emptySet();
    }

    public Map<String, Set<String>> getBlockedNodesPerMap() {
        Map<String, Set<String>> copy = new HashMap<>();
        for (Map.Entry<String, Set<String>> entry : npcBlockedNodes.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableSet(new HashSet<>(entry.getValue())));
        }
        return copy;
    }

    /**
     * Locates the obstacle with the given id on any map.
     *
     * @return the owning map id, or null when no map has it
     */
    public String findFacilityMapId(String obstacleId) {
        for (WorldMap map : maps.values()) {
            if (map.findObstacle(obstacleId).isPresent()) {
                return map.getId();
            }
        }
        return null;
    }

    public String getCurrentMapId() { return currentMapId; }
    public WorldTime getTime() { return time; }
    public long getTick() { return tick; }
    public boolean isPaused() { return paused; }
    public long getServerStartTime() { return serverStartTime; }

    // ------------------------------------------------------------------
    // Needs, money, display
    // ------------------------------------------------------------------

    public void updateNeeds(String characterId, NeedValues needs) {
        SimCharacter c = require(characterId);
        if (c != null) {
            c.setNeeds(needs);
        }
    }

    public void setMoney(String characterId, int money) {
        SimCharacter c = require(characterId);
        if (c != null) {
            c.setMoney(Math.max(0, money));
        }
    }

    public void setDisplayEmoji(String characterId, String emoji) {
        SimCharacter c = require(characterId);
        if (c != null) {
            c.setDisplayEmoji(emoji);
        }
    }

    // ------------------------------------------------------------------
    // Navigation
    // ------------------------------------------------------------------

    /**
     * Starts walking along {@code path}; the first step heads for path[1].
     */
    public void startNavigation(String characterId, List<String> path, Position startPosition, Position targetPosition) {
        SimCharacter c = require(characterId);
        if (c == null) {
            return;
        }
        c.setNavigation(new NavigationState(true, path, 1, 0.0, startPosition, targetPosition));
    }

    public void updateNavigationProgress(String characterId, double progress, Position position) {
        SimCharacter c = require(characterId);
        if (c == null) {
            return;
        }
        c.setNavigation(c.getNavigation().withProgress(progress));
        c.setPosition(position);
    }

    /**
     * Records arrival at the current step's node and heads for the next one.
     */
    public void advanceToNextNode(String characterId, Position nextTarget) {
        SimCharacter c = require(characterId);
        if (c == null) {
            return;
        }
        NavigationState nav = c.getNavigation();
        Position reached = nav.targetPosition();
        c.setCurrentNodeId(nav.targetNodeId());
        c.setPosition(reached);
        c.setNavigation(new NavigationState(true, nav.path(), nav.currentPathIndex() + 1, 0.0, reached, nextTarget));
    }

    public void completeNavigation(String characterId) {
        SimCharacter c = require(characterId);
        if (c != null) {
            c.setNavigation(NavigationState.REST);
        }
    }

    // ------------------------------------------------------------------
    // Cross-map navigation
    // ------------------------------------------------------------------

    public void startCrossMapNavigation(String characterId, String targetMapId, String targetNodeId, CrossMapRoute route) {
        SimCharacter c = require(characterId);
        if (c != null) {
            c.setCrossMapNavigation(new CrossMapNavigationState(true, route, 0, targetMapId, targetNodeId));
        }
    }

    public void advanceCrossMapSegment(String characterId) {
        SimCharacter c = require(characterId);
        if (c != null && c.getCrossMapNavigation().active()) {
            c.setCrossMapNavigation(c.getCrossMapNavigation().advance());
        }
    }

    public void completeCrossMapNavigation(String characterId) {
        SimCharacter c = require(characterId);
        if (c != null) {
            c.setCrossMapNavigation(CrossMapNavigationState.INACTIVE);
        }
    }

    // ------------------------------------------------------------------
    // Position
    // ------------------------------------------------------------------

    public void setCharacterMap(String characterId, String mapId, String nodeId, Position position) {
        SimCharacter c = require(characterId);
        if (c == null) {
            return;
        }
        c.setCurrentMapId(mapId);
        c.setCurrentNodeId(nodeId);
        c.setPosition(position);
    }

    public void updateCharacterPosition(String characterId, Position position, String nodeId) {
        SimCharacter c = require(characterId);
        if (c == null) {
            return;
        }
        c.setPosition(position);
        if (nodeId != null) {
            c.setCurrentNodeId(nodeId);
        }
    }

    public void updateCharacterDirection(String characterId, Direction direction) {
        SimCharacter c = require(characterId);
        if (c != null) {
            c.setDirection(direction);
        }
    }

    // ------------------------------------------------------------------
    // Map transition
    // ------------------------------------------------------------------

    public void startTransition(String characterId, String targetMapId, String targetNodeId, Position targetPosition) {
        SimCharacter c = require(characterId);
        if (c != null) {
            c.setTransition(TransitionState.fadeOut(targetMapId, targetNodeId, targetPosition));
        }
    }

    public void updateTransitionProgress(String characterId, TransitionState.Phase phase, double progress) {
        SimCharacter c = require(characterId);
        if (c != null && c.getTransition() != null) {
            c.setTransition(c.getTransition().with(phase, progress));
        }
    }

    public void endTransition(String characterId) {
        SimCharacter c = require(characterId);
        if (c != null) {
            c.setTransition(null);
        }
    }

    // ------------------------------------------------------------------
    // Actions and conversation
    // ------------------------------------------------------------------

    public void setCurrentAction(String characterId, ActionState action) {
        SimCharacter c = require(characterId);
        if (c != null) {
            c.setCurrentAction(action);
        }
    }

    public void clearCurrentAction(String characterId) {
        setCurrentAction(characterId, null);
    }

    public void setPendingAction(String characterId, PendingAction pendingAction) {
        SimCharacter c = require(characterId);
        if (c != null) {
            c.setPendingAction(pendingAction);
        }
    }

    public void clearPendingAction(String characterId) {
        setPendingAction(characterId, null);
    }

    public void setActionCounter(String characterId, int counter) {
        SimCharacter c = require(characterId);
        if (c != null) {
            c.setActionCounter(counter);
        }
    }

    public void setCharacterConversation(String characterId, boolean inConversation) {
        SimCharacter c = require(characterId);
        if (c != null) {
            c.setInConversation(inConversation);
        }
    }

    public void setNpcConversation(String npcId, boolean inConversation) {
        Npc npc = npcs.get(npcId);
        if (npc == null) {
            LOGGER.warning("Unknown NPC: " + npcId);
            return;
        }
        npc.setInConversation(inConversation);
    }

    // ------------------------------------------------------------------
    // Time and control
    // ------------------------------------------------------------------

    public void incrementTick() {
        tick++;
    }

    public void setTime(WorldTime time) {
        this.time = Objects.requireNonNull(time, "time cannot be null");
    }

    public void setPaused(boolean paused) {
        this.paused = paused;
    }

    public boolean togglePause() {
        paused = !paused;
        return paused;
    }

    public void setCurrentMapId(String currentMapId) {
        this.currentMapId = currentMapId;
    }

    public void setServerStartTime(long serverStartTime) {
        this.serverStartTime = serverStartTime;
    }

    // ------------------------------------------------------------------
    // Snapshots
    // ------------------------------------------------------------------

    public WorldSnapshot toSnapshot() {
        Map<String, CharacterSnapshot> characterSnapshots = new LinkedHashMap<>();
        for (SimCharacter c : characters.values()) {
            characterSnapshots.put(c.getId(), CharacterSnapshot.of(c));
        }
        Map<String, NpcSnapshot> npcSnapshots = new LinkedHashMap<>();
        for (Npc npc : npcs.values()) {
            npcSnapshots.put(npc.getId(), NpcSnapshot.of(npc));
        }
        return new WorldSnapshot(tick, time, currentMapId, serverStartTime, paused, characterSnapshots, npcSnapshots);
    }

    /**
     * Restores agents, time and tick from a snapshot. Maps must already be loaded.
     *
     * Motion does not survive a restart: navigation, routes, transitions, pending actions,
     * conversations and the thinking placeholder are reset, leaving each agent idle or in its
     * timed action.
     *
     * @return number of characters restored
     */
    public int restore(WorldSnapshot snapshot) {
        clearAgents();
        int restored = 0;
        for (CharacterSnapshot s : snapshot.characters().values()) {
            WorldMap map = maps.get(s.currentMapId());
            if (map == null || !map.hasNode(s.currentNodeId())) {
                LOGGER.warning(String.format("[STORE] Skipping %s: unknown location %s/%s",
                        s.id(), s.currentMapId(), s.currentNodeId()));
                continue;
            }
            // Snap back onto the last node reached
            Position position = map.getNode(s.currentNodeId()).position();
            SimCharacter c = new SimCharacter(s.id(), s.name(), s.currentMapId(), s.currentNodeId(), position,
                    NeedValues.of(s.needs()), s.money(), s.employment());
            c.setDirection(s.direction() != null ? s.direction() : Direction.DOWN);
            c.setActionCounter(s.actionCounter());
            c.setDisplayEmoji(s.displayEmoji());
            ActionState action = s.currentAction();
            if (action != null && !action.isThinking() && action.actionId() != ActionId.TALK) {
                c.setCurrentAction(action);
            }
            characters.put(c.getId(), c);
            restored++;
        }
        for (NpcSnapshot s : snapshot.npcs().values()) {
            if (!maps.containsKey(s.mapId())) {
                continue;
            }
            addNpc(new Npc(s.id(), s.name(), s.mapId(), s.nodeId(), s.position(), s.direction()));
        }
        this.tick = snapshot.tick();
        if (snapshot.time() != null) {
            this.time = snapshot.time();
        }
        if (snapshot.currentMapId() != null && maps.containsKey(snapshot.currentMapId())) {
            this.currentMapId = snapshot.currentMapId();
        }
        if (snapshot.serverStartTime() > 0) {
            this.serverStartTime = snapshot.serverStartTime();
        }
        return restored;
    }

    private SimCharacter require(String characterId) {
        SimCharacter c = characters.get(characterId);
        if (c == null) {
            LOGGER.warning("Unknown character: " + characterId);
        }
        return c;
    }
}
