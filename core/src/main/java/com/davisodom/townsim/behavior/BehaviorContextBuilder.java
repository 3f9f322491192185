package com.davisodom.townsim.behavior;

import com.davisodom.townsim.action.ActionExecutor;
import com.davisodom.townsim.model.*;
import com.davisodom.townsim.navigation.MapGraph;
import com.davisodom.townsim.world.Npc;
import com.davisodom.townsim.world.SimCharacter;
import com.davisodom.townsim.world.WorldState;

import java.util.*;

/**
 * Snapshots an agent's situation into a {@link BehaviorContext}.
 * Runs on the tick thread; the result shares nothing mutable with the world.
 */
public class BehaviorContextBuilder {

    public static final int NEARBY_MAP_HOPS = 3;

    private final WorldState world;
    private final ActionExecutor actions;
    private final ScheduleManager schedules;
    private final ActionHistory history;
    private final int historySize;

    public BehaviorContextBuilder(WorldState world, ActionExecutor actions, ScheduleManager schedules,
                                  ActionHistory history, int historySize) {
        this.world = world;
        this.actions = actions;
        this.schedules = schedules;
        this.history = history;
        this.historySize = historySize;
    }

    public BehaviorContext build(String agentId, ActionId forcedAction) {
        SimCharacter c = world.getCharacter(agentId);
        if (c == null) {
            throw new IllegalArgumentException("Unknown character: " + agentId);
        }
        WorldTime time = world.getTime();
        WorldMap map = world.getMap(c.getCurrentMapId());

        Obstacle here = actions.getCurrentFacility(agentId);
        BehaviorContext.FacilitySummary currentFacility = here != null ? summarize(here, c.getCurrentMapId(), 0) : null;

        Map<String, Integer> hops = MapGraph.build(world.getMaps()).hopDistances(c.getCurrentMapId(), NEARBY_MAP_HOPS);
        List<BehaviorContext.MapSummary> nearbyMaps = new ArrayList<>();
        List<BehaviorContext.FacilitySummary> currentMapFacilities = new ArrayList<>();
        List<BehaviorContext.FacilitySummary> nearbyFacilities = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : hops.entrySet()) {
            WorldMap nearby = world.getMap(entry.getKey());
            nearbyMaps.add(new BehaviorContext.MapSummary(nearby.getId(), nearby.getName(), entry.getValue()));
            List<BehaviorContext.FacilitySummary> target = entry.getValue() == 0 ? currentMapFacilities : nearbyFacilities;
            for (Obstacle obstacle : nearby.getObstacles()) {
                if (obstacle.hasFacility()) {
                    target.add(summarize(obstacle, nearby.getId(), entry.getValue()));
                }
            }
        }

        List<BehaviorContext.NpcSummary> npcs = new ArrayList<>();
        for (Npc npc : world.getNpcsOnMap(c.getCurrentMapId())) {
            PathNode npcNode = map != null ? map.getNode(npc.getNodeId()) : null;
            boolean adjacent = npcNode != null && npcNode.getConnectedTo().contains(c.getCurrentNodeId());
            npcs.add(new BehaviorContext.NpcSummary(npc.getId(), npc.getName(), npc.getNodeId(), adjacent,
                    npc.isInConversation()));
        }

        return new BehaviorContext(
                c.getId(),
                c.getName(),
                c.getNeeds(),
                c.getMoney(),
                c.getEmployment(),
                c.getCurrentMapId(),
                c.getCurrentNodeId(),
                currentFacility,
                time,
                schedules.getSchedule(agentId, time.day()),
                actions.getAvailableActions(agentId),
                npcs,
                currentMapFacilities,
                nearbyFacilities,
                nearbyMaps,
                history.recent(agentId, time.day(), historySize),
                forcedAction);
    }

    private static BehaviorContext.FacilitySummary summarize(Obstacle obstacle, String mapId, int hops) {
        FacilityInfo facility = obstacle.getFacility();
        return new BehaviorContext.FacilitySummary(obstacle.getId(),
                obstacle.getLabel() != null ? obstacle.getLabel() : obstacle.getId(),
                mapId, facility.tags(), facility.cost(), facility.quality(), facility.owner(), hops);
    }
}
