package com.davisodom.townsim.behavior;

import com.davisodom.townsim.model.*;

import java.util.List;

/**
 * Read-only view of one agent's situation handed to a {@link BehaviorDecider}.
 *
 * @param forcedAction action category an interrupt decision must satisfy, null otherwise
 */
public record BehaviorContext(String agentId,
                              String agentName,
                              NeedValues needs,
                              int money,
                              Employment employment,
                              String currentMapId,
                              String currentNodeId,
                              FacilitySummary currentFacility,
                              WorldTime time,
                              DailySchedule schedule,
                              List<ActionId> availableActions,
                              List<NpcSummary> nearbyNpcs,
                              List<FacilitySummary> currentMapFacilities,
                              List<FacilitySummary> nearbyFacilities,
                              List<MapSummary> nearbyMaps,
                              List<ActionHistoryEntry> recentHistory,
                              ActionId forcedAction) {

    public BehaviorContext {
        availableActions = List.copyOf(availableActions);
        nearbyNpcs = List.copyOf(nearbyNpcs);
        currentMapFacilities = List.copyOf(currentMapFacilities);
        nearbyFacilities = List.copyOf(nearbyFacilities);
        nearbyMaps = List.copyOf(nearbyMaps);
        recentHistory = List.copyOf(recentHistory);
    }

    /**
     * A facility and how many map hops away it is (0 = current map).
     */
    public record FacilitySummary(String id, String label, String mapId, List<FacilityTag> tags,
                                  int cost, int quality, String owner, int hops) {}

    /**
     * @param adjacent true when the NPC stands on a node connected to the agent's node
     */
    public record NpcSummary(String id, String name, String nodeId, boolean adjacent, boolean inConversation) {}

    public record MapSummary(String id, String name, int hops) {}

    public boolean isInterrupt() {
        return forcedAction != null;
    }
}
