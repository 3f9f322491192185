package com.davisodom.townsim.data;

import com.davisodom.townsim.model.Direction;
import com.davisodom.townsim.model.WorldMap;
import com.davisodom.townsim.world.Npc;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * An NPC as declared in world data.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NpcDefinition(String id, String name, String mapId, String nodeId, Direction direction) {

    public Npc toNpc(WorldMap map) {
        return new Npc(id, name, mapId, nodeId, map.getNode(nodeId).position(), direction);
    }
}
