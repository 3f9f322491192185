package com.davisodom.townsim.world;

import com.davisodom.townsim.model.Direction;
import com.davisodom.townsim.model.Position;

/**
 * Serialized form of an {@link Npc}.
 */
public record NpcSnapshot(String id, String name, String mapId, String nodeId, Position position,
                          Direction direction, boolean inConversation) {

    static NpcSnapshot of(Npc npc) {
        return new NpcSnapshot(npc.getId(), npc.getName(), npc.getMapId(), npc.getNodeId(),
                npc.getPosition(), npc.getDirection(), npc.isInConversation());
    }
}
