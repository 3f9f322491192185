package com.davisodom.townsim.world;

import com.davisodom.townsim.model.Direction;
import com.davisodom.townsim.model.Position;

import java.util.Objects;

/**
 * Stationary non-player character. Occupies its node, which other agents route around.
 */
public class Npc {

    private final String id;
    private final String name;
    private final String mapId;
    private final String nodeId;
    private final Position position;
    private final Direction direction;
    private boolean inConversation;

    public Npc(String id, String name, String mapId, String nodeId, Position position, Direction direction) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.name = name != null ? name : id;
        this.mapId = Objects.requireNonNull(mapId, "mapId cannot be null");
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId cannot be null");
        this.position = Objects.requireNonNull(position, "position cannot be null");
        this.direction = direction != null ? direction : Direction.DOWN;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getMapId() { return mapId; }
    public String getNodeId() { return nodeId; }
    public Position getPosition() { return position; }
    public Direction getDirection() { return direction; }
    public boolean isInConversation() { return inConversation; }

    void setInConversation(boolean inConversation) { this.inConversation = inConversation; }

    @Override
    public String toString() {
        return String.format("Npc{id=%s, map=%s, node=%s}", id, mapId, nodeId);
    }
}
