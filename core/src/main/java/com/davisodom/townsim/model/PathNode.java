package com.davisodom.townsim.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.*;

/**
 * Vertex of a map's walkable graph.
 * Immutable once loaded; entrance nodes may carry a {@link MapLink} to another map.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PathNode {

    private final String id;
    private final double x;
    private final double y;
    private final NodeType type;
    private final List<String> connectedTo;
    private final MapLink leadsTo;

    @JsonCreator
    public PathNode(@JsonProperty("id") String id,
                    @JsonProperty("x") double x,
                    @JsonProperty("y") double y,
                    @JsonProperty("type") NodeType type,
                    @JsonProperty("connectedTo") List<String> connectedTo,
                    @JsonProperty("leadsTo") MapLink leadsTo) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.x = x;
        this.y = y;
        this.type = type != null ? type : NodeType.WAYPOINT;
        this.connectedTo = connectedTo != null
                ? Collections.unmodifiableList(new ArrayList<>(connectedTo))
                : Collections.emptyList();
        this.leadsTo = leadsTo;
    }

    public PathNode(String id, double x, double y, NodeType type, List<String> connectedTo) {
        this(id, x, y, type, connectedTo, null);
    }

    public String getId() { return id; }
    public double getX() { return x; }
    public double getY() { return y; }
    public NodeType getType() { return type; }
    public List<String> getConnectedTo() { return connectedTo; }
    public MapLink getLeadsTo() { return leadsTo; }

    public Position position() {
        return new Position(x, y);
    }

    /**
     * True for entrance nodes that actually lead somewhere.
     */
    @JsonIgnore
    public boolean isLinkedEntrance() {
        return type == NodeType.ENTRANCE && leadsTo != null;
    }

    @Override
    public String toString() {
        return String.format("PathNode{id=%s, type=%s, links=%d%s}",
                id, type, connectedTo.size(), leadsTo != null ? ", leadsTo=" + leadsTo.mapId() : "");
    }
}
