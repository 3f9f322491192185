package com.davisodom.townsim.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.*;

/**
 * A single map: its node graph, obstacles and spawn node.
 * Immutable after construction and safe to share between threads.
 */
public class WorldMap {

    private final String id;
    private final String name;
    private final String gridPrefix;
    private final List<PathNode> nodes;
    private final List<Obstacle> obstacles;
    private final String spawnNodeId;
    private final Map<String, PathNode> nodeIndex;

    @JsonCreator
    public WorldMap(@JsonProperty("id") String id,
                    @JsonProperty("name") String name,
                    @JsonProperty("gridPrefix") String gridPrefix,
                    @JsonProperty("nodes") List<PathNode> nodes,
                    @JsonProperty("obstacles") List<Obstacle> obstacles,
                    @JsonProperty("spawnNodeId") String spawnNodeId) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.name = name != null ? name : id;
        this.gridPrefix = gridPrefix != null ? gridPrefix : id;
        this.nodes = nodes != null ? Collections.unmodifiableList(new ArrayList<>(nodes)) : Collections.emptyList();
        this.obstacles = obstacles != null ? Collections.unmodifiableList(new ArrayList<>(obstacles)) : Collections.emptyList();
        this.spawnNodeId = spawnNodeId;

        Map<String, PathNode> index = new LinkedHashMap<>();
        for (PathNode node : this.nodes) {
            index.put(node.getId(), node);
        }
        this.nodeIndex = Collections.unmodifiableMap(index);
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getGridPrefix() { return gridPrefix; }
    public List<PathNode> getNodes() { return nodes; }
    public List<Obstacle> getObstacles() { return obstacles; }
    public String getSpawnNodeId() { return spawnNodeId; }

    /**
     * @return the node, or null when the id is unknown on this map
     */
    public PathNode getNode(String nodeId) {
        return nodeId == null ? null : nodeIndex.get(nodeId);
    }

    public boolean hasNode(String nodeId) {
        return nodeId != null && nodeIndex.containsKey(nodeId);
    }

    public Optional<Obstacle> findObstacle(String obstacleId) {
        return obstacles.stream().filter(o -> o.getId().equals(obstacleId)).findFirst();
    }

    /**
     * Entrance nodes that lead to another map, in declaration order.
     */
    @JsonIgnore
    public List<PathNode> getLinkedEntrances() {
        List<PathNode> result = new ArrayList<>();
        for (PathNode node : nodes) {
            if (node.isLinkedEntrance()) {
                result.add(node);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return String.format("WorldMap{id=%s, nodes=%d, obstacles=%d, spawn=%s}",
                id, nodes.size(), obstacles.size(), spawnNodeId);
    }

    /**
     * Builder for creating WorldMap instances.
     */
    public static class Builder {
        private final String id;
        private String name;
        private String gridPrefix;
        private final List<PathNode> nodes = new ArrayList<>();
        private final List<Obstacle> obstacles = new ArrayList<>();
        private String spawnNodeId;

        public Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder gridPrefix(String gridPrefix) {
            this.gridPrefix = gridPrefix;
            return this;
        }

        public Builder addNode(PathNode node) {
            this.nodes.add(node);
            return this;
        }

        public Builder addObstacle(Obstacle obstacle) {
            this.obstacles.add(obstacle);
            return this;
        }

        public Builder spawnNodeId(String spawnNodeId) {
            this.spawnNodeId = spawnNodeId;
            return this;
        }

        public WorldMap build() {
            String spawn = spawnNodeId;
            if (spawn == null && !nodes.isEmpty()) {
                spawn = nodes.get(0).getId();
            }
            return new WorldMap(id, name, gridPrefix, nodes, obstacles, spawn);
        }
    }
}
