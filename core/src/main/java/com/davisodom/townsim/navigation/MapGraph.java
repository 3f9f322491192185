package com.davisodom.townsim.navigation;

import com.davisodom.townsim.model.PathNode;
import com.davisodom.townsim.model.WorldMap;

import java.util.*;

/**
 * Map-level connectivity built from entrance {@code leadsTo} links.
 * Immutable snapshot of the maps it was built from.
 */
public class MapGraph {

    /**
     * A directed map-to-map edge through one entrance pair.
     */
    public record Connection(String fromMapId, String fromEntranceId, String toMapId, String toEntranceId) {}

    private final Map<String, List<Connection>> adjacency;

    private MapGraph(Map<String, List<Connection>> adjacency) {
        this.adjacency = adjacency;
    }

    public static MapGraph build(Map<String, WorldMap> maps) {
        Map<String, List<Connection>> adjacency = new LinkedHashMap<>();
        for (WorldMap map : maps.values()) {
            List<Connection> edges = new ArrayList<>();
            for (PathNode node : map.getLinkedEntrances()) {
                edges.add(new Connection(map.getId(), node.getId(),
                        node.getLeadsTo().mapId(), node.getLeadsTo().nodeId()));
            }
            adjacency.put(map.getId(), Collections.unmodifiableList(edges));
        }
        return new MapGraph(Collections.unmodifiableMap(adjacency));
    }

    public List<Connection> connectionsFrom(String mapId) {
        return adjacency.getOrDefault(mapId, Collections.emptyList());
    }

    /**
     * Hop distance to every map reachable within {@code maxHops}, the start map included at 0.
     * Iteration order is BFS discovery order.
     */
    public Map<String, Integer> hopDistances(String fromMapId, int maxHops) {
        Map<String, Integer> distances = new LinkedHashMap<>();
        if (!adjacency.containsKey(fromMapId)) {
            return distances;
        }
        distances.put(fromMapId, 0);
        Deque<String> queue = new ArrayDeque<>();
        queue.add(fromMapId);
        while (!queue.isEmpty()) {
            String mapId = queue.poll();
            int distance = distances.get(mapId);
            if (distance >= maxHops) {
                continue;
            }
            for (Connection connection : connectionsFrom(mapId)) {
                if (!distances.containsKey(connection.toMapId()) && adjacency.containsKey(connection.toMapId())) {
                    distances.put(connection.toMapId(), distance + 1);
                    queue.add(connection.toMapId());
                }
            }
        }
        return distances;
    }
}
