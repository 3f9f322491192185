package com.davisodom.townsim.navigation;

import com.davisodom.townsim.model.PathNode;
import com.davisodom.townsim.model.WorldMap;

import java.util.*;
import java.util.logging.Logger;

/**
 * Unweighted breadth-first search over a map's node graph.
 *
 * Ties between equal-length paths resolve by discovery order: neighbors are expanded in
 * their {@code connectedTo} order, so the first shortest path found wins. Node pixel
 * coordinates play no part in the search.
 */
public class Pathfinder {

    private static final Logger LOGGER = Logger.getLogger(Pathfinder.class.getName());

    /**
     * Find a shortest path from {@code startId} to {@code endId}.
     *
     * @param blocked nodes that must not appear on the path (e.g. occupied by NPCs)
     * @return node ids from start to end inclusive; {@code [startId]} when start equals end;
     *         empty when the destination is blocked, either end is unknown, or no path exists
     */
    public List<String> findPath(WorldMap map, String startId, String endId, Set<String> blocked) {
        if (startId != null && startId.equals(endId)) {
            return List.of(startId);
        }
        // A blocked destination short-circuits before any search
        if (blocked.contains(endId)) {
            return Collections.emptyList();
        }
        if (!map.hasNode(startId) || !map.hasNode(endId)) {
            LOGGER.fine(String.format("[NAV] Unknown endpoint on %s: %s -> %s", map.getId(), startId, endId));
            return Collections.emptyList();
        }

        Map<String, String> parent = new HashMap<>();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        visited.add(startId);
        queue.add(startId);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(endId)) {
                return reconstruct(parent, startId, endId);
            }
            PathNode node = map.getNode(current);
            if (node == null) {
                continue;
            }
            for (String neighbor : node.getConnectedTo()) {
                if (visited.contains(neighbor) || blocked.contains(neighbor) || !map.hasNode(neighbor)) {
                    continue;
                }
                visited.add(neighbor);
                parent.put(neighbor, current);
                queue.add(neighbor);
            }
        }
        return Collections.emptyList();
    }

    public List<String> findPath(WorldMap map, String startId, String endId) {
        return findPath(map, startId, endId, Collections.emptySet());
    }

    private List<String> reconstruct(Map<String, String> parent, String startId, String endId) {
        LinkedList<String> path = new LinkedList<>();
        String current = endId;
        while (current != null) {
            path.addFirst(current);
            if (current.equals(startId)) {
                break;
            }
            current = parent.get(current);
        }
        return new ArrayList<>(path);
    }
}
