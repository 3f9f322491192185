package com.davisodom.townsim.action;

import com.davisodom.townsim.model.Obstacle;
import com.davisodom.townsim.model.ObstacleType;
import com.davisodom.townsim.model.PathNode;
import com.davisodom.townsim.model.WorldMap;

import java.util.Set;

/**
 * Grid geometry between path nodes and facilities.
 *
 * Node ids follow {@code {gridPrefix}-{row}-{col}}; nodes with other ids (entrances, named
 * spots) are never at a facility. A node is at a zone when it lies strictly inside it, and at a
 * building when it touches the footprint.
 */
public class FacilityLocator {

    /** Grid cell parsed from a node id. */
    public record GridCoord(int row, int col) {}

    private static final int BUILDING_PROXIMITY = 1;

    public GridCoord parseGridCoord(WorldMap map, String nodeId) {
        if (nodeId == null) {
            return null;
        }
        String prefix = map.getGridPrefix() + "-";
        if (!nodeId.startsWith(prefix)) {
            return null;
        }
        String[] parts = nodeId.substring(prefix.length()).split("-");
        if (parts.length != 2) {
            return null;
        }
        try {
            return new GridCoord(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Facility serving a node: a zone containing it, else a building within one cell.
     *
     * @return the facility obstacle, or null when the node serves none
     */
    public Obstacle findFacilityAt(WorldMap map, String nodeId) {
        GridCoord coord = parseGridCoord(map, nodeId);
        if (coord == null) {
            return null;
        }
        for (Obstacle obstacle : map.getObstacles()) {
            if (obstacle.hasFacility() && obstacle.getType() == ObstacleType.ZONE
                    && obstacle.containsInterior(coord.row(), coord.col())) {
                return obstacle;
            }
        }
        for (Obstacle obstacle : map.getObstacles()) {
            if (obstacle.hasFacility() && obstacle.getType() == ObstacleType.BUILDING
                    && obstacle.isNear(coord.row(), coord.col(), BUILDING_PROXIMITY)) {
                return obstacle;
            }
        }
        return null;
    }

    public boolean isNodeAtFacility(WorldMap map, String nodeId, Obstacle obstacle) {
        GridCoord coord = parseGridCoord(map, nodeId);
        if (coord == null) {
            return false;
        }
        if (obstacle.getType() == ObstacleType.ZONE) {
            return obstacle.containsInterior(coord.row(), coord.col());
        }
        return obstacle.isAdjacent(coord.row(), coord.col());
    }

    /**
     * First node, in map order, from which the facility can be used. Entrances are skipped.
     *
     * @param blocked nodes to skip (occupied by NPCs)
     * @return the node id, or null when the facility has no usable node
     */
    public String findFacilityTargetNode(WorldMap map, Obstacle obstacle, Set<String> blocked) {
        for (PathNode node : map.getNodes()) {
            if (!blocked.contains(node.getId()) && !node.isLinkedEntrance()
                    && isNodeAtFacility(map, node.getId(), obstacle)) {
                return node.getId();
            }
        }
        return null;
    }
}
