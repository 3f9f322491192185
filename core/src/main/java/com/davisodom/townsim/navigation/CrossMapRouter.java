package com.davisodom.townsim.navigation;

import com.davisodom.townsim.model.CrossMapRoute;
import com.davisodom.townsim.model.RouteSegment;
import com.davisodom.townsim.model.WorldMap;

import java.util.*;
import java.util.logging.Logger;

/**
 * Composes routes across maps by following entrance links.
 *
 * Breadth-first over (map, entry node) states: an entrance is only usable when the
 * {@link Pathfinder} can reach it on its map under that map's blocked nodes, so the result
 * crosses the fewest maps among routes that actually exist. Entrances are tried in
 * declaration order.
 */
public class CrossMapRouter {

    private static final Logger LOGGER = Logger.getLogger(CrossMapRouter.class.getName());

    private final Pathfinder pathfinder;

    public CrossMapRouter(Pathfinder pathfinder) {
        this.pathfinder = pathfinder;
    }

    private record Hop(String mapId, String entryNodeId, List<RouteSegment> segments) {}

    /**
     * Plan a route from a node on one map to a node on another (or the same) map.
     *
     * @param blockedPerMap blocked node ids by map id; maps without an entry block nothing
     * @return the route, or null when no composed route exists
     */
    public CrossMapRoute planRoute(Map<String, WorldMap> maps,
                                   String startMapId, String startNodeId,
                                   String targetMapId, String targetNodeId,
                                   Map<String, Set<String>> blockedPerMap) {
        if (!maps.containsKey(startMapId) || !maps.containsKey(targetMapId)) {
            LOGGER.warning(String.format("[NAV] Unknown map in route %s -> %s", startMapId, targetMapId));
            return null;
        }

        MapGraph graph = MapGraph.build(maps);
        Set<String> visitedMaps = new HashSet<>();
        Deque<Hop> queue = new ArrayDeque<>();
        queue.add(new Hop(startMapId, startNodeId, List.of()));
        visitedMaps.add(startMapId);

        while (!queue.isEmpty()) {
            Hop hop = queue.poll();
            WorldMap map = maps.get(hop.mapId());
            Set<String> blocked = blockedPerMap.getOrDefault(hop.mapId(), Collections.emptySet());

            if (hop.mapId().equals(targetMapId)) {
                List<String> path = pathfinder.findPath(map, hop.entryNodeId(), targetNodeId, blocked);
                if (!path.isEmpty()) {
                    List<RouteSegment> segments = new ArrayList<>(hop.segments());
                    segments.add(new RouteSegment(hop.mapId(), path, null));
                    return new CrossMapRoute(segments);
                }
                // Target unreachable from this entry; other entries into the target map may still work
                visitedMaps.remove(targetMapId);
                continue;
            }

            for (MapGraph.Connection connection : graph.connectionsFrom(hop.mapId())) {
                String next = connection.toMapId();
                if (visitedMaps.contains(next) || !maps.containsKey(next)) {
                    continue;
                }
                WorldMap nextMap = maps.get(next);
                if (!nextMap.hasNode(connection.toEntranceId())) {
                    continue;
                }
                List<String> path = pathfinder.findPath(map, hop.entryNodeId(), connection.fromEntranceId(), blocked);
                if (path.isEmpty()) {
                    continue;
                }
                List<RouteSegment> segments = new ArrayList<>(hop.segments());
                segments.add(new RouteSegment(hop.mapId(), path, connection.fromEntranceId()));
                if (!next.equals(targetMapId)) {
                    visitedMaps.add(next);
                }
                queue.add(new Hop(next, connection.toEntranceId(), segments));
            }
        }

        LOGGER.info(String.format("[NAV] No route from %s/%s to %s/%s",
                startMapId, startNodeId, targetMapId, targetNodeId));
        return null;
    }
}
