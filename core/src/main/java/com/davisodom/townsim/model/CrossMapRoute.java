package com.davisodom.townsim.model;

import java.util.List;

/**
 * Ordered list of per-map segments leading from a start node to a target on another map.
 */
public record CrossMapRoute(List<RouteSegment> segments) {

    public CrossMapRoute {
        segments = List.copyOf(segments);
    }

    public RouteSegment segment(int index) {
        return segments.get(index);
    }

    public boolean hasMoreSegments(int currentIndex) {
        return currentIndex < segments.size() - 1;
    }

    public int totalHops() {
        int hops = 0;
        for (RouteSegment segment : segments) {
            hops += segment.path().size() - 1;
        }
        return hops;
    }
}
