package com.davisodom.townsim.model;

/**
 * Overlay on {@link NavigationState} while an agent follows a multi-map route.
 */
public record CrossMapNavigationState(boolean active,
                                      CrossMapRoute route,
                                      int currentSegmentIndex,
                                      String targetMapId,
                                      String targetNodeId) {

    public static final CrossMapNavigationState INACTIVE = new CrossMapNavigationState(false, null, 0, null, null);

    public RouteSegment currentSegment() {
        return route != null ? route.segment(currentSegmentIndex) : null;
    }

    public boolean hasMoreSegments() {
        return route != null && route.hasMoreSegments(currentSegmentIndex);
    }

    public CrossMapNavigationState advance() {
        return new CrossMapNavigationState(active, route, currentSegmentIndex + 1, targetMapId, targetNodeId);
    }
}
