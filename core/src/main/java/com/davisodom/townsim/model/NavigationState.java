package com.davisodom.townsim.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Single-map movement along a path.
 * {@code currentPathIndex} points at the node the agent is walking towards, and
 * {@code progress} runs from 0 (at startPosition) to 1 (at targetPosition).
 */
public record NavigationState(boolean moving,
                              List<String> path,
                              int currentPathIndex,
                              double progress,
                              Position startPosition,
                              Position targetPosition) {

    public static final NavigationState REST = new NavigationState(false, List.of(), 0, 0.0, null, null);

    public NavigationState {
        path = path != null ? List.copyOf(path) : List.of();
    }

    public String targetNodeId() {
        return currentPathIndex < path.size() ? path.get(currentPathIndex) : null;
    }

    @JsonIgnore
    public boolean isFinalStep() {
        return currentPathIndex >= path.size() - 1;
    }

    public NavigationState withProgress(double newProgress) {
        return new NavigationState(moving, path, currentPathIndex, newProgress, startPosition, targetPosition);
    }
}
