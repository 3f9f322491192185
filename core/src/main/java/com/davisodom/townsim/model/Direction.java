package com.davisodom.townsim.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Facing direction of an agent.
 */
public enum Direction {
    @JsonProperty("up") UP,
    @JsonProperty("down") DOWN,
    @JsonProperty("left") LEFT,
    @JsonProperty("right") RIGHT;

    /**
     * Direction of the dominant axis of the vector from {@code from} to {@code to}.
     * Ties resolve to the vertical axis.
     */
    public static Direction facing(Position from, Position to) {
        double dx = to.x() - from.x();
        double dy = to.y() - from.y();
        if (Math.abs(dx) > Math.abs(dy)) {
            return dx > 0 ? RIGHT : LEFT;
        }
        return dy > 0 ? DOWN : UP;
    }
}
