package com.davisodom.townsim.model;

/**
 * Pixel position on a map.
 */
public record Position(double x, double y) {

    public double distanceTo(Position other) {
        double dx = other.x - x;
        double dy = other.y - y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    /**
     * Linear interpolation towards {@code target}; t=0 is this position, t=1 is the target.
     */
    public Position lerp(Position target, double t) {
        return new Position(x + (target.x - x) * t, y + (target.y - y) * t);
    }
}
