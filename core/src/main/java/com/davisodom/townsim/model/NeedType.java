package com.davisodom.townsim.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The five need stats. 100 is best, 0 is worst.
 */
public enum NeedType {
    @JsonProperty("satiety") SATIETY,
    @JsonProperty("energy") ENERGY,
    @JsonProperty("hygiene") HYGIENE,
    @JsonProperty("mood") MOOD,
    @JsonProperty("bladder") BLADDER;

    public static final double MIN = 0.0;
    public static final double MAX = 100.0;

    public static double clamp(double value) {
        return Math.max(MIN, Math.min(MAX, value));
    }
}
