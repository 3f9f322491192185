package com.davisodom.townsim.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum NodeType {
    @JsonProperty("waypoint") WAYPOINT,
    @JsonProperty("entrance") ENTRANCE,
    @JsonProperty("spawn") SPAWN
}
