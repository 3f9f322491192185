package com.davisodom.townsim.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ObstacleType {
    @JsonProperty("building") BUILDING, // solid footprint, used from adjacent cells
    @JsonProperty("zone") ZONE          // walkable area, used from interior cells
}
