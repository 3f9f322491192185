package com.davisodom.townsim.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Facility tags drive which abstract actions an obstacle supports.
 */
public enum FacilityTag {
    @JsonProperty("bedroom") BEDROOM,
    @JsonProperty("kitchen") KITCHEN,
    @JsonProperty("restaurant") RESTAURANT,
    @JsonProperty("bathroom") BATHROOM,
    @JsonProperty("hotspring") HOTSPRING,
    @JsonProperty("toilet") TOILET,
    @JsonProperty("workspace") WORKSPACE,
    @JsonProperty("public") PUBLIC
}
