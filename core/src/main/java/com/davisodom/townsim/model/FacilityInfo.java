package com.davisodom.townsim.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Set;

/**
 * Facility data attached to an obstacle.
 *
 * @param tags    tags the facility carries
 * @param cost    money charged per use, 0 for free facilities
 * @param quality free-form rating exposed to deciders
 * @param owner   agent id that owns the facility, or null when shared
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FacilityInfo(List<FacilityTag> tags, int cost, int quality, String owner) {

    public FacilityInfo {
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public boolean hasTag(FacilityTag tag) {
        return tags.contains(tag);
    }

    public boolean hasAnyTag(Set<FacilityTag> candidates) {
        for (FacilityTag tag : tags) {
            if (candidates.contains(tag)) {
                return true;
            }
        }
        return false;
    }
}
