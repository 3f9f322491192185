package com.davisodom.townsim.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Intent to start an action once the agent arrives. Cleared when the action starts
 * or the agent gives up on it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PendingAction(ActionId actionId,
                            String facilityId,
                            String targetNpcId,
                            String facilityMapId,
                            String reason,
                            Integer durationMinutes) {

    public static PendingAction forFacility(ActionId actionId, String facilityId, String facilityMapId,
                                            String reason, Integer durationMinutes) {
        return new PendingAction(actionId, facilityId, null, facilityMapId, reason, durationMinutes);
    }

    public static PendingAction forNpc(String npcId, String mapId, String reason) {
        return new PendingAction(ActionId.TALK, null, npcId, mapId, reason, null);
    }
}
