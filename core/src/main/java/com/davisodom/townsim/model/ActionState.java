package com.davisodom.townsim.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The action an agent is currently performing. At most one per agent.
 *
 * @param targetEndTime epoch millis at which the action completes; equal to startTime for
 *                      actions that never complete on their own
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionState(ActionId actionId,
                          long startTime,
                          long targetEndTime,
                          String facilityId,
                          String targetNpcId,
                          Integer durationMinutes,
                          String reason) {

    @JsonIgnore
    public boolean isThinking() {
        return actionId == ActionId.THINKING;
    }
}
