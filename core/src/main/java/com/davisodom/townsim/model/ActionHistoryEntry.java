package com.davisodom.townsim.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What an agent did, for the decider's short-term memory.
 *
 * @param time     "HH:MM" world time
 * @param kind     action, move or idle
 * @param actionId the action for {@code kind == ACTION}
 * @param target   facility, NPC or map/node the entry refers to
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionHistoryEntry(String characterId,
                                 int day,
                                 String time,
                                 Kind kind,
                                 ActionId actionId,
                                 String target,
                                 Integer durationMinutes,
                                 String reason) {

    public enum Kind {
        ACTION,
        MOVE,
        IDLE
    }
}
