package com.davisodom.townsim.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Abstract actions an agent can perform.
 * {@link #THINKING} is the placeholder shown while a behavior decision is in flight.
 */
public enum ActionId {
    @JsonProperty("eat") EAT,
    @JsonProperty("sleep") SLEEP,
    @JsonProperty("toilet") TOILET,
    @JsonProperty("bathe") BATHE,
    @JsonProperty("rest") REST,
    @JsonProperty("work") WORK,
    @JsonProperty("talk") TALK,
    @JsonProperty("thinking") THINKING;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a lowercase action id such as {@code "eat"}.
     *
     * @return the action, or null for unknown ids
     */
    public static ActionId fromId(String id) {
        if (id == null) {
            return null;
        }
        try {
            return ActionId.valueOf(id.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
