package com.davisodom.townsim.action;

import com.davisodom.townsim.model.NeedType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumMap;
import java.util.Map;

/**
 * Configured timing and effects of one action.
 *
 * Fixed actions run for {@code duration} minutes and apply {@code effects} once on completion.
 * Ranged actions run for a clamped requested duration and apply {@code perMinute} rates while
 * running, replacing decay for the needs they name.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActionDefinition {

    public boolean fixed = false;
    public int duration = 0;
    public Map<NeedType, Double> effects = new EnumMap<>(NeedType.class);
    public DurationRange durationRange;
    public Map<NeedType, Double> perMinute = new EnumMap<>(NeedType.class);
    public int cost = 0;
    public String emoji;

    public static class DurationRange {
        public int min;
        public int max;
        @JsonProperty("default")
        public int defaultMinutes;

        public DurationRange() {} // For Jackson

        public DurationRange(int min, int max, int defaultMinutes) {
            this.min = min;
            this.max = max;
            this.defaultMinutes = defaultMinutes;
        }
    }

    public static ActionDefinition fixed(int minutes, Map<NeedType, Double> effects) {
        ActionDefinition def = new ActionDefinition();
        def.fixed = true;
        def.duration = minutes;
        def.effects.putAll(effects);
        return def;
    }

    public static ActionDefinition ranged(int min, int max, int defaultMinutes, Map<NeedType, Double> perMinute) {
        ActionDefinition def = new ActionDefinition();
        def.durationRange = new DurationRange(min, max, defaultMinutes);
        def.perMinute.putAll(perMinute);
        return def;
    }

    public ActionDefinition withEmoji(String emoji) {
        this.emoji = emoji;
        return this;
    }

    /**
     * Effective duration in minutes for a requested value (null = default).
     */
    public int resolveDuration(Integer requestedMinutes) {
        if (fixed || durationRange == null) {
            return duration;
        }
        int requested = requestedMinutes != null ? requestedMinutes : durationRange.defaultMinutes;
        return Math.max(durationRange.min, Math.min(durationRange.max, requested));
    }

    /**
     * Per-minute rates while running; empty for fixed actions.
     */
    public Map<NeedType, Double> activeRates() {
        if (fixed || perMinute == null) {
            return Map.of();
        }
        return perMinute;
    }
}
