package com.davisodom.townsim.config;

import com.davisodom.townsim.action.ActionDefinition;
import com.davisodom.townsim.model.ActionId;
import com.davisodom.townsim.model.NeedType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonMerge;

import java.util.EnumMap;
import java.util.Map;

/**
 * Simulation configuration bound from {@code townsim-config.yml}.
 *
 * Every field carries a default so a partial file (or none) still yields a runnable setup.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SimulationConfig {

    public Simulation simulation = new Simulation();
    public Movement movement = new Movement();
    public Time time = new Time();
    public Needs needs = new Needs();
    public Behavior behavior = new Behavior();
    @JsonMerge
    public Map<ActionId, ActionDefinition> actions = defaultActions();
    public Errors errors = new Errors();
    public Persistence persistence = new Persistence();
    public Debug debug = new Debug();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Simulation {
        public int tickRateHz = 20;
        public int notifyEveryTicks = 5;
        public long saveIntervalMs = 30_000;
        public long statusDecayIntervalMs = 60_000;
        public String currentMapId = "town";

        public long tickIntervalMs() {
            return Math.max(1, 1000L / Math.max(1, tickRateHz));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Movement {
        public double speed = 150.0;              // pixels per second
        public double transitionFadeSpeed = 2.0;  // progress per second, per ramp
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Time {
        public String timezone = "Asia/Tokyo";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Needs {
        public double interruptThreshold = 10.0;
        @JsonMerge
        public Map<NeedType, Double> decayPerMinute = defaultDecay();

        public double rate(NeedType need) {
            Double rate = decayPerMinute != null ? decayPerMinute.get(need) : null;
            return rate != null ? rate : 0.0;
        }

        private static Map<NeedType, Double> defaultDecay() {
            Map<NeedType, Double> rates = new EnumMap<>(NeedType.class);
            rates.put(NeedType.SATIETY, 0.15);
            rates.put(NeedType.ENERGY, 0.1);
            rates.put(NeedType.HYGIENE, 0.08);
            rates.put(NeedType.MOOD, 0.05);
            rates.put(NeedType.BLADDER, 0.2);
            return rates;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Behavior {
        public long idleRetryMs = 2_000;
        public long interruptIdleRetryMs = 5_000;
        public long moveRetryMs = 1_000;
        public long redecisionDelayMs = 1_000;
        public int wanderEveryActions = 3;
        public int wanderHopRadius = 2;
        public String safeMapId = "home";
        public double urgentThreshold = 20.0;
        public double restProbability = 0.1;
        public int historySize = 10;
        public String idleEmoji = "😶";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Errors {
        public boolean pauseOnCriticalError = true;
        public int maxConsecutiveFailures = 3;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Persistence {
        public boolean enabled = false;
        public String dataFolder = "data";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Debug {
        public boolean navigation = false;
        public boolean decisions = false;
        public boolean decay = false;
        public boolean performance = false;
    }

    public ActionDefinition action(ActionId actionId) {
        return actions != null ? actions.get(actionId) : null;
    }

    /**
     * Built-in action table used when the config file names none.
     */
    public static Map<ActionId, ActionDefinition> defaultActions() {
        Map<ActionId, ActionDefinition> defs = new EnumMap<>(ActionId.class);
        defs.put(ActionId.TOILET, ActionDefinition.fixed(5, Map.of(NeedType.BLADDER, 100.0)).withEmoji("🚽"));
        defs.put(ActionId.EAT, ActionDefinition.ranged(15, 60, 30,
                Map.of(NeedType.SATIETY, 2.0, NeedType.MOOD, 0.5)).withEmoji("🍽️"));
        defs.put(ActionId.SLEEP, ActionDefinition.ranged(60, 480, 120, Map.of(NeedType.ENERGY, 1.5)).withEmoji("💤"));
        defs.put(ActionId.BATHE, ActionDefinition.ranged(15, 60, 30,
                Map.of(NeedType.HYGIENE, 3.33, NeedType.MOOD, 0.5)).withEmoji("🛁"));
        defs.put(ActionId.REST, ActionDefinition.ranged(10, 60, 20,
                Map.of(NeedType.MOOD, 0.3, NeedType.ENERGY, 0.5)).withEmoji("☕"));
        defs.put(ActionId.WORK, ActionDefinition.ranged(60, 480, 240, Map.of()).withEmoji("💼"));
        defs.put(ActionId.TALK, ActionDefinition.ranged(5, 30, 10, Map.of(NeedType.MOOD, 0.5)).withEmoji("💬"));
        return defs;
    }
}
