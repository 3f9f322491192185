package com.davisodom.townsim;

import com.davisodom.townsim.config.SimulationConfig;

import java.util.logging.Logger;

/**
 * Debug flags and verbose logging helpers.
 * Gated lines carry the same subsystem markers as regular logging ([NAV], [DECIDE], [DECAY]).
 */
public class DebugFlags {

    private static final Logger LOGGER = Logger.getLogger(DebugFlags.class.getName());

    private final boolean debugNavigation;
    private final boolean debugDecisions;
    private final boolean debugDecay;
    private final boolean debugPerformance;

    public DebugFlags(boolean debugNavigation, boolean debugDecisions, boolean debugDecay, boolean debugPerformance) {
        this.debugNavigation = debugNavigation;
        this.debugDecisions = debugDecisions;
        this.debugDecay = debugDecay;
        this.debugPerformance = debugPerformance;
    }

    /**
     * Build flags from the {@code debug} config section.
     */
    public static DebugFlags from(SimulationConfig config) {
        SimulationConfig.Debug debug = config.debug != null ? config.debug : new SimulationConfig.Debug();
        DebugFlags flags = new DebugFlags(debug.navigation, debug.decisions, debug.decay, debug.performance);
        if (flags.isAnyDebugEnabled()) {
            LOGGER.info("[SIM] Debug flags initialized: navigation=" + flags.debugNavigation +
                    ", decisions=" + flags.debugDecisions +
                    ", decay=" + flags.debugDecay +
                    ", performance=" + flags.debugPerformance);
        }
        return flags;
    }

    public static DebugFlags disabled() {
        return new DebugFlags(false, false, false, false);
    }

    public boolean isDebugNavigation() { return debugNavigation; }
    public boolean isDebugDecisions() { return debugDecisions; }
    public boolean isDebugDecay() { return debugDecay; }
    public boolean isDebugPerformance() { return debugPerformance; }

    public boolean isAnyDebugEnabled() {
        return debugNavigation || debugDecisions || debugDecay || debugPerformance;
    }

    public void debugNavigation(String message) {
        if (debugNavigation) {
            LOGGER.info("[NAV] DEBUG: " + message);
        }
    }

    public void debugDecision(String message) {
        if (debugDecisions) {
            LOGGER.info("[DECIDE] DEBUG: " + message);
        }
    }

    public void debugDecay(String message) {
        if (debugDecay) {
            LOGGER.info("[DECAY] DEBUG: " + message);
        }
    }

    /**
     * Log a phase timing if performance debugging is enabled.
     */
    public void debugPerformance(String operation, long durationMicros) {
        if (debugPerformance) {
            LOGGER.info(String.format("[TICK] Performance DEBUG: %s took %.2fms", operation, durationMicros / 1000.0));
        }
    }
}
