package com.davisodom.townsim.needs;

import com.davisodom.townsim.DebugFlags;
import com.davisodom.townsim.action.ActionExecutor;
import com.davisodom.townsim.config.SimulationConfig;
import com.davisodom.townsim.core.EventBus;
import com.davisodom.townsim.core.SimulationEvent;
import com.davisodom.townsim.model.NeedType;
import com.davisodom.townsim.model.NeedValues;
import com.davisodom.townsim.world.SimCharacter;
import com.davisodom.townsim.world.WorldState;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Elapsed-time need decay with edge-triggered interrupts.
 *
 * Each need loses {@code rate * minutes}, unless the agent's running action reports a per-minute
 * rate for it; that rate then replaces decay for the need. After all needs are updated, the first
 * need in {@link #INTERRUPT_PRIORITY} that went from at-or-above the threshold to below it raises
 * one interrupt. Mood never interrupts.
 */
public class NeedDecayModel {

    private static final Logger LOGGER = Logger.getLogger(NeedDecayModel.class.getName());

    public static final List<NeedType> INTERRUPT_PRIORITY =
            List.of(NeedType.BLADDER, NeedType.SATIETY, NeedType.ENERGY, NeedType.HYGIENE);

    private final WorldState world;
    private final ActionExecutor actions;
    private final EventBus events;
    private final SimulationConfig.Needs config;
    private final DebugFlags debug;

    public NeedDecayModel(WorldState world, ActionExecutor actions, EventBus events,
                          SimulationConfig.Needs config, DebugFlags debug) {
        this.world = world;
        this.actions = actions;
        this.events = events;
        this.config = config;
        this.debug = debug;
    }

    /**
     * Decay every character by {@code elapsedMinutes}.
     *
     * @return interrupts raised, at most one per agent
     */
    public List<NeedInterrupt> applyDecay(double elapsedMinutes) {
        double minutes = Math.max(0.0, elapsedMinutes);
        List<NeedInterrupt> interrupts = new ArrayList<>();
        for (SimCharacter c : world.getCharacters()) {
            try {
                NeedValues before = c.getNeeds();
                NeedValues after = computeNeeds(before, actions.getActivePerMinuteEffects(c.getId()), minutes);
                world.updateNeeds(c.getId(), after);
                debug.debugDecay(String.format("%s over %.2f min: %s", c.getId(), minutes, after));

                NeedInterrupt interrupt = detectCrossing(c.getId(), before, after);
                if (interrupt != null) {
                    LOGGER.info(String.format("[DECAY] %s: %s fell below %.1f (%.1f -> %.1f)", c.getId(),
                            interrupt.need().name().toLowerCase(Locale.ROOT), config.interruptThreshold,
                            interrupt.previousValue(), interrupt.newValue()));
                    interrupts.add(interrupt);
                    events.publish(SimulationEvent.needThresholdCrossed(c.getId(), interrupt.need()));
                }
            } catch (RuntimeException e) {
                LOGGER.log(Level.SEVERE, "[DECAY] Decay failed for " + c.getId(), e);
            }
        }
        return interrupts;
    }

    /**
     * New need values after {@code minutes}; an override rate replaces the decay of its need.
     */
    public NeedValues computeNeeds(NeedValues current, Map<NeedType, Double> overrides, double minutes) {
        Map<NeedType, Double> next = new EnumMap<>(NeedType.class);
        for (NeedType need : NeedType.values()) {
            double value = current.get(need);
            Double override = overrides != null ? overrides.get(need) : null;
            if (override != null) {
                next.put(need, NeedType.clamp(value + override * minutes));
            } else {
                next.put(need, NeedType.clamp(value - config.rate(need) * minutes));
            }
        }
        return NeedValues.of(next);
    }

    NeedInterrupt detectCrossing(String agentId, NeedValues before, NeedValues after) {
        double threshold = config.interruptThreshold;
        for (NeedType need : INTERRUPT_PRIORITY) {
            if (before.get(need) >= threshold && after.get(need) < threshold) {
                return new NeedInterrupt(agentId, need, before.get(need), after.get(need));
            }
        }
        return null;
    }
}
