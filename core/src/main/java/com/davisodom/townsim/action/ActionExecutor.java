package com.davisodom.townsim.action;

import com.davisodom.townsim.model.ActionId;
import com.davisodom.townsim.model.NeedType;
import com.davisodom.townsim.model.Obstacle;

import java.util.List;
import java.util.Map;

/**
 * Owns the timed action lifecycle: start, tick, complete.
 *
 * Completions are announced as {@code ACTION_COMPLETED} events on the simulation's event bus.
 * All methods are called from the tick thread.
 */
public interface ActionExecutor {

    /**
     * Start an action for an idle agent.
     *
     * @param facilityId       facility to use, or null to use whatever facility the agent stands at
     * @param targetNpcId      conversation partner for {@code talk}
     * @param durationMinutes  requested duration, clamped to the action's range; null for its default
     * @return false when a precondition fails; nothing changes in that case
     */
    boolean startAction(String agentId, ActionId actionId, String facilityId, String targetNpcId,
                        Integer durationMinutes, String reason);

    /**
     * Complete every action whose end time has been reached.
     */
    void tick(long nowMillis);

    /**
     * Per-minute need rates of the agent's running action. They replace decay for the needs named.
     *
     * @return the rates, or null when no running action has any
     */
    Map<NeedType, Double> getActivePerMinuteEffects(String agentId);

    List<ActionId> getAvailableActions(String agentId);

    ActionCheck canExecuteAction(String agentId, ActionId actionId, String facilityId, String targetNpcId);

    /**
     * The facility the agent is standing at, or null.
     */
    Obstacle getCurrentFacility(String agentId);

    /**
     * Complete the running action now. The thinking placeholder is cleared without an event.
     */
    void forceCompleteAction(String agentId);

    boolean isExecutingAction(String agentId);
}
