package com.davisodom.townsim.core;

import com.davisodom.townsim.model.ActionId;
import com.davisodom.townsim.model.NeedType;

import java.util.Objects;

/**
 * Immutable event payload. Fields irrelevant to a type are null.
 */
public final class SimulationEvent {

    private final SimulationEventType type;
    private final String agentId;
    private final ActionId actionId;
    private final String mapId;
    private final String nodeId;
    private final NeedType need;
    private final String detail;

    private SimulationEvent(SimulationEventType type, String agentId, ActionId actionId, String mapId,
                            String nodeId, NeedType need, String detail) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.agentId = agentId;
        this.actionId = actionId;
        this.mapId = mapId;
        this.nodeId = nodeId;
        this.need = need;
        this.detail = detail;
    }

    public static SimulationEvent actionStarted(String agentId, ActionId actionId, String target) {
        return new SimulationEvent(SimulationEventType.ACTION_STARTED, agentId, actionId, null, null, null, target);
    }

    public static SimulationEvent actionCompleted(String agentId, ActionId actionId) {
        return new SimulationEvent(SimulationEventType.ACTION_COMPLETED, agentId, actionId, null, null, null, null);
    }

    public static SimulationEvent navigationStarted(String agentId, String mapId, String nodeId) {
        return new SimulationEvent(SimulationEventType.NAVIGATION_STARTED, agentId, null, mapId, nodeId, null, null);
    }

    public static SimulationEvent navigationCompleted(String agentId, String mapId, String nodeId) {
        return new SimulationEvent(SimulationEventType.NAVIGATION_COMPLETED, agentId, null, mapId, nodeId, null, null);
    }

    public static SimulationEvent transitionStarted(String agentId, String targetMapId, String targetNodeId) {
        return new SimulationEvent(SimulationEventType.MAP_TRANSITION_STARTED, agentId, null, targetMapId, targetNodeId, null, null);
    }

    public static SimulationEvent mapChanged(String agentId, String mapId, String nodeId) {
        return new SimulationEvent(SimulationEventType.MAP_CHANGED, agentId, null, mapId, nodeId, null, null);
    }

    public static SimulationEvent needThresholdCrossed(String agentId, NeedType need) {
        return new SimulationEvent(SimulationEventType.NEED_THRESHOLD_CROSSED, agentId, null, null, null, need, null);
    }

    public static SimulationEvent decisionApplied(String agentId, String decision) {
        return new SimulationEvent(SimulationEventType.DECISION_APPLIED, agentId, null, null, null, null, decision);
    }

    public static SimulationEvent dayChanged(int day) {
        return new SimulationEvent(SimulationEventType.DAY_CHANGED, null, null, null, null, null, String.valueOf(day));
    }

    public SimulationEventType getType() { return type; }
    public String getAgentId() { return agentId; }
    public ActionId getActionId() { return actionId; }
    public String getMapId() { return mapId; }
    public String getNodeId() { return nodeId; }
    public NeedType getNeed() { return need; }
    public String getDetail() { return detail; }

    @Override
    public String toString() {
        return String.format("SimulationEvent{type=%s, agent=%s, action=%s, map=%s, node=%s, need=%s, detail=%s}",
                type, agentId, actionId != null ? actionId.id() : null, mapId, nodeId, need, detail);
    }
}
