package com.davisodom.townsim.model;

import java.util.Objects;

/**
 * Outcome of a behavior decision: stay idle, move somewhere, or perform an action.
 * Immutable; build through the static factories.
 */
public final class BehaviorDecision {

    public enum Kind {
        IDLE,
        MOVE,
        ACTION
    }

    private final Kind kind;
    private final String reason;
    private final String targetMapId;
    private final String targetNodeId;
    private final ActionId actionId;
    private final String targetFacilityId;
    private final String targetNpcId;
    private final Integer durationMinutes;
    private final ScheduleUpdate scheduleUpdate;

    private BehaviorDecision(Kind kind, String reason, String targetMapId, String targetNodeId,
                             ActionId actionId, String targetFacilityId, String targetNpcId,
                             Integer durationMinutes, ScheduleUpdate scheduleUpdate) {
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.reason = reason;
        this.targetMapId = targetMapId;
        this.targetNodeId = targetNodeId;
        this.actionId = actionId;
        this.targetFacilityId = targetFacilityId;
        this.targetNpcId = targetNpcId;
        this.durationMinutes = durationMinutes;
        this.scheduleUpdate = scheduleUpdate;
    }

    public static BehaviorDecision idle(String reason) {
        return new BehaviorDecision(Kind.IDLE, reason, null, null, null, null, null, null, null);
    }

    /**
     * Move to a node on another map, or on the current map when {@code targetMapId} is null.
     */
    public static BehaviorDecision move(String targetMapId, String targetNodeId, String reason) {
        return new BehaviorDecision(Kind.MOVE, reason, targetMapId, targetNodeId, null, null, null, null, null);
    }

    public static BehaviorDecision action(ActionId actionId, String targetFacilityId, Integer durationMinutes, String reason) {
        Objects.requireNonNull(actionId, "actionId cannot be null");
        return new BehaviorDecision(Kind.ACTION, reason, null, null, actionId, targetFacilityId, null, durationMinutes, null);
    }

    public static BehaviorDecision talk(String targetNpcId, String reason) {
        return new BehaviorDecision(Kind.ACTION, reason, null, null, ActionId.TALK, null, targetNpcId, null, null);
    }

    public BehaviorDecision withScheduleUpdate(ScheduleUpdate update) {
        return new BehaviorDecision(kind, reason, targetMapId, targetNodeId, actionId, targetFacilityId,
                targetNpcId, durationMinutes, update);
    }

    public Kind getKind() { return kind; }
    public String getReason() { return reason; }
    public String getTargetMapId() { return targetMapId; }
    public String getTargetNodeId() { return targetNodeId; }
    public ActionId getActionId() { return actionId; }
    public String getTargetFacilityId() { return targetFacilityId; }
    public String getTargetNpcId() { return targetNpcId; }
    public Integer getDurationMinutes() { return durationMinutes; }
    public ScheduleUpdate getScheduleUpdate() { return scheduleUpdate; }

    @Override
    public String toString() {
        switch (kind) {
            case MOVE:
                return String.format("move{map=%s, node=%s, reason=%s}", targetMapId, targetNodeId, reason);
            case ACTION:
                return String.format("action{%s, facility=%s, npc=%s, minutes=%s, reason=%s}",
                        actionId.id(), targetFacilityId, targetNpcId, durationMinutes, reason);
            default:
                return String.format("idle{reason=%s}", reason);
        }
    }
}
