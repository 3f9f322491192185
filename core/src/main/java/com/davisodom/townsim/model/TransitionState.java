package com.davisodom.townsim.model;

/**
 * Map-change choreography. {@code progress} ramps 0 to 1 during FADE_OUT and 1 back to 0
 * during FADE_IN; the agent is moved to the target when FADE_OUT completes.
 */
public record TransitionState(Phase phase,
                              double progress,
                              String targetMapId,
                              String targetNodeId,
                              Position targetPosition) {

    public enum Phase {
        FADE_OUT,
        FADE_IN
    }

    public static TransitionState fadeOut(String targetMapId, String targetNodeId, Position targetPosition) {
        return new TransitionState(Phase.FADE_OUT, 0.0, targetMapId, targetNodeId, targetPosition);
    }

    public TransitionState with(Phase newPhase, double newProgress) {
        return new TransitionState(newPhase, newProgress, targetMapId, targetNodeId, targetPosition);
    }
}
