package com.davisodom.townsim.core;

/**
 * Every event the simulation publishes on its {@link EventBus}.
 */
public enum SimulationEventType {
    ACTION_STARTED,
    ACTION_COMPLETED,
    NAVIGATION_STARTED,
    NAVIGATION_COMPLETED,   // edge-triggered, once per finished trip
    MAP_TRANSITION_STARTED,
    MAP_CHANGED,
    NEED_THRESHOLD_CROSSED,
    DECISION_APPLIED,
    DAY_CHANGED
}
