package com.davisodom.townsim.model;

/**
 * Change a decision asks to make to today's schedule.
 */
public record ScheduleUpdate(Type type, ScheduleEntry entry) {

    public enum Type {
        ADD,
        REMOVE,
        MODIFY // replaces the entry at the same time, adds it when that time is absent
    }
}
