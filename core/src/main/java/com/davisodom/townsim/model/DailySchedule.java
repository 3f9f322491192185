package com.davisodom.townsim.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A character's schedule for one world day, entries sorted by time.
 */
public record DailySchedule(String characterId, int day, List<ScheduleEntry> entries) {

    public DailySchedule {
        List<ScheduleEntry> sorted = new ArrayList<>(entries != null ? entries : List.of());
        sorted.sort(Comparator.comparingInt(e -> WorldTime.parseMinutes(e.time())));
        entries = List.copyOf(sorted);
    }

    public DailySchedule forDay(int newDay) {
        return new DailySchedule(characterId, newDay, entries);
    }

    /**
     * Latest entry whose time is not after {@code time}, or null before the first entry.
     */
    public ScheduleEntry activeEntry(WorldTime time) {
        ScheduleEntry active = null;
        for (ScheduleEntry entry : entries) {
            int minutes = WorldTime.parseMinutes(entry.time());
            if (minutes >= 0 && minutes <= time.minutesOfDay()) {
                active = entry;
            }
        }
        return active;
    }
}
