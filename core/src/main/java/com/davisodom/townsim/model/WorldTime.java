package com.davisodom.townsim.model;

/**
 * Simulated local time. {@code day} starts at 1 and increments at local midnight.
 */
public record WorldTime(int hour, int minute, int day) {

    public int minutesOfDay() {
        return hour * 60 + minute;
    }

    /**
     * "HH:MM" form used by schedules and history.
     */
    public String format() {
        return String.format("%02d:%02d", hour, minute);
    }

    /**
     * Parses "HH:MM" into minutes of day.
     *
     * @return minutes since midnight, or -1 when the string is malformed
     */
    public static int parseMinutes(String hhmm) {
        if (hhmm == null) {
            return -1;
        }
        String[] parts = hhmm.split(":");
        if (parts.length != 2) {
            return -1;
        }
        try {
            int hour = Integer.parseInt(parts[0].trim());
            int minute = Integer.parseInt(parts[1].trim());
            if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
                return -1;
            }
            return hour * 60 + minute;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /**
     * True when this time falls in [start, end]; ranges may wrap past midnight (22:00-06:00).
     */
    public boolean isWithin(int startMinutes, int endMinutes) {
        int t = minutesOfDay();
        if (startMinutes <= endMinutes) {
            return t >= startMinutes && t <= endMinutes;
        }
        return t >= startMinutes || t <= endMinutes;
    }
}
