package com.davisodom.townsim.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One line of a daily schedule, e.g. {@code 12:00 lunch @ cafe}.
 *
 * @param time "HH:MM"
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduleEntry(String time, String activity, String location, String note) {
}
