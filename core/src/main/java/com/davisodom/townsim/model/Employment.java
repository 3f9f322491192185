package com.davisodom.townsim.model;

/**
 * Where and when an agent works. Hours may wrap past midnight for night shifts.
 *
 * @param startTime  "HH:MM"
 * @param endTime    "HH:MM", exclusive
 * @param hourlyWage money earned per hour worked
 */
public record Employment(String workplaceFacilityId, String startTime, String endTime, int hourlyWage) {
}
