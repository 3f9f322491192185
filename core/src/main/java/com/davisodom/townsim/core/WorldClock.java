package com.davisodom.townsim.core;

import com.davisodom.townsim.model.WorldTime;

import java.time.*;
import java.time.temporal.ChronoUnit;
import java.util.logging.Logger;

/**
 * Derives {@link WorldTime} from wall-clock time in a configured timezone.
 *
 * Day 1 is the local calendar day on which the server started; the day number increments at
 * each local midnight after that, not at multiples of 24h from process start.
 */
public class WorldClock {

    private static final Logger LOGGER = Logger.getLogger(WorldClock.class.getName());

    public static final String DEFAULT_TIMEZONE = "Asia/Tokyo";

    private final ZoneId zone;
    private volatile long serverStartTime;
    private LocalDate startDate;

    public WorldClock(String timezone, long serverStartTime) {
        this.zone = resolveZone(timezone);
        setServerStartTime(serverStartTime);
    }

    /**
     * Parses a timezone id, falling back to {@value #DEFAULT_TIMEZONE} when it is invalid.
     */
    public static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.of(DEFAULT_TIMEZONE);
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            LOGGER.warning(String.format("[SIM] Invalid timezone '%s', using %s", timezone, DEFAULT_TIMEZONE));
            return ZoneId.of(DEFAULT_TIMEZONE);
        }
    }

    public WorldTime timeAt(long epochMillis) {
        ZonedDateTime now = Instant.ofEpochMilli(epochMillis).atZone(zone);
        long days = ChronoUnit.DAYS.between(startDate, now.toLocalDate());
        // Wall clock behind the anchor (restored start time in the future) still reports day 1
        int day = (int) Math.max(0, days) + 1;
        return new WorldTime(now.getHour(), now.getMinute(), day);
    }

    public ZoneId getZone() {
        return zone;
    }

    public long getServerStartTime() {
        return serverStartTime;
    }

    public void setServerStartTime(long serverStartTime) {
        this.serverStartTime = serverStartTime;
        this.startDate = Instant.ofEpochMilli(serverStartTime).atZone(zone).toLocalDate();
    }
}
