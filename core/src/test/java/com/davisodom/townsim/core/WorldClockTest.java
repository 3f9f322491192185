package com.davisodom.townsim.core;

import com.davisodom.townsim.model.WorldTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

class WorldClockTest {

    private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");

    private static long tokyo(int day, int hour, int minute) {
        return ZonedDateTime.of(2024, 3, day, hour, minute, 0, 0, TOKYO).toInstant().toEpochMilli();
    }

    @Test
    @DisplayName("Local time comes from the configured zone")
    void testLocalTime() {
        WorldClock clock = new WorldClock("Asia/Tokyo", tokyo(10, 9, 0));

        assertEquals(new WorldTime(14, 35, 1), clock.timeAt(tokyo(10, 14, 35)));
    }

    @Test
    @DisplayName("Day increments at local midnight, not after 24 hours")
    void testDayBoundary() {
        WorldClock clock = new WorldClock("Asia/Tokyo", tokyo(10, 23, 50));

        assertEquals(1, clock.timeAt(tokyo(10, 23, 59)).day());
        assertEquals(2, clock.timeAt(tokyo(11, 0, 1)).day(), "Ten minutes later is already day 2");
        assertEquals(3, clock.timeAt(tokyo(12, 23, 0)).day());
    }

    @Test
    @DisplayName("Times before the start still report day 1")
    void testBeforeStart() {
        WorldClock clock = new WorldClock("Asia/Tokyo", tokyo(10, 12, 0));

        assertEquals(1, clock.timeAt(tokyo(8, 12, 0)).day());
    }

    @Test
    @DisplayName("Invalid or missing zones fall back to the default")
    void testZoneFallback() {
        assertEquals(TOKYO, WorldClock.resolveZone("Not/AZone"));
        assertEquals(TOKYO, WorldClock.resolveZone(null));
        assertEquals(ZoneId.of("UTC"), WorldClock.resolveZone(" UTC "));
    }

    @Test
    @DisplayName("Moving the start time re-anchors day 1")
    void testReanchor() {
        WorldClock clock = new WorldClock("UTC", tokyo(10, 12, 0));
        long later = tokyo(15, 12, 0);

        clock.setServerStartTime(later);

        assertEquals(1, clock.timeAt(later).day());
        assertEquals(later, clock.getServerStartTime());
    }
}
