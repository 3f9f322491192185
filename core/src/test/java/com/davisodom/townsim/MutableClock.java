package com.davisodom.townsim;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock that only moves when a test advances it.
 */
public class MutableClock extends Clock {

    private long millis;
    private final ZoneId zone;

    public MutableClock(long startMillis) {
        this(startMillis, ZoneOffset.UTC);
    }

    public MutableClock(long startMillis, ZoneId zone) {
        this.millis = startMillis;
        this.zone = zone;
    }

    public void advance(long deltaMillis) {
        millis += deltaMillis;
    }

    public void set(long newMillis) {
        millis = newMillis;
    }

    @Override
    public long millis() {
        return millis;
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(millis);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId newZone) {
        return new MutableClock(millis, newZone);
    }
}
