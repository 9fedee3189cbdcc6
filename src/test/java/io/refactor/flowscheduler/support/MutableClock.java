package io.refactor.flowscheduler.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** Fake clock that can be moved instantly (no sleeping). */
public final class MutableClock extends Clock {
    private volatile Instant now;
    private final ZoneId zoneId;

    public MutableClock(Instant start) {
        this(start, ZoneOffset.UTC);
    }

    private MutableClock(Instant start, ZoneId zoneId) {
        this.now = start;
        this.zoneId = zoneId;
    }

    public static MutableClock at(String isoInstant) {
        return new MutableClock(Instant.parse(isoInstant));
    }

    public void advance(Duration delta) { now = now.plus(delta); }

    public void set(Instant instant) { now = instant; }

    @Override public ZoneId getZone() { return zoneId; }
    @Override public Clock withZone(ZoneId zone) { return new MutableClock(now, zone); }
    @Override public Instant instant() { return now; }
}
