package com.algoclock.scheduling;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * A {@link Clock} whose instant only moves when told to. Backs simulated time in backtests, where
 * the simulation loop sets the clock before advancing the scheduler, and in tests.
 *
 * <p>Time never moves backwards: {@link #setInstant(Instant)} rejects earlier instants.
 */
public class ManualClock extends Clock {

    private final ZoneId zone;
    private volatile Instant instant;

    public ManualClock(Instant instant) {
        this(instant, ZoneOffset.UTC);
    }

    public ManualClock(Instant instant, ZoneId zone) {
        this.instant = instant;
        this.zone = zone;
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new ManualClock(instant, zone);
    }

    @Override
    public Instant instant() {
        return instant;
    }

    public synchronized void setInstant(Instant instant) {
        if (instant.isBefore(this.instant)) {
            throw new IllegalArgumentException("Clock cannot move backwards from " + this.instant + " to " + instant);
        }
        this.instant = instant;
    }

    public synchronized void advance(Duration duration) {
        setInstant(instant.plus(duration));
    }
}
