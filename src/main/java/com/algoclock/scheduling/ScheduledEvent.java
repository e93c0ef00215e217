package com.algoclock.scheduling;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collections;
import java.util.Iterator;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A named callback that fires at each time of its own ascending sequence of UTC instants.
 *
 * <p>The sequence is consumed through an iterator, so it may be a materialized list or an
 * unbounded lazy generator ("every day at 12:00"). The cursor is primed on construction:
 * {@link #getNextEventUtcTime()} always holds the earliest time not yet fired, or
 * {@link #END_OF_TIME} once the sequence is exhausted, after which the event is inert.
 *
 * <p>The sequence must already be ascending. This is not verified.
 *
 * <p>Not thread-safe. The owning scheduler serializes access.
 */
public class ScheduledEvent {

    private static final Logger log = LoggerFactory.getLogger(ScheduledEvent.class);

    /** Next-time value of an event whose sequence is exhausted. */
    public static final Instant END_OF_TIME = Instant.MAX;

    private final String name;
    private final ScheduledEventCallback callback;
    private final Iterator<Instant> eventUtcTimes;

    private Instant nextEventUtcTime;
    private long firedCount;
    private volatile boolean loggingEnabled;

    public ScheduledEvent(String name, Instant eventUtcTime, ScheduledEventCallback callback) {
        this(name, Collections.singletonList(eventUtcTime), callback);
    }

    public ScheduledEvent(String name, Iterable<Instant> eventUtcTimes, ScheduledEventCallback callback) {
        this(name, eventUtcTimes.iterator(), callback);
    }

    public ScheduledEvent(String name, Iterator<Instant> eventUtcTimes, ScheduledEventCallback callback) {
        this.name = Objects.requireNonNull(name, "name");
        this.callback = Objects.requireNonNull(callback, "callback");
        this.eventUtcTimes = Objects.requireNonNull(eventUtcTimes, "eventUtcTimes");
        moveNext();
    }

    public String getName() {
        return name;
    }

    /** Earliest scheduled time not yet fired, or {@link #END_OF_TIME}. */
    public Instant getNextEventUtcTime() {
        return nextEventUtcTime;
    }

    /** Returns true once every time in the sequence has fired or been skipped. */
    public boolean isExhausted() {
        return nextEventUtcTime == END_OF_TIME;
    }

    public boolean isLoggingEnabled() {
        return loggingEnabled;
    }

    public void setLoggingEnabled(boolean loggingEnabled) {
        this.loggingEnabled = loggingEnabled;
    }

    /**
     * Fires every pending occurrence scheduled at or before {@code utcTime}, oldest first.
     *
     * <p>Each invocation receives the occurrence's scheduled time, not {@code utcTime}. The cursor
     * moves past an occurrence even when its callback throws; the exception then propagates and
     * the remaining due occurrences stay pending for the next scan.
     *
     * @param utcTime the current time in UTC
     * @return the number of callback invocations
     */
    public int scan(Instant utcTime) {
        int fired = 0;
        while (!isExhausted() && !nextEventUtcTime.isAfter(utcTime)) {
            Instant triggerTime = nextEventUtcTime;
            if (loggingEnabled) {
                log.info("ScheduledEvent.{}: Firing at {} UTC, scheduled at {} UTC", name, utcTime, triggerTime);
            }
            try {
                callback.onEvent(name, triggerTime);
                fired++;
                firedCount++;
            } finally {
                moveNext();
            }
        }
        return fired;
    }

    /** Callback invocations that returned normally since the event was created. */
    public long getFiredCount() {
        return firedCount;
    }

    /**
     * Advances past every occurrence scheduled strictly before {@code utcTime} without firing.
     *
     * @return the number of skipped occurrences
     */
    public int skipEventsUntil(Instant utcTime) {
        int skipped = 0;
        while (!isExhausted() && nextEventUtcTime.isBefore(utcTime)) {
            moveNext();
            skipped++;
        }
        if (skipped > 0 && loggingEnabled) {
            log.info("ScheduledEvent.{}: Skipped {} past events, next event: {} UTC", name, skipped, nextEventUtcTime);
        }
        return skipped;
    }

    private void moveNext() {
        if (eventUtcTimes.hasNext()) {
            nextEventUtcTime = eventUtcTimes.next();
            if (loggingEnabled) {
                log.info("ScheduledEvent.{}: Next event: {} UTC", name, nextEventUtcTime);
            }
        } else {
            if (loggingEnabled && nextEventUtcTime != END_OF_TIME) {
                log.info("ScheduledEvent.{}: Completed scheduled events", name);
            }
            nextEventUtcTime = END_OF_TIME;
        }
    }

    @Override
    public String toString() {
        return name + " (next: " + (isExhausted() ? "never" : nextEventUtcTime) + ")";
    }

    /**
     * Event firing {@code timeOfDay} after local midnight of each date, in {@code zone}. The dates
     * are consumed lazily. A time of day of a full day or more lands on a later date.
     *
     * @param currentUtcTime when not null, occurrences at or before this instant are dropped
     */
    public static ScheduledEvent everyDayAt(
            String name,
            Stream<LocalDate> dates,
            Duration timeOfDay,
            ZoneId zone,
            ScheduledEventCallback callback,
            Instant currentUtcTime) {
        Stream<Instant> eventUtcTimes =
                dates.map(date -> date.atStartOfDay().plus(timeOfDay).atZone(zone).toInstant());
        if (currentUtcTime != null) {
            eventUtcTimes = eventUtcTimes.filter(time -> time.isAfter(currentUtcTime));
        }
        return new ScheduledEvent(name, eventUtcTimes.iterator(), callback);
    }

    /** Builds a scoped event name, e.g. {@code "Algorithm.EndOfDay"}. */
    public static String createEventName(String scope, String name) {
        return scope + "." + name;
    }
}
