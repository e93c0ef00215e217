package com.algoclock.scheduling;

import java.time.Instant;
import java.util.List;

/**
 * Holds scheduled events and fires the ones that are due as time advances.
 *
 * <p>Ordering guarantee shared by all implementations: events whose next times are due are
 * visited earliest first, and events sharing a time are visited in the order they were added.
 * Each visited event fires all of its own due occurrences before the next event is visited.
 *
 * <p>Callbacks may call {@link #add} and {@link #remove} on the scheduler that is firing them.
 * A removed event that has not fired yet in the current scan does not fire; an added event is
 * considered from the next scan on.
 */
public interface EventScheduler {

    /**
     * Registers an event. Distinct events sharing a name are allowed and all fire.
     *
     * @return false if the same instance is already registered
     */
    boolean add(ScheduledEvent scheduledEvent);

    /**
     * Unregisters an event. Removing an unknown or already removed event is a no-op.
     *
     * @return false if the event was not registered
     */
    boolean remove(ScheduledEvent scheduledEvent);

    /** Returns true if this instance is registered. */
    boolean contains(ScheduledEvent scheduledEvent);

    /** Fires every event due at or before {@code utcTime}. */
    void setTime(Instant utcTime);

    /**
     * Fires the backlog of events due at or before {@code utcTime}. Same semantics as
     * {@link #setTime}; used once after setup to replay events scheduled in the past.
     */
    void scanPastEvents(Instant utcTime);

    /** Registered events in firing order. */
    List<ScheduledEvent> getScheduledEvents();

    /** Number of registered events, exhausted ones included. */
    int size();

    /** Releases the scheduler's resources. No event fires afterwards. */
    default void stop() {}

    /** Identifies the variant in logs and metrics. */
    SchedulerMode getMode();
}
