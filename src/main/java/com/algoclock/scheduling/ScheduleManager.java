package com.algoclock.scheduling;

import com.algoclock.algorithm.SecurityRegistry;
import com.algoclock.config.SchedulerProperties;
import com.algoclock.scheduling.rules.DateRule;
import com.algoclock.scheduling.rules.DateRules;
import com.algoclock.scheduling.rules.TimeRule;
import com.algoclock.scheduling.rules.TimeRules;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Algorithm-facing entry point for user scheduled events.
 *
 * <p>Events registered here first skip every occurrence that lies before the current time of
 * {@code clock}, so a rule like "every day at 10:00" added at noon starts with tomorrow instead of
 * replaying its history.
 */
public class ScheduleManager {

    private static final Logger log = LoggerFactory.getLogger(ScheduleManager.class);

    private final EventScheduler eventScheduler;
    private final SecurityRegistry securities;
    private final Clock clock;
    private final DateRules dateRules;
    private final TimeRules timeRules;

    private volatile boolean eventLoggingEnabled;

    public ScheduleManager(
            EventScheduler eventScheduler,
            SecurityRegistry securities,
            ZoneId timeZone,
            Clock clock,
            SchedulerProperties schedulerProperties) {
        this.eventScheduler = eventScheduler;
        this.securities = securities;
        this.clock = clock;
        this.dateRules = new DateRules(securities, timeZone, clock);
        this.timeRules = new TimeRules(securities, timeZone);
        this.eventLoggingEnabled = schedulerProperties.isEventLoggingEnabled();
    }

    public DateRules getDateRules() {
        return dateRules;
    }

    public TimeRules getTimeRules() {
        return timeRules;
    }

    public boolean isEventLoggingEnabled() {
        return eventLoggingEnabled;
    }

    /** Default logging flag for events added from now on. */
    public void setEventLoggingEnabled(boolean eventLoggingEnabled) {
        this.eventLoggingEnabled = eventLoggingEnabled;
    }

    /**
     * Registers an event after skipping its occurrences before the current time. An occurrence at
     * exactly the current time is kept and fires on the next scan. An event that is already
     * registered is left untouched, so its pending occurrences and queue position are kept.
     *
     * @return false if the event was already registered
     */
    public boolean add(ScheduledEvent scheduledEvent) {
        if (eventScheduler.contains(scheduledEvent)) {
            log.debug("Scheduled event {} already registered", scheduledEvent.getName());
            return false;
        }
        if (eventLoggingEnabled) {
            scheduledEvent.setLoggingEnabled(true);
        }
        scheduledEvent.skipEventsUntil(clock.instant());
        boolean added = eventScheduler.add(scheduledEvent);
        if (added) {
            log.info("Scheduled event {}", scheduledEvent);
        }
        return added;
    }

    public boolean remove(ScheduledEvent scheduledEvent) {
        return eventScheduler.remove(scheduledEvent);
    }

    /**
     * Removes every registered event with the given name.
     *
     * @return the number of removed events
     */
    public int remove(String name) {
        int removed = 0;
        for (ScheduledEvent scheduledEvent : eventScheduler.getScheduledEvents()) {
            if (scheduledEvent.getName().equals(name) && eventScheduler.remove(scheduledEvent)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Removed {} scheduled event(s) named {}", removed, name);
        }
        return removed;
    }

    /** Schedules {@code callback} at the times of {@code timeRule} on the dates of {@code dateRule}. */
    public ScheduledEvent on(DateRule dateRule, TimeRule timeRule, ScheduledEventCallback callback) {
        return on(dateRule.getName() + ": " + timeRule.getName(), dateRule, timeRule, callback);
    }

    public ScheduledEvent on(String name, DateRule dateRule, TimeRule timeRule, ScheduledEventCallback callback) {
        Stream<Instant> eventTimes = timeRule.createUtcEventTimes(getDefaultDates(dateRule));
        ScheduledEvent scheduledEvent = new ScheduledEvent(name, eventTimes.iterator(), callback);
        add(scheduledEvent);
        return scheduledEvent;
    }

    /** Starts a fluent schedule with a generated name. */
    public FluentDateSpecifier event() {
        return new FluentScheduledEventBuilder(this, securities, null);
    }

    public FluentDateSpecifier event(String name) {
        return new FluentScheduledEventBuilder(this, securities, name);
    }

    public List<ScheduledEvent> getScheduledEvents() {
        return eventScheduler.getScheduledEvents();
    }

    /**
     * Dates of {@code dateRule} from the day before the current UTC date to
     * {@link DateRules#END_OF_TIME}. Starting a day early covers time zones behind UTC; past
     * occurrences are skipped on {@link #add}.
     */
    Stream<LocalDate> getDefaultDates(DateRule dateRule) {
        LocalDate start = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).minusDays(1);
        return dateRule.getDates(start, DateRules.END_OF_TIME);
    }
}
