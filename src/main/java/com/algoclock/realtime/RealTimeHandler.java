package com.algoclock.realtime;

import com.algoclock.algorithm.Algorithm;
import com.algoclock.algorithm.EndOfDayHooks;
import com.algoclock.domain.model.Security;
import com.algoclock.domain.model.SecurityChanges;
import com.algoclock.scheduling.EventScheduler;
import com.algoclock.scheduling.ScheduledEvent;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connects one algorithm to an {@link EventScheduler}: registers its end-of-day events, keeps the
 * per-security ones in step with the algorithm's universe, and forwards time to the scheduler.
 *
 * <p>End-of-day events are only created for hooks the algorithm actually overrides.
 */
public class RealTimeHandler {

    private static final Logger log = LoggerFactory.getLogger(RealTimeHandler.class);

    private final EventScheduler eventScheduler;
    private final EndOfDayEventFactory endOfDayEventFactory;

    /** Per-security end-of-day events by symbol. */
    private final Map<String, ScheduledEvent> securityEndOfDayEvents = new ConcurrentHashMap<>();

    private Algorithm algorithm;
    private EndOfDayHooks endOfDayHooks;
    private LocalDate startDate;
    private LocalDate endDate;
    private volatile Instant currentUtcTime;

    public RealTimeHandler(EventScheduler eventScheduler, EndOfDayEventFactory endOfDayEventFactory) {
        this.eventScheduler = eventScheduler;
        this.endOfDayEventFactory = endOfDayEventFactory;
    }

    /**
     * Registers the algorithm's end-of-day events for [start, end].
     *
     * @param currentUtcTime occurrences at or before this instant are not registered; null keeps all
     */
    public void setup(Algorithm algorithm, LocalDate start, LocalDate end, Instant currentUtcTime) {
        this.algorithm = algorithm;
        this.startDate = start;
        this.endDate = end;
        this.currentUtcTime = currentUtcTime;
        this.endOfDayHooks = EndOfDayHooks.detect(algorithm);

        if (endOfDayHooks.hasAlgorithmEndOfDay()) {
            eventScheduler.add(endOfDayEventFactory.everyAlgorithmEndOfDay(algorithm, start, end, currentUtcTime));
        }
        if (endOfDayHooks.hasSecurityEndOfDay()) {
            for (Security security : algorithm.getSecurities().getAll()) {
                addSecurityEndOfDay(security, start, currentUtcTime);
            }
        }
        log.info(
                "RealTimeHandler setup for {}: algorithmEndOfDay={}, securityEndOfDay={}, events={}",
                algorithm.getName(),
                endOfDayHooks.hasAlgorithmEndOfDay(),
                endOfDayHooks.hasSecurityEndOfDay(),
                eventScheduler.size());
    }

    /**
     * Removes the end-of-day events of removed securities and creates them for added ones,
     * starting from the last time passed to {@link #setTime}.
     */
    public void onSecuritiesChanged(SecurityChanges changes) {
        checkSetup();
        if (changes.isEmpty()) {
            return;
        }
        for (Security security : changes.getRemovedSecurities()) {
            ScheduledEvent scheduledEvent = securityEndOfDayEvents.remove(security.getSymbol());
            if (scheduledEvent != null) {
                eventScheduler.remove(scheduledEvent);
            }
        }
        if (!endOfDayHooks.hasSecurityEndOfDay()) {
            return;
        }
        for (Security security : changes.getAddedSecurities()) {
            if (securityEndOfDayEvents.containsKey(security.getSymbol())) {
                continue;
            }
            Instant now = currentUtcTime;
            LocalDate start = now == null
                    ? startDate
                    : LocalDate.ofInstant(now, security.getExchangeHours().getTimeZone());
            addSecurityEndOfDay(security, start, now);
        }
    }

    /** Advances the scheduler to {@code utcTime}, firing the events that are due. */
    public void setTime(Instant utcTime) {
        currentUtcTime = utcTime;
        eventScheduler.setTime(utcTime);
    }

    /** Fires the events scheduled at or before {@code utcTime} that have not fired yet. */
    public void scanPastEvents(Instant utcTime) {
        currentUtcTime = utcTime;
        eventScheduler.scanPastEvents(utcTime);
    }

    /** Stops the scheduler. No event fires afterwards. */
    public void exit() {
        eventScheduler.stop();
        log.info("RealTimeHandler exited");
    }

    private void addSecurityEndOfDay(Security security, LocalDate start, Instant currentUtcTime) {
        ScheduledEvent scheduledEvent =
                endOfDayEventFactory.everySecurityEndOfDay(algorithm, security, start, endDate, currentUtcTime);
        securityEndOfDayEvents.put(security.getSymbol(), scheduledEvent);
        eventScheduler.add(scheduledEvent);
    }

    private void checkSetup() {
        if (algorithm == null) {
            throw new IllegalStateException("RealTimeHandler.setup() has not been called");
        }
    }
}
