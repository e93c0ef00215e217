package com.algoclock.scheduling;

import com.algoclock.exception.ScheduledEventException;
import com.algoclock.observability.SchedulerMetrics;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Event scheduler driven synchronously by the backtest loop through {@link #setTime(Instant)}.
 *
 * <p>Single-threaded: the thread that advances time is the one that runs every callback.
 * Callbacks may still add or remove events on this scheduler while it is scanning.
 *
 * <p>Fail-fast: an exception thrown by a callback stops the scan and reaches the caller of
 * {@link #setTime(Instant)} as a {@link ScheduledEventException}, so a broken algorithm ends
 * the run with a visible error. Events not yet visited stay pending.
 */
public class BacktestEventScheduler implements EventScheduler {

    private static final Logger log = LoggerFactory.getLogger(BacktestEventScheduler.class);

    private final ScheduledEventQueue queue = new ScheduledEventQueue();
    private final SchedulerMetrics schedulerMetrics;

    public BacktestEventScheduler() {
        this(SchedulerMetrics.inMemory());
    }

    public BacktestEventScheduler(SchedulerMetrics schedulerMetrics) {
        this.schedulerMetrics = schedulerMetrics;
    }

    @Override
    public boolean add(ScheduledEvent scheduledEvent) {
        boolean added = queue.add(scheduledEvent);
        if (added) {
            log.debug("Added scheduled event {}", scheduledEvent);
        }
        return added;
    }

    @Override
    public boolean remove(ScheduledEvent scheduledEvent) {
        boolean removed = queue.remove(scheduledEvent);
        if (removed) {
            log.debug("Removed scheduled event {}", scheduledEvent.getName());
        }
        return removed;
    }

    @Override
    public boolean contains(ScheduledEvent scheduledEvent) {
        return queue.contains(scheduledEvent);
    }

    @Override
    public void setTime(Instant utcTime) {
        scan(utcTime);
    }

    @Override
    public void scanPastEvents(Instant utcTime) {
        log.info("Scanning past events up to {}", utcTime);
        int fired = scan(utcTime);
        log.info("Past event scan complete: {} events fired", fired);
    }

    @Override
    public List<ScheduledEvent> getScheduledEvents() {
        return queue.snapshot();
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public SchedulerMode getMode() {
        return SchedulerMode.BACKTEST;
    }

    private int scan(Instant utcTime) {
        long startNanos = System.nanoTime();
        int[] fired = {0};
        try {
            queue.scan(utcTime, scheduledEvent -> {
                long firedBefore = scheduledEvent.getFiredCount();
                try {
                    fired[0] += scheduledEvent.scan(utcTime);
                } catch (RuntimeException e) {
                    fired[0] += (int) (scheduledEvent.getFiredCount() - firedBefore);
                    log.error("Scheduled event {} failed at {}", scheduledEvent.getName(), utcTime, e);
                    throw new ScheduledEventException(scheduledEvent.getName(), utcTime, e);
                }
            });
        } finally {
            schedulerMetrics.recordScan(SchedulerMode.BACKTEST, fired[0], System.nanoTime() - startNanos);
        }
        return fired[0];
    }
}
