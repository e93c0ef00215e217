package com.algoclock.scheduling;

import com.algoclock.observability.SchedulerMetrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Event scheduler paced by the wall clock.
 *
 * <p>A dedicated daemon thread samples {@link Clock#instant()} every {@code scanInterval} and fires
 * the events that are due, while the algorithm thread adds and removes events as the universe
 * changes. One {@link ReentrantLock} guards the event queue:
 * <ul>
 *   <li>{@link #add}, {@link #remove} and snapshot reads take the lock, so the sampler never sees a
 *       half-applied change</li>
 *   <li>the sampler holds the lock for the whole scan, callbacks included</li>
 *   <li>a callback calling {@link #add} or {@link #remove} re-enters the lock on the same thread</li>
 * </ul>
 *
 * <p>Availability over fail-fast: a callback failure, {@link AssertionError} and other errors
 * included, is logged, handed to the {@link ScheduledEventErrorHandler}, and the scan continues
 * with the next event. Only a {@link VirtualMachineError} ends the sampler, and it marks the
 * scheduler as not running first.
 *
 * <p>{@link #stop()} wakes the sampler out of its wait and joins it for at most
 * {@code stopTimeout}. A callback that never returns is not interrupted; the join times out and
 * the sampler is abandoned as a daemon thread. Events still due in a scan that is in progress
 * when stop() is called are not fired.
 */
public class LiveEventScheduler implements EventScheduler, SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(LiveEventScheduler.class);

    private final ScheduledEventQueue queue = new ScheduledEventQueue();
    private final ReentrantLock lock = new ReentrantLock();

    /** Separate from {@link #lock} so stop() never waits behind a running scan. */
    private final ReentrantLock wakeLock = new ReentrantLock();

    private final Condition wakeUp = wakeLock.newCondition();

    private final Clock clock;
    private final Duration scanInterval;
    private final Duration stopTimeout;
    private final ScheduledEventErrorHandler errorHandler;
    private final SchedulerMetrics schedulerMetrics;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread samplerThread;
    private volatile boolean stopRequested;

    public LiveEventScheduler(
            Clock clock,
            Duration scanInterval,
            Duration stopTimeout,
            ScheduledEventErrorHandler errorHandler,
            SchedulerMetrics schedulerMetrics) {
        if (scanInterval.isZero() || scanInterval.isNegative()) {
            throw new IllegalArgumentException("Scan interval must be positive: " + scanInterval);
        }
        this.clock = clock;
        this.scanInterval = scanInterval;
        this.stopTimeout = stopTimeout;
        this.errorHandler = errorHandler;
        this.schedulerMetrics = schedulerMetrics;
    }

    @Override
    public boolean add(ScheduledEvent scheduledEvent) {
        lock.lock();
        try {
            boolean added = queue.add(scheduledEvent);
            if (added) {
                log.debug("Added scheduled event {}", scheduledEvent);
            }
            return added;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean remove(ScheduledEvent scheduledEvent) {
        lock.lock();
        try {
            boolean removed = queue.remove(scheduledEvent);
            if (removed) {
                log.debug("Removed scheduled event {}", scheduledEvent.getName());
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean contains(ScheduledEvent scheduledEvent) {
        lock.lock();
        try {
            return queue.contains(scheduledEvent);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fires every event due at {@code utcTime}. Called by the sampler on each tick, and callable
     * directly from any thread.
     */
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
        lock.lock();
        try {
            return queue.snapshot();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /** Earliest pending event time, or {@link ScheduledEvent#END_OF_TIME}. */
    public Instant getNextEventUtcTime() {
        lock.lock();
        try {
            return queue.peekNextEventUtcTime();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public SchedulerMode getMode() {
        return SchedulerMode.LIVE;
    }

    public Duration getScanInterval() {
        return scanInterval;
    }

    /** Starts the sampler thread. Calling it on a running scheduler does nothing. */
    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            stopRequested = false;
            Thread thread = new Thread(this::sampleLoop, "live-event-scheduler");
            thread.setDaemon(true);
            samplerThread = thread;
            thread.start();
            log.info("LiveEventScheduler started: scanInterval={}", scanInterval);
        }
    }

    /**
     * Stops the sampler and waits at most {@code stopTimeout} for it to exit. Safe to call at any
     * time, repeatedly, and from a callback running on the sampler thread.
     */
    @Override
    public void stop() {
        stopRequested = true;
        if (!running.compareAndSet(true, false)) {
            return;
        }
        signalWakeUp();

        Thread thread = samplerThread;
        if (thread == null || thread == Thread.currentThread()) {
            log.info("LiveEventScheduler stopping");
            return;
        }
        try {
            thread.join(stopTimeout.toMillis());
            if (thread.isAlive()) {
                log.warn("LiveEventScheduler sampler did not exit within {}, a callback may be blocked", stopTimeout);
            } else {
                log.info("LiveEventScheduler stopped");
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for LiveEventScheduler to stop");
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Stop before the components whose callbacks it drives
        return Integer.MAX_VALUE - 100;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    private void sampleLoop() {
        while (running.get()) {
            try {
                scan(clock.instant());
            } catch (RuntimeException e) {
                log.error("LiveEventScheduler tick failed, continuing", e);
            } catch (Error e) {
                running.set(false);
                stopRequested = true;
                log.error("LiveEventScheduler sampler stopped by a fatal error", e);
                throw e;
            }
            awaitNextTick();
        }
        log.debug("LiveEventScheduler sampler exiting");
    }

    private void awaitNextTick() {
        wakeLock.lock();
        try {
            long remainingNanos = scanInterval.toNanos();
            while (running.get() && remainingNanos > 0) {
                remainingNanos = wakeUp.awaitNanos(remainingNanos);
            }
        } catch (InterruptedException e) {
            log.info("LiveEventScheduler sampler interrupted");
            running.set(false);
            Thread.currentThread().interrupt();
        } finally {
            wakeLock.unlock();
        }
    }

    private void signalWakeUp() {
        wakeLock.lock();
        try {
            wakeUp.signalAll();
        } finally {
            wakeLock.unlock();
        }
    }

    private int scan(Instant utcTime) {
        long startNanos = System.nanoTime();
        int[] fired = {0};
        lock.lock();
        try {
            queue.scan(utcTime, scheduledEvent -> {
                if (!stopRequested) {
                    fired[0] += scanSafely(scheduledEvent, utcTime);
                }
            });
        } finally {
            lock.unlock();
            schedulerMetrics.recordScan(SchedulerMode.LIVE, fired[0], System.nanoTime() - startNanos);
        }
        return fired[0];
    }

    /**
     * Scans one event, absorbing callback failures. An event whose callback throws moves past the
     * failing occurrence; its remaining due occurrences fire on the next tick.
     *
     * @return the occurrences fired before any failure
     */
    private int scanSafely(ScheduledEvent scheduledEvent, Instant utcTime) {
        long firedBefore = scheduledEvent.getFiredCount();
        try {
            return scheduledEvent.scan(utcTime);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.error("Scheduled event {} failed at {}, continuing", scheduledEvent.getName(), utcTime, e);
            try {
                errorHandler.handleError(scheduledEvent, utcTime, e);
            } catch (RuntimeException handlerError) {
                log.error("Error handler failed for scheduled event {}", scheduledEvent.getName(), handlerError);
            }
            return (int) (scheduledEvent.getFiredCount() - firedBefore);
        }
    }
}
