package com.algoclock.observability;

import com.algoclock.event.ScheduledEventFailedEvent;
import com.algoclock.scheduling.EventScheduler;
import com.algoclock.scheduling.SchedulerMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the event schedulers.
 *
 * <ul>
 *   <li><b>scheduler.events.fired</b> (counter, tag mode): callback invocations</li>
 *   <li><b>scheduler.scan.duration</b> (timer, tag mode): duration of scans that fired something</li>
 *   <li><b>scheduler.callback.failures</b> (counter): live callback failures, counted from
 *       {@link ScheduledEventFailedEvent}</li>
 *   <li><b>scheduler.events.registered</b> (gauge, tag mode): registered events per scheduler</li>
 * </ul>
 *
 * <p>Ticks where nothing is due are not timed, so the timer reflects callback work only.
 */
@Service
public class SchedulerMetrics {

    private static final Logger log = LoggerFactory.getLogger(SchedulerMetrics.class);

    private final MeterRegistry meterRegistry;
    private final Map<SchedulerMode, Counter> firedCounters = new EnumMap<>(SchedulerMode.class);
    private final Map<SchedulerMode, Timer> scanTimers = new EnumMap<>(SchedulerMode.class);
    private final Counter callbackFailureCounter;

    public SchedulerMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (SchedulerMode mode : SchedulerMode.values()) {
            firedCounters.put(
                    mode,
                    Counter.builder("scheduler.events.fired")
                            .description("Scheduled event callback invocations")
                            .tag("mode", mode.getTag())
                            .register(meterRegistry));
            scanTimers.put(
                    mode,
                    Timer.builder("scheduler.scan.duration")
                            .description("Duration of scheduler scans that fired at least one event")
                            .tag("mode", mode.getTag())
                            .register(meterRegistry));
        }
        this.callbackFailureCounter = Counter.builder("scheduler.callback.failures")
                .description("Scheduled event callbacks that threw during a live scan")
                .register(meterRegistry);
    }

    /** Metrics backed by a private in-memory registry, for schedulers built outside Spring. */
    public static SchedulerMetrics inMemory() {
        return new SchedulerMetrics(new SimpleMeterRegistry());
    }

    public void recordScan(SchedulerMode mode, int fired, long durationNanos) {
        if (fired == 0) {
            return;
        }
        firedCounters.get(mode).increment(fired);
        scanTimers.get(mode).record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /** Registers a gauge over the scheduler's registered event count. */
    public void bindScheduler(EventScheduler eventScheduler) {
        Gauge.builder("scheduler.events.registered", eventScheduler, EventScheduler::size)
                .description("Events registered with the scheduler")
                .tag("mode", eventScheduler.getMode().getTag())
                .register(meterRegistry);
    }

    @EventListener
    public void onScheduledEventFailed(ScheduledEventFailedEvent event) {
        callbackFailureCounter.increment();
        log.debug("Counted callback failure of {}", event.getEventName());
    }

    public double getFiredCount(SchedulerMode mode) {
        return firedCounters.get(mode).count();
    }

    public double getCallbackFailureCount() {
        return callbackFailureCounter.count();
    }
}
