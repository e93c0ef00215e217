package com.algoclock.service;

import com.algoclock.api.dto.response.ScheduledEventResponse;
import com.algoclock.api.dto.response.SchedulerStatusResponse;
import com.algoclock.exception.ResourceNotFoundException;
import com.algoclock.observability.SchedulerMetrics;
import com.algoclock.scheduling.LiveEventScheduler;
import com.algoclock.scheduling.ScheduleManager;
import com.algoclock.scheduling.ScheduledEvent;
import com.algoclock.scheduling.SchedulerMode;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Read and remove operations on the live scheduler for the REST layer.
 */
@Service
public class SchedulerService {

    private static final Logger log = LoggerFactory.getLogger(SchedulerService.class);

    private final LiveEventScheduler liveEventScheduler;
    private final ScheduleManager scheduleManager;
    private final SchedulerMetrics schedulerMetrics;

    public SchedulerService(
            LiveEventScheduler liveEventScheduler, ScheduleManager scheduleManager, SchedulerMetrics schedulerMetrics) {
        this.liveEventScheduler = liveEventScheduler;
        this.scheduleManager = scheduleManager;
        this.schedulerMetrics = schedulerMetrics;
    }

    /** Registered events in firing order. */
    public List<ScheduledEventResponse> getScheduledEvents() {
        return scheduleManager.getScheduledEvents().stream()
                .map(ScheduledEventResponse::from)
                .toList();
    }

    public SchedulerStatusResponse getStatus() {
        Instant nextEventUtcTime = liveEventScheduler.getNextEventUtcTime();
        return SchedulerStatusResponse.builder()
                .mode(liveEventScheduler.getMode().getTag())
                .running(liveEventScheduler.isRunning())
                .registeredEvents(liveEventScheduler.size())
                .nextEventUtcTime(nextEventUtcTime.equals(ScheduledEvent.END_OF_TIME) ? null : nextEventUtcTime)
                .scanInterval(liveEventScheduler.getScanInterval())
                .eventsFired((long) schedulerMetrics.getFiredCount(SchedulerMode.LIVE))
                .callbackFailures((long) schedulerMetrics.getCallbackFailureCount())
                .build();
    }

    /**
     * Removes every event with the given name.
     *
     * @return the number of removed events
     * @throws ResourceNotFoundException if no event has that name
     */
    public int removeScheduledEvents(String name) {
        int removed = scheduleManager.remove(name);
        if (removed == 0) {
            throw new ResourceNotFoundException("Scheduled event", name);
        }
        log.info("Removed {} scheduled event(s) named {} via API", removed, name);
        return removed;
    }
}
