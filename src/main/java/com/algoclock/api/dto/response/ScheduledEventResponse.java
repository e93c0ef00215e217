package com.algoclock.api.dto.response;

import com.algoclock.scheduling.ScheduledEvent;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * One registered scheduled event, as returned by GET /api/scheduler/events.
 */
@Getter
@Builder
public class ScheduledEventResponse {

    private final String name;

    /** Next time the event fires, in UTC. Null once the event has no times left. */
    private final Instant nextEventUtcTime;

    private final boolean exhausted;

    private final boolean loggingEnabled;

    public static ScheduledEventResponse from(ScheduledEvent scheduledEvent) {
        return ScheduledEventResponse.builder()
                .name(scheduledEvent.getName())
                .nextEventUtcTime(scheduledEvent.isExhausted() ? null : scheduledEvent.getNextEventUtcTime())
                .exhausted(scheduledEvent.isExhausted())
                .loggingEnabled(scheduledEvent.isLoggingEnabled())
                .build();
    }
}
