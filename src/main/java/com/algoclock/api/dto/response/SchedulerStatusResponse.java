package com.algoclock.api.dto.response;

import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * State of the live scheduler, returned by GET /api/scheduler/status.
 */
@Getter
@Builder
public class SchedulerStatusResponse {

    /** "live" or "backtest". */
    private final String mode;

    /** Whether the sampler thread is running. */
    private final boolean running;

    private final int registeredEvents;

    /** Earliest pending event time in UTC. Null when nothing is pending. */
    private final Instant nextEventUtcTime;

    private final Duration scanInterval;

    /** Callback invocations since startup. */
    private final long eventsFired;

    /** Callback failures since startup. */
    private final long callbackFailures;
}
