package com.algoclock.scheduling;

import java.time.Instant;

/**
 * Receives callback failures caught by {@link LiveEventScheduler}. The scheduler has already
 * logged the failure and keeps scanning once the handler returns.
 */
@FunctionalInterface
public interface ScheduledEventErrorHandler {

    void handleError(ScheduledEvent scheduledEvent, Instant utcTime, Throwable error);
}
