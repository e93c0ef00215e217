package com.algoclock.event;

import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a scheduled event callback throws during a live scan.
 *
 * <p>The live scheduler has already logged the failure and moved on to the next event when this
 * is published. Listeners count it ({@code SchedulerMetrics}) or alert on it.
 */
public class ScheduledEventFailedEvent extends ApplicationEvent {

    private final String eventName;
    private final Instant utcTime;
    private final String errorType;
    private final String errorMessage;

    public ScheduledEventFailedEvent(Object source, String eventName, Instant utcTime, Throwable error) {
        super(source);
        this.eventName = eventName;
        this.utcTime = utcTime;
        this.errorType = error.getClass().getName();
        this.errorMessage = error.getMessage();
    }

    public String getEventName() {
        return eventName;
    }

    /** Scan time at which the callback failed. */
    public Instant getUtcTime() {
        return utcTime;
    }

    public String getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
