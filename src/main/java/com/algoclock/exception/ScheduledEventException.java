package com.algoclock.exception;

import java.time.Instant;
import java.util.Map;

/**
 * Wraps an exception thrown by a scheduled event callback while a backtest scheduler was
 * advancing time. The original exception is the cause.
 */
public class ScheduledEventException extends BaseException {

    private final String eventName;
    private final Instant scanTime;

    public ScheduledEventException(String eventName, Instant scanTime, Throwable cause) {
        super(
                ErrorCode.SCHEDULED_EVENT_FAILED,
                String.format("Runtime error in scheduled event %s at %s: %s", eventName, scanTime, cause.getMessage()),
                Map.of("eventName", eventName, "scanTime", scanTime.toString()),
                cause);
        this.eventName = eventName;
        this.scanTime = scanTime;
    }

    public String getEventName() {
        return eventName;
    }

    public Instant getScanTime() {
        return scanTime;
    }
}
