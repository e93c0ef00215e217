package com.algoclock.exception;

import java.util.Map;

/**
 * Thrown when a date rule, time rule or end-of-day event is built from arguments outside
 * their allowed range (e.g. a month start offset of 20 days, a non-positive interval).
 */
public class ScheduleConfigurationException extends BaseException {

    public ScheduleConfigurationException(String message) {
        super(ErrorCode.INVALID_SCHEDULE, message);
    }

    public ScheduleConfigurationException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_SCHEDULE, message, details);
    }

    public ScheduleConfigurationException(String message, Throwable cause) {
        super(ErrorCode.INVALID_SCHEDULE, message, null, cause);
    }
}
