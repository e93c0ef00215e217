package com.algoclock.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Machine-readable error codes and the HTTP status each maps to.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    BAD_REQUEST("BAD_REQUEST", 400),
    INVALID_SCHEDULE("INVALID_SCHEDULE", 400),
    NOT_FOUND("NOT_FOUND", 404),
    SCHEDULED_EVENT_FAILED("SCHEDULED_EVENT_FAILED", 500),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
