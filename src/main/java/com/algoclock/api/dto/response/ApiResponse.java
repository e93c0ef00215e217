package com.algoclock.api.dto.response;

import java.time.Clock;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Success envelope of every REST response: {@code {success, data, timestamp}}.
 *
 * <p>The timestamp is read from the application {@link Clock}, the clock the live scheduler
 * samples, so response times and event times come from one source.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final Instant timestamp;

    public static <T> ApiResponse<T> of(T data, Clock clock) {
        return new ApiResponse<>(true, data, clock.instant());
    }
}
