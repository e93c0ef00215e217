package com.algoclock.api.dto.response;

import com.algoclock.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error envelope: {@code {success: false, error: {code, status, message, details, path, timestamp}}}.
 */
@Getter
@Builder
public class ApiErrorResponse {

    @Builder.Default
    private final boolean success = false;

    private final ErrorDetail error;

    public static ApiErrorResponse of(
            ErrorCode errorCode, String message, Map<String, Object> details, String path, Instant timestamp) {
        ErrorDetail detail = ErrorDetail.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus())
                .message(message)
                .details(details == null ? Map.of() : details)
                .path(path)
                .timestamp(timestamp)
                .build();
        return ApiErrorResponse.builder().error(detail).build();
    }

    @Getter
    @Builder
    public static class ErrorDetail {
        private final String code;
        private final int status;
        private final String message;
        private final Map<String, Object> details;
        private final String path;
        private final Instant timestamp;
    }
}
