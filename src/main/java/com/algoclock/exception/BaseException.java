package com.algoclock.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the application's unchecked exceptions. The {@link ErrorCode} fixes the HTTP status the
 * REST layer answers with; the details map is rendered into the error body as is.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    /** Whether the failure is on the server side rather than in the caller's input. */
    public boolean isServerError() {
        return errorCode.getHttpStatus() >= 500;
    }
}
