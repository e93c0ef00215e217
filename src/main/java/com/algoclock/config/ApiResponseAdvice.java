package com.algoclock.config;

import com.algoclock.api.dto.response.ApiErrorResponse;
import com.algoclock.api.dto.response.ApiResponse;
import java.time.Clock;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps controller results in {@link ApiResponse}, stamped with the application clock.
 *
 * <p>Actuator and error endpoints, bodies that are already envelopes, and plain strings pass
 * through unchanged.
 */
@RestControllerAdvice
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    private final Clock clock;

    public ApiResponseAdvice(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return !StringHttpMessageConverter.class.isAssignableFrom(converterType);
    }

    @Override
    public Object beforeBodyWrite(
            Object body,
            MethodParameter returnType,
            MediaType selectedContentType,
            Class<? extends HttpMessageConverter<?>> selectedConverterType,
            ServerHttpRequest request,
            ServerHttpResponse response) {
        if (isPassThrough(body, request.getURI().getPath())) {
            return body;
        }
        return ApiResponse.of(body, clock);
    }

    private static boolean isPassThrough(Object body, String path) {
        return path.startsWith("/actuator")
                || path.equals("/error")
                || body instanceof ApiResponse<?>
                || body instanceof ApiErrorResponse;
    }
}
