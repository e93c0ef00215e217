package com.algoclock.exception;

import java.util.Map;

/**
 * A lookup by key found nothing: an unknown symbol, exchange calendar or scheduled event name.
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                resourceType + " not found: " + identifier,
                Map.of("resourceType", resourceType, "identifier", String.valueOf(identifier)));
    }
}
