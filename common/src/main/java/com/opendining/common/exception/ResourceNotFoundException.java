package com.opendining.common.exception;

import lombok.Getter;

/**
 * A restaurant, table or booking id that does not resolve. Code is {@code <TYPE>_NOT_FOUND},
 * e.g. {@code BOOKING_NOT_FOUND}.
 */
@Getter
public class ResourceNotFoundException extends BusinessException {

    private final String resourceType;
    private final Object identifier;

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(resourceType + " " + identifier + " not found", codeFor(resourceType));
        this.resourceType = resourceType;
        this.identifier = identifier;
    }

    static String codeFor(String resourceType) {
        return resourceType.trim().toUpperCase().replace(' ', '_') + "_NOT_FOUND";
    }
}
