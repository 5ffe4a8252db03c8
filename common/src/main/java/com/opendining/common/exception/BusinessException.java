package com.opendining.common.exception;

import lombok.Getter;

/**
 * Base of every rule violation the booking engine reports to a caller.
 * <p>
 * The error code is the stable, machine-readable half of the failure; the message is for people
 * and may change wording between releases. Subclasses pick the code, handlers pick the HTTP status.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final String errorCode;

    public BusinessException(String message, String errorCode) {
        this(message, null, errorCode);
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode must not be blank");
        }
        this.errorCode = errorCode;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + errorCode + "]: " + getMessage();
    }
}
