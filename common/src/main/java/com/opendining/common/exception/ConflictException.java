package com.opendining.common.exception;

/**
 * Business exception for requests that are well-formed but collide with current state
 * (e.g. the requested slot was taken in the meantime). Mapped to HTTP 409.
 */
public class ConflictException extends BusinessException {

    public ConflictException(String message, String errorCode) {
        super(message, errorCode);
    }

    public ConflictException(String message, Throwable cause, String errorCode) {
        super(message, cause, errorCode);
    }
}
