package com.opendining.common.exception;

/**
 * A backing system (lock registry, booking store) could not be reached or answered too late.
 * Nothing was committed, so the same request is safe to send again. Mapped to HTTP 503.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
