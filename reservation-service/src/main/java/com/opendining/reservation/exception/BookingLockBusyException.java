package com.opendining.reservation.exception;

import com.opendining.common.exception.ServiceUnavailableException;
import lombok.Getter;

/**
 * Another request kept the slot lock for longer than we were willing to wait.
 * Retryable: the client should try again shortly.
 */
@Getter
public class BookingLockBusyException extends ServiceUnavailableException {

    private final String lockKey;

    public BookingLockBusyException(String lockKey) {
        super("Another booking for this time slot is in progress. Please try again.");
        this.lockKey = lockKey;
    }
}
