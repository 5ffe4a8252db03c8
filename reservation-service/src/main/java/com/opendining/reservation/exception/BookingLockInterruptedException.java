package com.opendining.reservation.exception;

import com.opendining.common.exception.BusinessException;

/**
 * The caller gave up while waiting for the slot lock. Nothing was written.
 */
public class BookingLockInterruptedException extends BusinessException {

    public BookingLockInterruptedException(String lockKey, Throwable cause) {
        super("Booking interrupted while waiting for lock " + lockKey, cause, "BOOKING_INTERRUPTED");
    }
}
