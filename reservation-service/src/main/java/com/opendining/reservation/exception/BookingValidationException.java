package com.opendining.reservation.exception;

import com.opendining.common.exception.BusinessException;

/**
 * Request rejected before any lock is taken (bad party size, date outside the booking window,
 * missing override reason...).
 */
public class BookingValidationException extends BusinessException {

    public BookingValidationException(String message) {
        super(message, "VALIDATION_ERROR");
    }
}
