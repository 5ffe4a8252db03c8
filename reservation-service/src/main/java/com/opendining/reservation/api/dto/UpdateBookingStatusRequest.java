package com.opendining.reservation.api.dto;

import com.opendining.reservation.domain.model.Booking.BookingStatus;
import jakarta.validation.constraints.NotNull;

public record UpdateBookingStatusRequest(
        @NotNull(message = "Status cannot be null")
        BookingStatus status
) {
}
