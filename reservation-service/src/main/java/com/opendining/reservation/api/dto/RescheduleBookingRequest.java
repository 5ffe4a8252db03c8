package com.opendining.reservation.api.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.opendining.common.util.Constants;
import com.opendining.reservation.domain.model.Booking.BookingSource;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Moves a booking to another slot. Party size and duration keep their current values when absent.
 */
public record RescheduleBookingRequest(
        @NotNull(message = "Date cannot be null")
        LocalDate date,

        @NotNull(message = "Time cannot be null")
        @JsonFormat(pattern = "HH:mm")
        LocalTime time,

        @Min(value = Constants.MIN_PARTY_SIZE, message = "Party size must be at least 1")
        @Max(value = Constants.MAX_PARTY_SIZE, message = "Party size must be at most 50")
        Integer partySize,

        @Min(value = 30, message = "Duration must be at least 30 minutes")
        @Max(value = 480, message = "Duration must be at most 480 minutes")
        Integer durationMinutes,

        Long preferredTableId,

        BookingSource source,

        boolean overridePacing,

        @Size(max = 500)
        String overrideReason
) {
    public BookingSource sourceOrDefault() {
        return source != null ? source : BookingSource.STAFF;
    }
}
