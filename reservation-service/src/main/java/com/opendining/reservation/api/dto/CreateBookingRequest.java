package com.opendining.reservation.api.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.opendining.common.util.Constants;
import com.opendining.reservation.domain.model.Booking.BookingSource;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Request DTO for creating a booking.
 *
 * @param preferredTableId optional staff table pick; used only if that table is free and fits
 * @param durationMinutes  optional; resolved from turn time rules when absent
 * @param source           defaults to WIDGET; only STAFF may override pacing
 * @param overridePacing   book past the pacing ceiling; requires an overrideReason
 * @param joinWaitlist     queue the booking when no table is free instead of failing; the
 *                         restaurant must have its waitlist enabled
 */
public record CreateBookingRequest(
        @NotNull(message = "Restaurant ID cannot be null")
        Long restaurantId,

        @NotNull(message = "Date cannot be null")
        LocalDate date,

        @NotNull(message = "Time cannot be null")
        @JsonFormat(pattern = "HH:mm")
        LocalTime time,

        @NotNull(message = "Party size cannot be null")
        @Min(value = Constants.MIN_PARTY_SIZE, message = "Party size must be at least 1")
        @Max(value = Constants.MAX_PARTY_SIZE, message = "Party size must be at most 50")
        Integer partySize,

        @NotBlank(message = "Customer name cannot be blank")
        @Size(max = 255)
        String customerName,

        @Email(message = "Customer email must be a valid address")
        String customerEmail,

        @Size(max = 40)
        String customerPhone,

        @Size(max = 2000)
        String notes,

        Long preferredTableId,

        @Min(value = 30, message = "Duration must be at least 30 minutes")
        @Max(value = 480, message = "Duration must be at most 480 minutes")
        Integer durationMinutes,

        BookingSource source,

        boolean overridePacing,

        @Size(max = 500)
        String overrideReason,

        boolean joinWaitlist
) {
    public BookingSource sourceOrDefault() {
        return source != null ? source : BookingSource.WIDGET;
    }
}
