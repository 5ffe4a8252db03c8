package com.opendining.reservation.api.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.opendining.reservation.domain.model.Booking;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

/**
 * Response DTO for a booking.
 */
public record BookingResponse(
        Long id,
        Long restaurantId,
        Long tableId,
        List<Long> joinedTableIds,
        LocalDate date,
        @JsonFormat(pattern = "HH:mm")
        LocalTime time,
        @JsonFormat(pattern = "HH:mm")
        LocalTime endTime,
        int durationMinutes,
        int partySize,
        Booking.BookingStatus status,
        Booking.BookingSource source,
        String customerName,
        String customerEmail,
        String customerPhone,
        String notes,
        boolean overridePacing,
        String overrideReason,
        LocalDateTime createdAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getId(),
                booking.getRestaurantId(),
                booking.getTableId(),
                booking.getJoinedTableIds() == null ? List.of() : List.copyOf(booking.getJoinedTableIds()),
                booking.getBookingDate(),
                booking.getBookingTime(),
                booking.endTime(),
                booking.getDurationMinutes(),
                booking.getPartySize(),
                booking.getStatus(),
                booking.getSource(),
                booking.getCustomerName(),
                booking.getCustomerEmail(),
                booking.getCustomerPhone(),
                booking.getNotes(),
                booking.isOverridePacing(),
                booking.getOverrideReason(),
                booking.getCreatedAt());
    }
}
