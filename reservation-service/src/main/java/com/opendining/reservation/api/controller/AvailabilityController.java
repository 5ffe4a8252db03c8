package com.opendining.reservation.api.controller;

import com.opendining.common.dto.BaseResponse;
import com.opendining.reservation.api.dto.AvailableTablesResponse;
import com.opendining.reservation.api.dto.BookingResponse;
import com.opendining.reservation.domain.availability.AvailabilityReport;
import com.opendining.reservation.domain.availability.AvailabilityReporter;
import com.opendining.reservation.domain.service.BookingService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Read-only availability endpoints. Nothing here takes a slot lock.
 */
@RestController
@RequestMapping("/api/v1/restaurants/{restaurantId}")
@RequiredArgsConstructor
public class AvailabilityController {

    private final AvailabilityReporter availabilityReporter;
    private final BookingService bookingService;

    @GetMapping("/availability")
    public ResponseEntity<BaseResponse<AvailabilityReport>> getAvailability(
            @PathVariable Long restaurantId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam Integer partySize,
            @RequestParam(required = false) @DateTimeFormat(pattern = "HH:mm") LocalTime preferredTime) {
        return ResponseEntity.ok(BaseResponse.success(
                availabilityReporter.report(restaurantId, date, partySize, preferredTime)));
    }

    @GetMapping("/tables/available")
    public ResponseEntity<BaseResponse<AvailableTablesResponse>> getAvailableTables(
            @PathVariable Long restaurantId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam @DateTimeFormat(pattern = "HH:mm") LocalTime time,
            @RequestParam Integer partySize) {
        return ResponseEntity.ok(BaseResponse.success(AvailableTablesResponse.from(
                availabilityReporter.findTables(restaurantId, date, time, partySize))));
    }

    /**
     * Day sheet for the host stand.
     */
    @GetMapping("/bookings")
    public ResponseEntity<BaseResponse<List<BookingResponse>>> getBookings(
            @PathVariable Long restaurantId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        List<BookingResponse> bookings = bookingService.listBookings(restaurantId, date).stream()
                .map(BookingResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(bookings));
    }
}
