package com.opendining.reservation.api.controller;

import com.opendining.common.dto.BaseResponse;
import com.opendining.reservation.api.dto.BookingResponse;
import com.opendining.reservation.api.dto.CreateBookingRequest;
import com.opendining.reservation.api.dto.RescheduleBookingRequest;
import com.opendining.reservation.api.dto.UpdateBookingStatusRequest;
import com.opendining.reservation.domain.model.Booking;
import com.opendining.reservation.domain.service.BookingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for bookings.
 *
 * Creation and rescheduling run under the slot lock; a full slot answers 409 with either
 * PHYSICALLY_FULL (alternatives attached) or OVERRIDE_REQUIRED.
 */
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingService bookingService;

    @PostMapping
    public ResponseEntity<BaseResponse<BookingResponse>> createBooking(
            @Valid @RequestBody CreateBookingRequest request) {
        BookingResponse response = BookingResponse.from(bookingService.createBooking(request));
        String message = response.status() == Booking.BookingStatus.WAITLISTED
                ? "Added to waitlist" : "Booking created successfully";
        return ResponseEntity.status(HttpStatus.CREATED).body(BaseResponse.success(message, response));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<BookingResponse>> getBooking(@PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success(BookingResponse.from(bookingService.getBooking(id))));
    }

    @PutMapping("/{id}/schedule")
    public ResponseEntity<BaseResponse<BookingResponse>> rescheduleBooking(
            @PathVariable Long id,
            @Valid @RequestBody RescheduleBookingRequest request) {
        BookingResponse response = BookingResponse.from(bookingService.rescheduleBooking(id, request));
        return ResponseEntity.ok(BaseResponse.success("Booking rescheduled successfully", response));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<BaseResponse<BookingResponse>> cancelBooking(@PathVariable Long id) {
        BookingResponse response = BookingResponse.from(bookingService.cancelBooking(id));
        return ResponseEntity.ok(BaseResponse.success("Booking cancelled successfully", response));
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<BaseResponse<BookingResponse>> updateStatus(
            @PathVariable Long id,
            @Valid @RequestBody UpdateBookingStatusRequest request) {
        return ResponseEntity.ok(BaseResponse.success(
                BookingResponse.from(bookingService.updateStatus(id, request.status()))));
    }
}
