package com.opendining.reservation.api.controller;

import com.opendining.common.dto.BaseResponse;
import com.opendining.reservation.api.dto.BookingResponse;
import com.opendining.reservation.domain.service.BookingService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/**
 * Staff view of a day's waitlist. Promotion also runs on its own after a cancellation or no-show.
 */
@RestController
@RequestMapping("/api/v1/restaurants/{restaurantId}/waitlist")
@RequiredArgsConstructor
public class WaitlistController {

    private final BookingService bookingService;

    @GetMapping
    public ResponseEntity<BaseResponse<List<BookingResponse>>> getWaitlist(
            @PathVariable Long restaurantId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(BaseResponse.success(
                bookingService.getWaitlist(restaurantId, date).stream().map(BookingResponse::from).toList()));
    }

    @PostMapping("/promote")
    public ResponseEntity<BaseResponse<List<BookingResponse>>> promoteWaitlist(
            @PathVariable Long restaurantId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        List<BookingResponse> seated = bookingService.promoteWaitlist(restaurantId, date).stream()
                .map(BookingResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(seated.size() + " waitlisted booking(s) seated", seated));
    }
}
