package com.opendining.reservation.api.exception;

import com.opendining.common.dto.BaseResponse;
import com.opendining.reservation.domain.pacing.PacingClassification;
import com.opendining.reservation.domain.storage.StorageException;
import com.opendining.reservation.exception.BookingLockBusyException;
import com.opendining.reservation.exception.OverrideRequiredException;
import com.opendining.reservation.exception.RestaurantClosedException;
import com.opendining.reservation.exception.SlotUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Maps booking engine outcomes to HTTP. Runs before the shared GlobalExceptionHandler so the
 * conflict bodies keep their alternatives and pacing details.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ReservationExceptionHandler {

    @ExceptionHandler(SlotUnavailableException.class)
    public ResponseEntity<BaseResponse<SlotConflict>> handleSlotUnavailable(SlotUnavailableException ex) {
        log.info("Slot unavailable: {} (alternatives {})", ex.getMessage(), ex.getAlternativeTimes());
        SlotConflict body = new SlotConflict(ex.getDate(), ex.getTime(), ex.getPartySize(), ex.getAlternativeTimes());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode(), body));
    }

    @ExceptionHandler(OverrideRequiredException.class)
    public ResponseEntity<BaseResponse<PacingConflict>> handleOverrideRequired(OverrideRequiredException ex) {
        log.info("Override required: {}", ex.getMessage());
        PacingClassification classification = ex.getClassification();
        PacingConflict body = new PacingConflict(ex.getDate(), ex.getTime(), classification.status().code(),
                classification.utilizationPercent(), classification.canOverride());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode(), body));
    }

    @ExceptionHandler(RestaurantClosedException.class)
    public ResponseEntity<BaseResponse<?>> handleRestaurantClosed(RestaurantClosedException ex) {
        log.info("Restaurant closed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(BookingLockBusyException.class)
    public ResponseEntity<BaseResponse<?>> handleLockBusy(BookingLockBusyException ex) {
        log.warn("Slot lock busy: {}", ex.getLockKey());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, "1")
                .body(BaseResponse.error(ex.getMessage(), "SLOT_BUSY"));
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<BaseResponse<?>> handleStorage(StorageException ex) {
        if (ex.isRetryable()) {
            log.warn("Booking store temporarily unavailable: {}", ex.getKind());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(BaseResponse.error("Booking storage is temporarily unavailable. Please try again.",
                            "STORAGE_" + ex.getKind()));
        }
        log.error("Booking store failure: {}", ex.getKind(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(BaseResponse.error("Booking storage failure", "STORAGE_" + ex.getKind()));
    }

    public record SlotConflict(LocalDate date, LocalTime time, int partySize, List<LocalTime> alternativeTimes) {
    }

    public record PacingConflict(LocalDate date, LocalTime time, String status, double utilizationPercent,
                                 boolean canOverride) {
    }
}
