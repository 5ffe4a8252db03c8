package com.opendining.reservation.domain.lock;

import com.opendining.common.util.Constants;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Identity of a bookable slot for locking purposes.
 *
 * Serialized as {@code booking-lock:{restaurantId}:{yyyy-MM-dd}:{HH:mm}}. The form is
 * injective: the restaurant id is purely numeric and date and time have fixed widths, so no
 * two distinct triples share a string.
 */
public record SlotLockKey(Long restaurantId, LocalDate date, LocalTime time) {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    public SlotLockKey {
        Objects.requireNonNull(restaurantId, "restaurantId");
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(time, "time");
        if (time.getSecond() != 0 || time.getNano() != 0) {
            throw new IllegalArgumentException("Slot time must be minute aligned: " + time);
        }
    }

    public String asString() {
        return Constants.BOOKING_LOCK_PREFIX + restaurantId + ":" + DATE_FORMAT.format(date) + ":" + TIME_FORMAT.format(time);
    }

    @Override
    public String toString() {
        return asString();
    }
}
