package com.opendining.reservation.exception;

import com.opendining.common.exception.BusinessException;
import lombok.Getter;

import java.time.LocalDate;

/**
 * The restaurant has no service period on the requested date. Distinct from an empty
 * availability report: nothing can be booked at all.
 */
@Getter
public class RestaurantClosedException extends BusinessException {

    private final Long restaurantId;
    private final LocalDate date;

    public RestaurantClosedException(Long restaurantId, LocalDate date) {
        super(String.format("Restaurant %d is closed on %s (%s)", restaurantId, date, date.getDayOfWeek()),
                "RESTAURANT_CLOSED");
        this.restaurantId = restaurantId;
        this.date = date;
    }
}
