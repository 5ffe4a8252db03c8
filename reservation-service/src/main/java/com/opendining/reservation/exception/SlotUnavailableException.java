package com.opendining.reservation.exception;

import com.opendining.common.exception.ConflictException;
import lombok.Getter;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * No table can take the party at the requested time. Never overridable.
 * Carries alternative times so the caller can offer them straight away.
 */
@Getter
public class SlotUnavailableException extends ConflictException {

    public static final String ERROR_CODE = "PHYSICALLY_FULL";

    private final Long restaurantId;
    private final LocalDate date;
    private final LocalTime time;
    private final int partySize;
    private final List<LocalTime> alternativeTimes;

    public SlotUnavailableException(Long restaurantId, LocalDate date, LocalTime time, int partySize) {
        this(restaurantId, date, time, partySize, List.of(), null);
    }

    public SlotUnavailableException(Long restaurantId, LocalDate date, LocalTime time, int partySize,
                                    Throwable cause) {
        this(restaurantId, date, time, partySize, List.of(), cause);
    }

    private SlotUnavailableException(Long restaurantId, LocalDate date, LocalTime time, int partySize,
                                     List<LocalTime> alternativeTimes, Throwable cause) {
        super(String.format("No table for a party of %d at %s %s", partySize, date, time), cause, ERROR_CODE);
        this.restaurantId = restaurantId;
        this.date = date;
        this.time = time;
        this.partySize = partySize;
        this.alternativeTimes = List.copyOf(alternativeTimes);
    }

    public SlotUnavailableException withAlternatives(List<LocalTime> alternatives) {
        return new SlotUnavailableException(restaurantId, date, time, partySize, alternatives, getCause());
    }
}
