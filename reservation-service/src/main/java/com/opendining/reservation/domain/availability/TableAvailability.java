package com.opendining.reservation.domain.availability;

import java.time.LocalDate;

/**
 * Free tables for one party at one time, with the pacing the slot would have.
 */
public record TableAvailability(Long restaurantId, LocalDate date, int partySize, int durationMinutes,
                                SlotEvaluation evaluation) {
}
