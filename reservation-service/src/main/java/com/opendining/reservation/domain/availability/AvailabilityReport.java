package com.opendining.reservation.domain.availability;

import java.time.LocalDate;
import java.util.List;

public record AvailabilityReport(
        Long restaurantId,
        LocalDate date,
        int partySize,
        int durationMinutes,
        List<SlotAvailability> slots,
        AvailabilitySuggestions suggestions
) {
}
