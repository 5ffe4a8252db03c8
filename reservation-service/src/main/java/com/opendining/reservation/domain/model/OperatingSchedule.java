package com.opendining.reservation.domain.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * A restaurant's weekly service periods.
 */
public record OperatingSchedule(Long restaurantId, List<ServicePeriod> periods) {

    public OperatingSchedule {
        periods = List.copyOf(periods);
    }

    public List<ServicePeriod> periodsOn(DayOfWeek dayOfWeek) {
        return periods.stream()
                .filter(p -> p.getDayOfWeek() == dayOfWeek)
                .sorted(Comparator.comparing(ServicePeriod::getStartTime))
                .toList();
    }

    public List<ServicePeriod> periodsOn(LocalDate date) {
        return periodsOn(date.getDayOfWeek());
    }

    public boolean isOpenOn(LocalDate date) {
        return !periodsOn(date).isEmpty();
    }
}
