package com.opendining.reservation.domain.service;

import com.opendining.reservation.domain.model.OperatingSchedule;
import com.opendining.reservation.domain.model.Restaurant;
import com.opendining.reservation.domain.model.ServicePeriod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static com.opendining.reservation.support.Fixtures.period;
import static com.opendining.reservation.support.Fixtures.restaurant;
import static org.assertj.core.api.Assertions.assertThat;

class SlotGridGeneratorTest {

    // a Friday
    private static final LocalDate DATE = LocalDate.of(2030, 3, 15);

    private final SlotGridGenerator generator = new SlotGridGenerator();

    @Test
    @DisplayName("Dinner 18:00-22:00 every 30 minutes includes both ends")
    void dinnerGrid() {
        OperatingSchedule schedule = schedule(period(DayOfWeek.FRIDAY, "18:00", "22:00"));

        List<LocalTime> slots = generator.generateSlots(restaurant(), schedule, DATE);

        assertThat(slots).extracting(LocalTime::toString).containsExactly(
                "18:00", "18:30", "19:00", "19:30", "20:00", "20:30", "21:00", "21:30", "22:00");
    }

    @Test
    @DisplayName("Last seating offset trims the end of each period")
    void lastSeatingOffset() {
        Restaurant restaurant = restaurant();
        restaurant.setLastSeatingOffsetMinutes(60);
        OperatingSchedule schedule = schedule(period(DayOfWeek.FRIDAY, "18:00", "22:00"));

        List<LocalTime> slots = generator.generateSlots(restaurant, schedule, DATE);

        assertThat(slots).last().isEqualTo(LocalTime.of(21, 0));
    }

    @Test
    @DisplayName("The gap between lunch and dinner is never filled")
    void twoPeriods_gapNotFilled() {
        OperatingSchedule schedule = schedule(
                period(DayOfWeek.FRIDAY, "18:00", "19:00"),
                period(DayOfWeek.FRIDAY, "12:00", "13:00"));

        List<LocalTime> slots = generator.generateSlots(restaurant(), schedule, DATE, 30);

        assertThat(slots).extracting(LocalTime::toString)
                .containsExactly("12:00", "12:30", "13:00", "18:00", "18:30", "19:00");
    }

    @Test
    @DisplayName("A period interval overrides the requested interval")
    void periodInterval() {
        ServicePeriod lunch = period(DayOfWeek.FRIDAY, "12:00", "13:00");
        lunch.setSlotIntervalMinutes(15);

        List<LocalTime> slots = generator.generateSlots(restaurant(), schedule(lunch), DATE, 30);

        assertThat(slots).hasSize(5);
    }

    @Test
    @DisplayName("Closed day yields no slots")
    void closedDay() {
        OperatingSchedule schedule = schedule(period(DayOfWeek.MONDAY, "18:00", "22:00"));

        assertThat(generator.generateSlots(restaurant(), schedule, DATE)).isEmpty();
    }

    @Test
    @DisplayName("Slots are strictly increasing and de-duplicated across overlapping periods")
    void overlappingPeriods() {
        OperatingSchedule schedule = schedule(
                period(DayOfWeek.FRIDAY, "18:00", "20:00"),
                period(DayOfWeek.FRIDAY, "19:00", "21:00"));

        List<LocalTime> slots = generator.generateSlots(restaurant(), schedule, DATE);

        assertThat(slots).isSorted().doesNotHaveDuplicates().hasSize(7);
    }

    private static OperatingSchedule schedule(ServicePeriod... periods) {
        return new OperatingSchedule(1L, List.of(periods));
    }
}
