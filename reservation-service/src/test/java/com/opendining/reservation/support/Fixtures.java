package com.opendining.reservation.support;

import com.opendining.reservation.domain.model.Booking;
import com.opendining.reservation.domain.model.DiningTable;
import com.opendining.reservation.domain.model.PacingLimits;
import com.opendining.reservation.domain.model.Restaurant;
import com.opendining.reservation.domain.model.ServicePeriod;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builders for floor plans and bookings shared by the unit tests.
 */
public final class Fixtures {

    public static final Long RESTAURANT_ID = 1L;

    private Fixtures() {
    }

    public static Restaurant restaurant() {
        return Restaurant.builder()
                .id(RESTAURANT_ID)
                .name("Test Bistro")
                .build();
    }

    public static Restaurant restaurantWithCoversCeiling(int maxCovers) {
        Restaurant restaurant = restaurant();
        restaurant.setPacingLimits(PacingLimits.builder().maxCoversPerSlot(maxCovers).build());
        return restaurant;
    }

    public static ServicePeriod period(DayOfWeek day, String start, String end) {
        return ServicePeriod.builder()
                .restaurantId(RESTAURANT_ID)
                .dayOfWeek(day)
                .name("dinner")
                .startTime(LocalTime.parse(start))
                .endTime(LocalTime.parse(end))
                .build();
    }

    /**
     * Dinner 18:00-22:00 on the day of the given date.
     */
    public static List<ServicePeriod> dinnerOn(LocalDate date) {
        return List.of(period(date.getDayOfWeek(), "18:00", "22:00"));
    }

    public static DiningTable table(long id, int min, int max) {
        return DiningTable.builder()
                .id(id)
                .restaurantId(RESTAURANT_ID)
                .label("T" + id)
                .minCapacity(min)
                .maxCapacity(max)
                .build();
    }

    public static DiningTable combinableTable(long id, int min, int max, String group) {
        DiningTable table = table(id, min, max);
        table.setCombinable(true);
        table.setCombinationGroup(group);
        return table;
    }

    public static Booking booking(long id, LocalDate date, String time, int duration, int partySize, Long tableId,
                                  Long... joinedTableIds) {
        return Booking.builder()
                .id(id)
                .restaurantId(RESTAURANT_ID)
                .tableId(tableId)
                .joinedTableIds(new ArrayList<>(Arrays.asList(joinedTableIds)))
                .bookingDate(date)
                .bookingTime(LocalTime.parse(time))
                .durationMinutes(duration)
                .partySize(partySize)
                .status(Booking.BookingStatus.CONFIRMED)
                .source(Booking.BookingSource.STAFF)
                .customerName("Guest " + id)
                .build();
    }
}
