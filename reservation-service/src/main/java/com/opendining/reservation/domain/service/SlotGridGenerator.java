package com.opendining.reservation.domain.service;

import com.opendining.reservation.domain.model.OperatingSchedule;
import com.opendining.reservation.domain.model.Restaurant;
import com.opendining.reservation.domain.model.ServicePeriod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Derives the bookable time points of a day from the opening schedule, independent of bookings.
 *
 * Each service period is stepped on its own, from its start up to (and including) its end
 * minus the restaurant's last-seating offset. The gap between two periods is never filled.
 */
@Slf4j
@Component
public class SlotGridGenerator {

    private static final int MINUTES_PER_DAY = 24 * 60;

    public List<LocalTime> generateSlots(Restaurant restaurant, OperatingSchedule schedule, LocalDate date) {
        return generateSlots(restaurant, schedule, date, restaurant.getSlotIntervalMinutes());
    }

    /**
     * @return ordered slot times; empty when the restaurant is closed on the date
     */
    public List<LocalTime> generateSlots(Restaurant restaurant, OperatingSchedule schedule,
                                         LocalDate date, Integer intervalMinutes) {
        List<ServicePeriod> periods = schedule.periodsOn(date);
        if (periods.isEmpty()) {
            return List.of();
        }

        int offset = restaurant.getLastSeatingOffsetMinutes() == null
                ? 0 : Math.max(0, restaurant.getLastSeatingOffsetMinutes());
        TreeSet<LocalTime> slots = new TreeSet<>();

        for (ServicePeriod period : periods) {
            int start = toMinutes(period.getStartTime());
            int end = toMinutes(period.getEndTime());
            if (end <= start) {
                log.warn("Skipping service period {} of restaurant {}: end {} is not after start {}",
                        period.getName(), restaurant.getId(), period.getEndTime(), period.getStartTime());
                continue;
            }
            int step = resolveInterval(period, intervalMinutes);
            int lastSeating = end - offset;
            for (int minute = start; minute <= lastSeating && minute < MINUTES_PER_DAY; minute += step) {
                slots.add(LocalTime.of(minute / 60, minute % 60));
            }
        }
        return new ArrayList<>(slots);
    }

    /**
     * True when {@code time} is one of the day's slot starts. Pacing is counted per slot start,
     * so bookings are only taken on the grid.
     */
    public boolean isSlotStart(Restaurant restaurant, OperatingSchedule schedule, LocalDate date, LocalTime time) {
        return generateSlots(restaurant, schedule, date).contains(time);
    }

    private int resolveInterval(ServicePeriod period, Integer requested) {
        if (period.getSlotIntervalMinutes() != null && period.getSlotIntervalMinutes() > 0) {
            return period.getSlotIntervalMinutes();
        }
        if (requested != null && requested > 0) {
            return requested;
        }
        return Restaurant.DEFAULT_SLOT_INTERVAL_MINUTES;
    }

    static int toMinutes(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }
}
