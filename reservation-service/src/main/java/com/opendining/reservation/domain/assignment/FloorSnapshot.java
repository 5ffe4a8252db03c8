package com.opendining.reservation.domain.assignment;

import com.opendining.reservation.domain.model.Booking;
import com.opendining.reservation.domain.model.DiningTable;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * Read-only view of one restaurant's floor around a service date: assignable tables and the
 * bookings that hold them. Intervals are expressed in minutes relative to midnight of
 * {@code date}, so bookings from the previous evening that run past midnight still count.
 */
public record FloorSnapshot(Long restaurantId, LocalDate date, List<DiningTable> tables, List<Booking> bookings) {

    private static final int MINUTES_PER_DAY = 24 * 60;

    public FloorSnapshot {
        tables = List.copyOf(tables);
        bookings = bookings.stream().filter(Booking::isOccupying).toList();
    }

    /**
     * The same floor without one booking; used when moving an existing booking.
     */
    public FloorSnapshot excluding(Long bookingId) {
        return new FloorSnapshot(restaurantId, date, tables,
                bookings.stream().filter(b -> !Objects.equals(b.getId(), bookingId)).toList());
    }

    public int startOf(Booking booking) {
        long dayOffset = ChronoUnit.DAYS.between(date, booking.getBookingDate());
        return (int) dayOffset * MINUTES_PER_DAY + booking.startMinute();
    }

    public int endOf(Booking booking) {
        return startOf(booking) + booking.getDurationMinutes();
    }

    public static int minuteOf(LocalTime time) {
        return time.toSecondOfDay() / 60;
    }

    /**
     * Half-open overlap test: [startA, endA) and [startB, endB) overlap iff
     * startA &lt; endB and startB &lt; endA.
     */
    public static boolean overlaps(int startA, int endA, int startB, int endB) {
        return startA < endB && startB < endA;
    }

    public boolean isFree(DiningTable table, int start, int end) {
        return bookings.stream()
                .filter(b -> b.holdsTable(table.getId()))
                .noneMatch(b -> overlaps(start, end, startOf(b), endOf(b)));
    }

    /**
     * Bookings on the snapshot date starting exactly at the slot; these are the covers pacing
     * limits apply to.
     */
    public List<Booking> bookingsStartingAt(LocalTime time) {
        return bookings.stream()
                .filter(b -> date.equals(b.getBookingDate()) && time.equals(b.getBookingTime()))
                .toList();
    }

    /**
     * Number of assignable tables held by any booking during [start, end).
     */
    public long occupiedTableCount(int start, int end) {
        return tables.stream().filter(t -> !isFree(t, start, end)).count();
    }
}
