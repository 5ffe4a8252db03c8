package com.opendining.reservation.domain.repository;

import com.opendining.reservation.domain.model.Booking;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Repository for Booking entity.
 */
public interface BookingRepository extends JpaRepository<Booking, Long> {

    /**
     * Bookings of a restaurant on the given dates whose status still holds a table.
     * The previous day is usually included by callers so late bookings that run past
     * midnight are not missed.
     */
    @Query("""
           SELECT b FROM Booking b
           WHERE b.restaurantId = :restaurantId
             AND b.bookingDate IN :dates
             AND b.status NOT IN :releasedStatuses
           ORDER BY b.bookingDate, b.bookingTime, b.id
           """)
    List<Booking> findOccupying(@Param("restaurantId") Long restaurantId,
                                @Param("dates") Collection<LocalDate> dates,
                                @Param("releasedStatuses") Collection<Booking.BookingStatus> releasedStatuses);

    List<Booking> findByRestaurantIdAndBookingDateOrderByBookingTime(Long restaurantId, LocalDate bookingDate);

    List<Booking> findByRestaurantIdAndBookingDateAndStatusOrderByCreatedAtAscIdAsc(
            Long restaurantId, LocalDate bookingDate, Booking.BookingStatus status);
}
