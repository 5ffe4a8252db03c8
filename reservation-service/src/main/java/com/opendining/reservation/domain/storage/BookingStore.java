package com.opendining.reservation.domain.storage;

import com.opendining.reservation.domain.model.Booking;
import com.opendining.reservation.domain.repository.BookingRepository;
import com.opendining.reservation.domain.repository.DiningTableRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Single source of truth for bookings.
 *
 * Every failure leaving this class is a {@link StorageException} tagged with a
 * {@link StorageErrorKind}, so callers (the lock coordinator in particular) can decide
 * whether to retry without inspecting driver exceptions.
 */
@Slf4j
@Component
public class BookingStore {

    private static final Set<Booking.BookingStatus> RELEASED_STATUSES = Booking.BookingStatus.notHoldingTable();

    private final BookingRepository bookingRepository;
    private final DiningTableRepository diningTableRepository;
    private final PlatformTransactionManager transactionManager;

    public BookingStore(BookingRepository bookingRepository, DiningTableRepository diningTableRepository,
                        PlatformTransactionManager transactionManager) {
        this.bookingRepository = bookingRepository;
        this.diningTableRepository = diningTableRepository;
        this.transactionManager = transactionManager;
    }

    public List<Booking> findOccupying(Long restaurantId, Collection<LocalDate> dates) {
        return translate("find occupying bookings", () ->
                bookingRepository.findOccupying(restaurantId, dates, RELEASED_STATUSES));
    }

    public List<Booking> findForDay(Long restaurantId, LocalDate date) {
        return translate("list bookings", () ->
                bookingRepository.findByRestaurantIdAndBookingDateOrderByBookingTime(restaurantId, date));
    }

    /**
     * Waitlisted bookings of a day, first come first served.
     */
    public List<Booking> findWaitlisted(Long restaurantId, LocalDate date) {
        return translate("list waitlist", () -> bookingRepository
                .findByRestaurantIdAndBookingDateAndStatusOrderByCreatedAtAscIdAsc(
                        restaurantId, date, Booking.BookingStatus.WAITLISTED));
    }

    public Optional<Booking> findById(Long bookingId) {
        return translate("find booking", () -> bookingRepository.findById(bookingId));
    }

    /**
     * Row-locks the given tables until the surrounding transaction ends. Slot locks only
     * serialize writers of the same start time; this serializes writers of the same table.
     */
    public void lockTables(Collection<Long> tableIds) {
        List<Long> ordered = tableIds.stream().distinct().sorted().toList();
        translate("lock tables", () -> diningTableRepository.findAllByIdWithLock(ordered));
    }

    /**
     * Inserts or updates the booking and flushes, so constraint violations surface here
     * rather than at commit time.
     */
    public Booking save(Booking booking) {
        return translate("save booking", () -> bookingRepository.saveAndFlush(booking));
    }

    /**
     * Runs work in a read-write transaction bounded by the given timeout.
     */
    public <T> T inTransaction(Duration timeout, Supplier<T> work) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setTimeout(Math.max(1, (int) timeout.toSeconds()));
        try {
            return template.execute(status -> work.get());
        } catch (TransactionException e) {
            StorageErrorKind kind = StorageErrorKind.classify(e);
            throw new StorageException(kind, "Booking transaction failed: " + kind, e);
        } catch (DataAccessException e) {
            throw toStorageException("commit booking transaction", e);
        }
    }

    private <T> T translate(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw toStorageException(operation, e);
        }
    }

    private StorageException toStorageException(String operation, DataAccessException e) {
        StorageErrorKind kind = StorageErrorKind.classify(e);
        if (kind.isRetryable()) {
            log.warn("Transient storage failure during {}: {}", operation, kind);
        } else {
            log.error("Storage failure during {}: {}", operation, kind, e);
        }
        return new StorageException(kind, "Failed to " + operation + " (" + kind + ")", e);
    }
}
