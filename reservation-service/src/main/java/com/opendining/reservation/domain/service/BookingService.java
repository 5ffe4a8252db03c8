package com.opendining.reservation.domain.service;

import com.opendining.common.exception.ResourceNotFoundException;
import com.opendining.reservation.api.dto.CreateBookingRequest;
import com.opendining.reservation.api.dto.RescheduleBookingRequest;
import com.opendining.reservation.config.BookingProperties;
import com.opendining.reservation.domain.assignment.FloorSnapshot;
import com.opendining.reservation.domain.assignment.TableAssignment;
import com.opendining.reservation.domain.assignment.TableAssignmentResolver;
import com.opendining.reservation.domain.availability.AvailabilityReporter;
import com.opendining.reservation.domain.availability.SlotEvaluation;
import com.opendining.reservation.domain.availability.SlotEvaluator;
import com.opendining.reservation.domain.lock.BookingLockCoordinator;
import com.opendining.reservation.domain.model.Booking;
import com.opendining.reservation.domain.model.Booking.BookingSource;
import com.opendining.reservation.domain.model.Booking.BookingStatus;
import com.opendining.reservation.domain.model.DiningTable;
import com.opendining.reservation.domain.model.OperatingSchedule;
import com.opendining.reservation.domain.model.Restaurant;
import com.opendining.reservation.domain.pacing.PacingClassification;
import com.opendining.reservation.domain.storage.BookingStore;
import com.opendining.reservation.domain.storage.StorageErrorKind;
import com.opendining.reservation.domain.storage.StorageException;
import com.opendining.reservation.exception.BookingValidationException;
import com.opendining.reservation.exception.OverrideRequiredException;
import com.opendining.reservation.exception.RestaurantClosedException;
import com.opendining.reservation.exception.SlotUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Booking path: validate, lock the slot, re-check tables and pacing against a fresh floor,
 * persist.
 *
 * Everything that can be rejected without looking at other bookings is rejected before the
 * lock. Inside the lock the floor is re-read in a transaction bounded by the operation timeout,
 * so the availability seen by the caller earlier is never trusted. Alternative times for a
 * capacity conflict are computed after the lock is released.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    private static final Map<BookingStatus, Set<BookingStatus>> ALLOWED_TRANSITIONS = Map.of(
            BookingStatus.PENDING, EnumSet.of(BookingStatus.CONFIRMED, BookingStatus.CANCELLED,
                    BookingStatus.COMPLETED, BookingStatus.NO_SHOW),
            BookingStatus.CONFIRMED, EnumSet.of(BookingStatus.CANCELLED, BookingStatus.COMPLETED,
                    BookingStatus.NO_SHOW),
            BookingStatus.CANCELLED, EnumSet.noneOf(BookingStatus.class),
            BookingStatus.COMPLETED, EnumSet.noneOf(BookingStatus.class),
            BookingStatus.NO_SHOW, EnumSet.noneOf(BookingStatus.class),
            BookingStatus.WAITLISTED, EnumSet.of(BookingStatus.CANCELLED));

    private static final int MAX_ASSIGNMENT_ATTEMPTS = 3;

    private final RestaurantDirectory restaurantDirectory;
    private final TurnTimeResolver turnTimeResolver;
    private final SlotGridGenerator slotGridGenerator;
    private final TableAssignmentResolver tableAssignmentResolver;
    private final SlotEvaluator slotEvaluator;
    private final AvailabilityReporter availabilityReporter;
    private final BookingLockCoordinator lockCoordinator;
    private final BookingStore bookingStore;
    private final BookingProperties bookingProperties;
    private final Clock clock;

    /**
     * @throws SlotUnavailableException   no table can take the party; carries alternative times
     * @throws OverrideRequiredException  pacing ceiling reached and no override was given
     * @throws RestaurantClosedException  no service on the date
     */
    public Booking createBooking(CreateBookingRequest request) {
        BookingSource source = request.sourceOrDefault();
        LocalTime time = request.time().truncatedTo(ChronoUnit.MINUTES);
        Restaurant restaurant = validate(request.restaurantId(), request.date(), time, request.partySize(),
                source, request.overridePacing(), request.overrideReason());
        if (request.joinWaitlist() && !restaurant.isWaitlistEnabled()) {
            throw new BookingValidationException("Restaurant " + restaurant.getId() + " does not take a waitlist");
        }
        int duration = request.durationMinutes() != null
                ? request.durationMinutes()
                : turnTimeResolver.resolveDuration(restaurant.getId(), request.partySize(), restaurant);
        SlotRequest slot = new SlotRequest(restaurant, request.date(), time, request.partySize(), duration,
                request.preferredTableId(), request.overridePacing());

        try {
            Booking booking = lockCoordinator.withLock(restaurant.getId(), slot.date(), slot.time(), () ->
                    bookingStore.inTransaction(operationTimeout(), () -> {
                        Booking created = Booking.builder()
                                .restaurantId(restaurant.getId())
                                .bookingDate(slot.date())
                                .bookingTime(slot.time())
                                .durationMinutes(duration)
                                .partySize(slot.partySize())
                                .status(source == BookingSource.STAFF ? BookingStatus.CONFIRMED : BookingStatus.PENDING)
                                .source(source)
                                .customerName(request.customerName())
                                .customerEmail(request.customerEmail())
                                .customerPhone(request.customerPhone())
                                .notes(request.notes())
                                .overridePacing(request.overridePacing())
                                .overrideReason(request.overridePacing() ? request.overrideReason().trim() : null)
                                .build();
                        try {
                            applyAssignment(created, assignAndLockTables(slot, null));
                        } catch (SlotUnavailableException full) {
                            if (!request.joinWaitlist()) {
                                throw full;
                            }
                            created.setStatus(BookingStatus.WAITLISTED);
                        }
                        return persist(created, slot);
                    }));
            if (booking.getStatus() == BookingStatus.WAITLISTED) {
                log.info("Booking {} waitlisted: restaurant {} {} {} party {}", booking.getId(),
                        booking.getRestaurantId(), booking.getBookingDate(), booking.getBookingTime(),
                        booking.getPartySize());
            } else {
                log.info("Booking {} created: restaurant {} {} {} party {} table {} ({} min)",
                        booking.getId(), booking.getRestaurantId(), booking.getBookingDate(), booking.getBookingTime(),
                        booking.getPartySize(), assignmentLabel(booking), booking.getDurationMinutes());
            }
            return booking;
        } catch (SlotUnavailableException e) {
            throw withAlternatives(e, duration);
        }
    }

    /**
     * Moves a booking under the target slot's lock. The booking's own current occupancy does not
     * count against the new slot.
     */
    public Booking rescheduleBooking(Long bookingId, RescheduleBookingRequest request) {
        Booking existing = getBooking(bookingId);
        requireActive(existing, "rescheduled");

        int partySize = request.partySize() != null ? request.partySize() : existing.getPartySize();
        LocalTime time = request.time().truncatedTo(ChronoUnit.MINUTES);
        Restaurant restaurant = validate(existing.getRestaurantId(), request.date(), time, partySize,
                request.sourceOrDefault(), request.overridePacing(), request.overrideReason());
        int duration = request.durationMinutes() != null
                ? request.durationMinutes()
                : turnTimeResolver.resolveDuration(restaurant.getId(), partySize, restaurant);
        SlotRequest slot = new SlotRequest(restaurant, request.date(), time, partySize, duration,
                request.preferredTableId(), request.overridePacing());

        try {
            Booking booking = lockCoordinator.withLock(restaurant.getId(), slot.date(), slot.time(), () ->
                    bookingStore.inTransaction(operationTimeout(), () -> {
                        Booking current = getBooking(bookingId);
                        requireActive(current, "rescheduled");
                        TableAssignment assignment = assignAndLockTables(slot, bookingId);
                        current.setBookingDate(slot.date());
                        current.setBookingTime(slot.time());
                        current.setPartySize(slot.partySize());
                        current.setDurationMinutes(duration);
                        if (request.overridePacing()) {
                            current.setOverridePacing(true);
                            current.setOverrideReason(request.overrideReason().trim());
                        }
                        applyAssignment(current, assignment);
                        return persist(current, slot);
                    }));
            log.info("Booking {} rescheduled to {} {} party {} table {}",
                    bookingId, booking.getBookingDate(), booking.getBookingTime(), booking.getPartySize(),
                    assignmentLabel(booking));
            return booking;
        } catch (SlotUnavailableException e) {
            throw withAlternatives(e, duration);
        }
    }

    /**
     * Cancelling frees capacity, so no slot lock is needed. Cancelling twice is a no-op.
     * A freed table is offered to the day's waitlist afterwards.
     */
    public Booking cancelBooking(Long bookingId) {
        boolean freesTable = getBooking(bookingId).isOccupying();
        Booking booking = bookingStore.inTransaction(operationTimeout(), () -> {
            Booking current = getBooking(bookingId);
            if (current.getStatus() == BookingStatus.CANCELLED) {
                return current;
            }
            transition(current, BookingStatus.CANCELLED);
            return bookingStore.save(current);
        });
        log.info("Booking {} cancelled: restaurant {} {} {}", bookingId, booking.getRestaurantId(),
                booking.getBookingDate(), booking.getBookingTime());
        if (freesTable) {
            promoteAfterRelease(booking);
        }
        return booking;
    }

    /**
     * Confirm, complete or mark a no-show. None of these adds load to a slot.
     */
    public Booking updateStatus(Long bookingId, BookingStatus status) {
        if (status == BookingStatus.CANCELLED) {
            return cancelBooking(bookingId);
        }
        Booking booking = bookingStore.inTransaction(operationTimeout(), () -> {
            Booking current = getBooking(bookingId);
            transition(current, status);
            return bookingStore.save(current);
        });
        log.info("Booking {} is now {}", bookingId, status);
        if (status == BookingStatus.NO_SHOW) {
            promoteAfterRelease(booking);
        }
        return booking;
    }

    /**
     * Seats waitlisted parties of the day, oldest first, at their requested time. Each promotion
     * runs under that slot's lock like a new booking and respects pacing; parties that still do
     * not fit stay on the waitlist.
     *
     * @return the bookings that were seated
     */
    public List<Booking> promoteWaitlist(Long restaurantId, LocalDate date) {
        Restaurant restaurant = restaurantDirectory.getRestaurant(restaurantId);
        List<Booking> promoted = new ArrayList<>();
        for (Booking queued : bookingStore.findWaitlisted(restaurantId, date)) {
            SlotRequest slot = new SlotRequest(restaurant, date, queued.getBookingTime(), queued.getPartySize(),
                    queued.getDurationMinutes(), null, false);
            try {
                Booking seated = lockCoordinator.withLock(restaurantId, date, slot.time(), () ->
                        bookingStore.inTransaction(operationTimeout(), () -> {
                            Booking current = getBooking(queued.getId());
                            if (current.getStatus() != BookingStatus.WAITLISTED) {
                                return null;
                            }
                            applyAssignment(current, assignAndLockTables(slot, null));
                            current.setStatus(BookingStatus.CONFIRMED);
                            return persist(current, slot);
                        }));
                if (seated != null) {
                    log.info("Waitlisted booking {} seated at {} {} table {}", seated.getId(), date,
                            seated.getBookingTime(), assignmentLabel(seated));
                    promoted.add(seated);
                }
            } catch (SlotUnavailableException | OverrideRequiredException e) {
                log.debug("Waitlisted booking {} still cannot be seated at {} {}: {}", queued.getId(), date,
                        queued.getBookingTime(), e.getMessage());
            }
        }
        return promoted;
    }

    public List<Booking> getWaitlist(Long restaurantId, LocalDate date) {
        restaurantDirectory.getRestaurant(restaurantId);
        return bookingStore.findWaitlisted(restaurantId, date);
    }

    public Booking getBooking(Long bookingId) {
        return bookingStore.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
    }

    public List<Booking> listBookings(Long restaurantId, LocalDate date) {
        restaurantDirectory.getRestaurant(restaurantId);
        return bookingStore.findForDay(restaurantId, date);
    }

    /**
     * Request checks that do not depend on other bookings. Returns the restaurant.
     */
    Restaurant validate(Long restaurantId, LocalDate date, LocalTime time, int partySize,
                        BookingSource source, boolean overridePacing, String overrideReason) {
        if (partySize < bookingProperties.minPartySize() || partySize > bookingProperties.maxPartySize()) {
            throw new BookingValidationException(String.format("Party size must be between %d and %d, got %d",
                    bookingProperties.minPartySize(), bookingProperties.maxPartySize(), partySize));
        }
        if (overridePacing) {
            if (source != BookingSource.STAFF) {
                throw new BookingValidationException("Only staff bookings may override pacing");
            }
            if (overrideReason == null || overrideReason.trim().length() < bookingProperties.minOverrideReasonLength()) {
                throw new BookingValidationException(String.format(
                        "Override reason must be at least %d characters", bookingProperties.minOverrideReasonLength()));
            }
        }

        Restaurant restaurant = restaurantDirectory.getRestaurant(restaurantId);
        LocalDate today = LocalDate.now(clock);
        if (date.isBefore(today)) {
            throw new BookingValidationException("Cannot book a date in the past: " + date);
        }
        int maxAdvanceDays = restaurant.getMaxAdvanceBookingDays() != null
                ? restaurant.getMaxAdvanceBookingDays() : Restaurant.DEFAULT_MAX_ADVANCE_BOOKING_DAYS;
        if (date.isAfter(today.plusDays(maxAdvanceDays))) {
            throw new BookingValidationException(String.format(
                    "Bookings open at most %d days in advance; %s is too far out", maxAdvanceDays, date));
        }

        OperatingSchedule schedule = restaurantDirectory.getSchedule(restaurantId);
        if (!schedule.isOpenOn(date)) {
            throw new RestaurantClosedException(restaurantId, date);
        }
        if (!slotGridGenerator.isSlotStart(restaurant, schedule, date, time)) {
            throw new BookingValidationException("Time " + time + " is not a bookable slot on " + date);
        }
        return restaurant;
    }

    /**
     * Picks tables under the slot lock, then row-locks them and re-reads the floor. Writers of
     * other slots can hold the same table over an overlapping interval, so the pick only stands
     * once it is still free after the row lock; otherwise the party is re-assigned on the
     * fresh floor.
     */
    private TableAssignment assignAndLockTables(SlotRequest slot, Long movingBookingId) {
        TableAssignment assignment = assign(loadFloor(slot, movingBookingId), slot);
        int start = FloorSnapshot.minuteOf(slot.time());
        int end = start + slot.durationMinutes();
        for (int attempt = 1; ; attempt++) {
            bookingStore.lockTables(assignment.tableIds());
            FloorSnapshot locked = loadFloor(slot, movingBookingId);
            if (assignment.tables().stream().allMatch(t -> locked.isFree(t, start, end))) {
                return assignment;
            }
            if (attempt >= MAX_ASSIGNMENT_ATTEMPTS) {
                throw new SlotUnavailableException(slot.restaurant().getId(), slot.date(), slot.time(),
                        slot.partySize());
            }
            log.debug("Table {} was taken by an overlapping booking before {} {} could claim it, re-assigning",
                    assignment.tableIds(), slot.date(), slot.time());
            assignment = assign(locked, slot);
        }
    }

    private FloorSnapshot loadFloor(SlotRequest slot, Long movingBookingId) {
        FloorSnapshot floor = tableAssignmentResolver.loadSnapshot(slot.restaurant().getId(), slot.date());
        return movingBookingId == null ? floor : floor.excluding(movingBookingId);
    }

    /**
     * Runs under the slot lock against a freshly read floor.
     */
    private TableAssignment assign(FloorSnapshot floor, SlotRequest slot) {
        SlotEvaluation evaluation = slotEvaluator.evaluate(floor, slot.restaurant().pacingLimitsOrDefault(),
                slot.time(), slot.partySize(), slot.durationMinutes());
        PacingClassification classification = evaluation.classification();

        TableAssignment assignment = evaluation.tables().best().orElseThrow(() -> new SlotUnavailableException(
                slot.restaurant().getId(), slot.date(), slot.time(), slot.partySize()));

        if (classification.requiresOverride()) {
            if (!slot.overridePacing()) {
                log.debug("Slot {} {} of restaurant {} needs an override ({}% utilized)", slot.date(), slot.time(),
                        slot.restaurant().getId(), classification.utilizationPercent());
                throw new OverrideRequiredException(slot.date(), slot.time(), classification);
            }
            log.info("Pacing override at restaurant {} {} {}: party {} on a slot at {}% utilization",
                    slot.restaurant().getId(), slot.date(), slot.time(), slot.partySize(),
                    classification.utilizationPercent());
        }

        if (slot.preferredTableId() != null) {
            if (tableAssignmentResolver.canSeat(floor, slot.preferredTableId(), slot.time(),
                    slot.partySize(), slot.durationMinutes())) {
                return TableAssignment.single(findTable(floor, slot.preferredTableId()));
            }
            log.debug("Preferred table {} cannot take party {} at {} {}, using best table",
                    slot.preferredTableId(), slot.partySize(), slot.date(), slot.time());
        }
        return assignment;
    }

    private Booking persist(Booking booking, SlotRequest slot) {
        try {
            return bookingStore.save(booking);
        } catch (StorageException e) {
            if (e.getKind() == StorageErrorKind.INTEGRITY_VIOLATION) {
                throw new SlotUnavailableException(slot.restaurant().getId(), slot.date(), slot.time(),
                        slot.partySize(), e);
            }
            throw e;
        }
    }

    /**
     * The release is already committed; a failed promotion leaves the queue for the next
     * release or a manual run.
     */
    private void promoteAfterRelease(Booking released) {
        try {
            promoteWaitlist(released.getRestaurantId(), released.getBookingDate());
        } catch (RuntimeException e) {
            log.warn("Waitlist promotion for restaurant {} on {} failed after booking {} was released: {}",
                    released.getRestaurantId(), released.getBookingDate(), released.getId(), e.getMessage());
        }
    }

    private SlotUnavailableException withAlternatives(SlotUnavailableException conflict, int duration) {
        try {
            List<LocalTime> alternatives = availabilityReporter.alternativeTimes(conflict.getRestaurantId(),
                    conflict.getDate(), conflict.getTime(), conflict.getPartySize(), duration);
            return conflict.withAlternatives(alternatives);
        } catch (RuntimeException e) {
            log.warn("Could not compute alternatives for {} {} of restaurant {}: {}",
                    conflict.getDate(), conflict.getTime(), conflict.getRestaurantId(), e.getMessage());
            return conflict;
        }
    }

    private static void applyAssignment(Booking booking, TableAssignment assignment) {
        booking.setTableId(assignment.primaryTable().getId());
        booking.setJoinedTableIds(new ArrayList<>(assignment.joinedTableIds()));
    }

    private static DiningTable findTable(FloorSnapshot floor, Long tableId) {
        return floor.tables().stream()
                .filter(t -> Objects.equals(t.getId(), tableId))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Table", tableId));
    }

    private static void requireActive(Booking booking, String action) {
        if (booking.getStatus() != BookingStatus.PENDING && booking.getStatus() != BookingStatus.CONFIRMED) {
            throw new BookingValidationException(String.format("Booking %d is %s and cannot be %s",
                    booking.getId(), booking.getStatus(), action));
        }
    }

    private static void transition(Booking booking, BookingStatus target) {
        BookingStatus from = booking.getStatus() != null ? booking.getStatus() : BookingStatus.PENDING;
        if (!ALLOWED_TRANSITIONS.get(from).contains(target)) {
            throw new BookingValidationException(String.format("Cannot change booking %d from %s to %s",
                    booking.getId(), from, target));
        }
        booking.setStatus(target);
    }

    private static String assignmentLabel(Booking booking) {
        if (booking.getJoinedTableIds() == null || booking.getJoinedTableIds().isEmpty()) {
            return String.valueOf(booking.getTableId());
        }
        return booking.getTableId() + "+" + booking.getJoinedTableIds();
    }

    private Duration operationTimeout() {
        return lockCoordinator.getProperties().operationTimeout();
    }

    private record SlotRequest(Restaurant restaurant, LocalDate date, LocalTime time, int partySize,
                               int durationMinutes, Long preferredTableId, boolean overridePacing) {
    }
}
