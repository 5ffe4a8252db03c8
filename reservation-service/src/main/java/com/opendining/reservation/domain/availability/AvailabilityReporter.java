package com.opendining.reservation.domain.availability;

import com.opendining.reservation.config.BookingProperties;
import com.opendining.reservation.domain.assignment.FloorSnapshot;
import com.opendining.reservation.domain.assignment.TableAssignmentResolver;
import com.opendining.reservation.domain.model.OperatingSchedule;
import com.opendining.reservation.domain.model.PacingLimits;
import com.opendining.reservation.domain.model.PacingStatus;
import com.opendining.reservation.domain.model.Restaurant;
import com.opendining.reservation.domain.service.RestaurantDirectory;
import com.opendining.reservation.domain.service.SlotGridGenerator;
import com.opendining.reservation.domain.service.TurnTimeResolver;
import com.opendining.reservation.exception.BookingValidationException;
import com.opendining.reservation.exception.RestaurantClosedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the per-slot availability of a day for one party size.
 *
 * Lock-free and read-only: the floor is read once and every slot is evaluated against that
 * snapshot, so two reports over unchanged data are identical. A slot that fails to evaluate is
 * reported with its failure and the rest of the day is still returned.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityReporter {

    private final RestaurantDirectory restaurantDirectory;
    private final SlotGridGenerator slotGridGenerator;
    private final TurnTimeResolver turnTimeResolver;
    private final TableAssignmentResolver tableAssignmentResolver;
    private final SlotEvaluator slotEvaluator;
    private final BookingProperties bookingProperties;

    /**
     * @param preferredTime optional; breaks utilization ties in the best-availability list
     */
    public AvailabilityReport report(Long restaurantId, LocalDate date, int partySize, LocalTime preferredTime) {
        validatePartySize(partySize);
        Restaurant restaurant = restaurantDirectory.getRestaurant(restaurantId);
        OperatingSchedule schedule = restaurantDirectory.getSchedule(restaurantId);
        if (!schedule.isOpenOn(date)) {
            throw new RestaurantClosedException(restaurantId, date);
        }

        int duration = turnTimeResolver.resolveDuration(restaurantId, partySize, restaurant);
        List<SlotAvailability> slots = evaluateDay(restaurant, schedule, date, partySize, duration);

        log.debug("Availability for restaurant {} on {} party {}: {} slots, {} bookable",
                restaurantId, date, partySize, slots.size(), slots.stream().filter(SlotAvailability::isBookable).count());
        return new AvailabilityReport(restaurantId, date, partySize, duration, slots,
                suggest(slots, preferredTime));
    }

    /**
     * Free tables for an exact time. The time must fall inside a service period.
     */
    public TableAvailability findTables(Long restaurantId, LocalDate date, LocalTime time, int partySize) {
        validatePartySize(partySize);
        Restaurant restaurant = restaurantDirectory.getRestaurant(restaurantId);
        OperatingSchedule schedule = restaurantDirectory.getSchedule(restaurantId);
        if (!schedule.isOpenOn(date)) {
            throw new RestaurantClosedException(restaurantId, date);
        }
        if (!slotGridGenerator.isSlotStart(restaurant, schedule, date, time)) {
            throw new BookingValidationException("Time " + time + " is not a bookable slot on " + date);
        }
        int duration = turnTimeResolver.resolveDuration(restaurantId, partySize, restaurant);
        FloorSnapshot floor = tableAssignmentResolver.loadSnapshot(restaurantId, date);
        SlotEvaluation evaluation = slotEvaluator.evaluate(floor, restaurant.pacingLimitsOrDefault(),
                time, partySize, duration);
        return new TableAvailability(restaurantId, date, partySize, duration, evaluation);
    }

    /**
     * Bookable times nearest to {@code time} on the same day, excluding {@code time} itself.
     * Empty when the restaurant is closed that day.
     */
    public List<LocalTime> alternativeTimes(Long restaurantId, LocalDate date, LocalTime time,
                                            int partySize, int durationMinutes) {
        Restaurant restaurant = restaurantDirectory.getRestaurant(restaurantId);
        OperatingSchedule schedule = restaurantDirectory.getSchedule(restaurantId);
        if (!schedule.isOpenOn(date)) {
            return List.of();
        }
        List<SlotAvailability> slots = evaluateDay(restaurant, schedule, date, partySize, durationMinutes);
        return nearestBookable(slots, time, bookingProperties.maxAlternatives());
    }

    private List<SlotAvailability> evaluateDay(Restaurant restaurant, OperatingSchedule schedule, LocalDate date,
                                               int partySize, int duration) {
        List<LocalTime> grid = slotGridGenerator.generateSlots(restaurant, schedule, date);
        FloorSnapshot floor = tableAssignmentResolver.loadSnapshot(restaurant.getId(), date);
        PacingLimits limits = restaurant.pacingLimitsOrDefault();

        List<SlotAvailability> slots = new ArrayList<>(grid.size());
        for (LocalTime time : grid) {
            try {
                slots.add(SlotAvailability.of(slotEvaluator.evaluate(floor, limits, time, partySize, duration)));
            } catch (RuntimeException e) {
                log.warn("Could not evaluate slot {} {} of restaurant {}: {}",
                        date, time, restaurant.getId(), e.getMessage(), e);
                slots.add(SlotAvailability.failed(time, e.getMessage() != null ? e.getMessage() : e.toString()));
            }
        }

        List<SlotAvailability> withAlternatives = new ArrayList<>(slots.size());
        for (SlotAvailability slot : slots) {
            if (slot.isBookable() || slot.isFailed()) {
                withAlternatives.add(slot);
            } else {
                withAlternatives.add(slot.withAlternatives(
                        nearestBookable(slots, slot.time(), bookingProperties.maxAlternatives())));
            }
        }
        return withAlternatives;
    }

    /**
     * Scans outward from {@code from}: nearest first, the earlier time wins a tie.
     */
    static List<LocalTime> nearestBookable(List<SlotAvailability> slots, LocalTime from, int limit) {
        int origin = FloorSnapshot.minuteOf(from);
        return slots.stream()
                .filter(SlotAvailability::isBookable)
                .map(SlotAvailability::time)
                .filter(t -> !t.equals(from))
                .sorted(Comparator.<LocalTime>comparingInt(t -> Math.abs(FloorSnapshot.minuteOf(t) - origin))
                        .thenComparing(Comparator.naturalOrder()))
                .limit(limit)
                .toList();
    }

    private AvailabilitySuggestions suggest(List<SlotAvailability> slots, LocalTime preferredTime) {
        int limit = bookingProperties.maxSuggestions();
        Comparator<SlotAvailability> byUtilization = Comparator.comparingDouble(SlotAvailability::utilizationPercent);
        if (preferredTime != null) {
            int preferred = FloorSnapshot.minuteOf(preferredTime);
            byUtilization = byUtilization.thenComparingInt(s -> Math.abs(FloorSnapshot.minuteOf(s.time()) - preferred));
        }
        Comparator<SlotAvailability> bestOrder = byUtilization.thenComparing(SlotAvailability::time);

        List<SlotAvailability> best = slots.stream()
                .filter(SlotAvailability::isBookable)
                .sorted(bestOrder)
                .limit(limit)
                .toList();
        List<SlotAvailability> quiet = slots.stream()
                .filter(s -> !s.isFailed() && s.status() == PacingStatus.AVAILABLE)
                .limit(limit)
                .toList();
        List<SlotAvailability> peak = slots.stream()
                .filter(s -> !s.isFailed()
                        && (s.status() == PacingStatus.BUSY || s.status() == PacingStatus.PACING_FULL))
                .limit(limit)
                .toList();
        return new AvailabilitySuggestions(best, quiet, peak);
    }

    private void validatePartySize(int partySize) {
        if (partySize < bookingProperties.minPartySize() || partySize > bookingProperties.maxPartySize()) {
            throw new BookingValidationException(String.format("Party size must be between %d and %d, got %d",
                    bookingProperties.minPartySize(), bookingProperties.maxPartySize(), partySize));
        }
    }
}
