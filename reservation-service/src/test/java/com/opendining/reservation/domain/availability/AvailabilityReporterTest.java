package com.opendining.reservation.domain.availability;

import com.opendining.reservation.config.BookingProperties;
import com.opendining.reservation.domain.assignment.TableAssignmentResolver;
import com.opendining.reservation.domain.model.DiningTable;
import com.opendining.reservation.domain.model.OperatingSchedule;
import com.opendining.reservation.domain.model.PacingStatus;
import com.opendining.reservation.domain.model.Restaurant;
import com.opendining.reservation.domain.pacing.PacingClassifier;
import com.opendining.reservation.domain.repository.DiningTableRepository;
import com.opendining.reservation.domain.service.RestaurantDirectory;
import com.opendining.reservation.domain.service.SlotGridGenerator;
import com.opendining.reservation.domain.service.TurnTimeResolver;
import com.opendining.reservation.exception.BookingValidationException;
import com.opendining.reservation.exception.RestaurantClosedException;
import com.opendining.reservation.support.InMemoryBookingStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static com.opendining.reservation.support.Fixtures.RESTAURANT_ID;
import static com.opendining.reservation.support.Fixtures.booking;
import static com.opendining.reservation.support.Fixtures.dinnerOn;
import static com.opendining.reservation.support.Fixtures.period;
import static com.opendining.reservation.support.Fixtures.restaurant;
import static com.opendining.reservation.support.Fixtures.restaurantWithCoversCeiling;
import static com.opendining.reservation.support.Fixtures.table;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

@ExtendWith(MockitoExtension.class)
class AvailabilityReporterTest {

    private static final LocalDate FRIDAY = LocalDate.of(2030, 3, 15);

    @Mock
    private RestaurantDirectory restaurantDirectory;

    @Mock
    private TurnTimeResolver turnTimeResolver;

    @Mock
    private DiningTableRepository diningTableRepository;

    private InMemoryBookingStore bookingStore;
    private TableAssignmentResolver tableAssignmentResolver;
    private SlotEvaluator slotEvaluator;

    @BeforeEach
    void setUp() {
        bookingStore = new InMemoryBookingStore();
        tableAssignmentResolver = new TableAssignmentResolver(diningTableRepository, bookingStore);
        slotEvaluator = new SlotEvaluator(tableAssignmentResolver, new PacingClassifier());
    }

    @Test
    @DisplayName("Single 2-4 table booked 18:00-19:30: 18:00 is physically full with alternatives from 19:30")
    void singleTable_physicallyFullWithAlternatives() {
        Restaurant restaurant = restaurant();
        givenFloor(restaurant, List.of(table(1, 2, 4)), 90);
        bookingStore.add(booking(10, FRIDAY, "18:00", 90, 4, 1L));

        AvailabilityReport report = reporter().report(RESTAURANT_ID, FRIDAY, 4, null);

        SlotAvailability six = slot(report, "18:00");
        assertThat(six.status()).isEqualTo(PacingStatus.PHYSICALLY_FULL);
        assertThat(six.tablesAvailable()).isZero();
        assertThat(six.canOverride()).isFalse();
        assertThat(six.alternativeTimes()).isNotEmpty().hasSizeLessThanOrEqualTo(4);
        assertThat(six.alternativeTimes()).allMatch(t -> !t.isBefore(LocalTime.of(19, 30)));
        assertThat(six.alternativeTimes().get(0)).isEqualTo(LocalTime.of(19, 30));

        assertThat(slot(report, "19:00").status()).isEqualTo(PacingStatus.PHYSICALLY_FULL);
        assertThat(slot(report, "19:30").status()).isEqualTo(PacingStatus.AVAILABLE);
        assertThat(slot(report, "19:30").suggestedTableIds()).containsExactly(1L);
        assertThat(report.durationMinutes()).isEqualTo(90);
    }

    @Test
    @DisplayName("Alternatives are nearest first and the earlier time wins a tie")
    void alternativesNearestFirst() {
        Restaurant restaurant = restaurant();
        givenFloor(restaurant, List.of(table(1, 2, 4)), 30);
        bookingStore.add(booking(10, FRIDAY, "20:00", 30, 4, 1L));

        AvailabilityReport report = reporter().report(RESTAURANT_ID, FRIDAY, 4, null);

        assertThat(slot(report, "20:00").alternativeTimes()).extracting(LocalTime::toString)
                .containsExactly("19:30", "20:30", "19:00", "21:00");
    }

    @Test
    @DisplayName("20-cover ceiling with 18 held at 19:00: a party of 4 sees pacing full")
    void coversCeiling_pacingFull() {
        Restaurant restaurant = restaurantWithCoversCeiling(20);
        List<DiningTable> tables = IntStream.rangeClosed(1, 10).mapToObj(i -> table(i, 1, 4)).toList();
        givenFloor(restaurant, tables, 90);
        for (int i = 1; i <= 6; i++) {
            bookingStore.add(booking(100 + i, FRIDAY, "19:00", 90, 3, (long) i));
        }

        AvailabilityReport report = reporter().report(RESTAURANT_ID, FRIDAY, 4, null);

        SlotAvailability seven = slot(report, "19:00");
        assertThat(seven.status()).isEqualTo(PacingStatus.PACING_FULL);
        assertThat(seven.canOverride()).isTrue();
        assertThat(seven.utilizationPercent()).isEqualTo(90.0);
        assertThat(seven.committedCovers()).isEqualTo(18);
        assertThat(seven.committedBookings()).isEqualTo(6);
        assertThat(report.suggestions().peakTimes()).extracting(SlotAvailability::time)
                .contains(LocalTime.of(19, 0));
        assertThat(report.suggestions().bestAvailability()).extracting(SlotAvailability::time)
                .doesNotContain(LocalTime.of(19, 0));
    }

    @Test
    @DisplayName("Best availability ranks by utilization, then distance to the preferred time, then time")
    void bestAvailabilityOrdering() {
        Restaurant restaurant = restaurant();
        givenFloor(restaurant, List.of(table(1, 1, 4), table(2, 1, 4)), 90);

        AvailabilityReport report = reporter().report(RESTAURANT_ID, FRIDAY, 2, LocalTime.of(20, 0));

        assertThat(report.suggestions().bestAvailability()).extracting(s -> s.time().toString())
                .containsExactly("20:00", "19:30", "20:30", "19:00", "21:00");
        assertThat(report.suggestions().quietTimes()).hasSize(5);
        assertThat(report.suggestions().peakTimes()).isEmpty();
    }

    @Test
    @DisplayName("Two reports over unchanged data are identical")
    void idempotent() {
        Restaurant restaurant = restaurant();
        givenFloor(restaurant, List.of(table(1, 2, 4), table(2, 2, 6)), 90);
        bookingStore.add(booking(10, FRIDAY, "19:00", 90, 4, 1L));

        AvailabilityReporter reporter = reporter();
        AvailabilityReport first = reporter.report(RESTAURANT_ID, FRIDAY, 4, LocalTime.of(19, 0));
        AvailabilityReport second = reporter.report(RESTAURANT_ID, FRIDAY, 4, LocalTime.of(19, 0));

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("A slot that fails to evaluate is reported with its failure; the rest of the day survives")
    void failingSlot_doesNotAbortReport() {
        Restaurant restaurant = restaurant();
        givenFloor(restaurant, List.of(table(1, 2, 4)), 90);
        slotEvaluator = spy(slotEvaluator);
        doThrow(new IllegalStateException("floor plan corrupt"))
                .when(slotEvaluator).evaluate(any(), any(), eq(LocalTime.of(19, 0)), anyInt(), anyInt());

        AvailabilityReport report = reporter().report(RESTAURANT_ID, FRIDAY, 2, null);

        assertThat(report.slots()).hasSize(9);
        SlotAvailability failed = slot(report, "19:00");
        assertThat(failed.failure()).isEqualTo("floor plan corrupt");
        assertThat(failed.isBookable()).isFalse();
        assertThat(slot(report, "19:30").status()).isEqualTo(PacingStatus.AVAILABLE);
    }

    @Test
    @DisplayName("Closed day fails with RestaurantClosedException rather than an empty report")
    void closedDay() {
        given(restaurantDirectory.getRestaurant(RESTAURANT_ID)).willReturn(restaurant());
        given(restaurantDirectory.getSchedule(RESTAURANT_ID))
                .willReturn(new OperatingSchedule(RESTAURANT_ID, List.of(period(DayOfWeek.MONDAY, "18:00", "22:00"))));

        assertThatThrownBy(() -> reporter().report(RESTAURANT_ID, FRIDAY, 2, null))
                .isInstanceOf(RestaurantClosedException.class)
                .extracting("errorCode")
                .isEqualTo("RESTAURANT_CLOSED");
    }

    @Test
    @DisplayName("Party size outside 1..50 is a validation error")
    void invalidPartySize() {
        assertThatThrownBy(() -> reporter().report(RESTAURANT_ID, FRIDAY, 0, null))
                .isInstanceOf(BookingValidationException.class);
        assertThatThrownBy(() -> reporter().report(RESTAURANT_ID, FRIDAY, 51, null))
                .isInstanceOf(BookingValidationException.class);
    }

    @Test
    @DisplayName("findTables reports candidates and pacing for an exact time")
    void findTables() {
        Restaurant restaurant = restaurant();
        givenFloor(restaurant, List.of(table(1, 2, 4), table(2, 2, 2)), 90);

        TableAvailability availability = reporter().findTables(RESTAURANT_ID, FRIDAY, LocalTime.of(19, 0), 2);

        assertThat(availability.evaluation().tables().count()).isEqualTo(2);
        assertThat(availability.evaluation().tables().best()).get()
                .extracting(a -> a.primaryTable().getId()).isEqualTo(2L);
        assertThat(availability.durationMinutes()).isEqualTo(90);
    }

    @Test
    @DisplayName("findTables rejects times outside service, off the slot grid or after last seating")
    void findTables_notASlot() {
        Restaurant restaurant = restaurant();
        restaurant.setLastSeatingOffsetMinutes(60);
        given(restaurantDirectory.getRestaurant(RESTAURANT_ID)).willReturn(restaurant);
        given(restaurantDirectory.getSchedule(RESTAURANT_ID))
                .willReturn(new OperatingSchedule(RESTAURANT_ID, dinnerOn(FRIDAY)));
        AvailabilityReporter reporter = reporter();

        assertThatThrownBy(() -> reporter.findTables(RESTAURANT_ID, FRIDAY, LocalTime.of(15, 0), 2))
                .isInstanceOf(BookingValidationException.class);
        assertThatThrownBy(() -> reporter.findTables(RESTAURANT_ID, FRIDAY, LocalTime.of(19, 10), 2))
                .isInstanceOf(BookingValidationException.class);
        assertThatThrownBy(() -> reporter.findTables(RESTAURANT_ID, FRIDAY, LocalTime.of(21, 30), 2))
                .isInstanceOf(BookingValidationException.class);
    }

    private AvailabilityReporter reporter() {
        return new AvailabilityReporter(restaurantDirectory, new SlotGridGenerator(), turnTimeResolver,
                tableAssignmentResolver, slotEvaluator, BookingProperties.defaults());
    }

    private void givenFloor(Restaurant restaurant, List<DiningTable> tables, int duration) {
        given(restaurantDirectory.getRestaurant(RESTAURANT_ID)).willReturn(restaurant);
        given(restaurantDirectory.getSchedule(RESTAURANT_ID))
                .willReturn(new OperatingSchedule(RESTAURANT_ID, dinnerOn(FRIDAY)));
        given(diningTableRepository.findAssignable(RESTAURANT_ID)).willReturn(new ArrayList<>(tables));
        given(turnTimeResolver.resolveDuration(eq(RESTAURANT_ID), anyInt(), any(Restaurant.class))).willReturn(duration);
    }

    private static SlotAvailability slot(AvailabilityReport report, String time) {
        LocalTime wanted = LocalTime.parse(time);
        return report.slots().stream()
                .filter(s -> s.time().equals(wanted))
                .findFirst()
                .orElseThrow();
    }
}
