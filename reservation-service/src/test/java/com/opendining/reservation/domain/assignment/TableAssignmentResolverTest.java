package com.opendining.reservation.domain.assignment;

import com.opendining.reservation.domain.model.Booking;
import com.opendining.reservation.domain.model.DiningTable;
import com.opendining.reservation.domain.repository.DiningTableRepository;
import com.opendining.reservation.domain.storage.BookingStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.opendining.reservation.support.Fixtures.RESTAURANT_ID;
import static com.opendining.reservation.support.Fixtures.booking;
import static com.opendining.reservation.support.Fixtures.combinableTable;
import static com.opendining.reservation.support.Fixtures.table;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
class TableAssignmentResolverTest {

    private static final LocalDate DATE = LocalDate.of(2030, 3, 15);
    private static final LocalTime SEVEN_PM = LocalTime.of(19, 0);

    @Mock
    private DiningTableRepository diningTableRepository;

    @Mock
    private BookingStore bookingStore;

    @InjectMocks
    private TableAssignmentResolver resolver;

    @Test
    @DisplayName("Tightest fitting table wins, then higher priority, then lower id")
    void tightestFit() {
        DiningTable six = table(1, 1, 6);
        DiningTable fourLowPriority = table(2, 1, 4);
        DiningTable fourHighPriority = table(3, 1, 4);
        fourHighPriority.setPriority(5);
        DiningTable fourSameAsTwo = table(4, 1, 4);

        AvailableTables result = resolver.findAvailableTables(
                floor(List.of(six, fourLowPriority, fourHighPriority, fourSameAsTwo), List.of()), SEVEN_PM, 4, 90);

        assertThat(result.candidates()).extracting(DiningTable::getId).containsExactly(3L, 2L, 4L, 1L);
        assertThat(result.best()).get().extracting(TableAssignment::primaryTable).isSameAs(fourHighPriority);
        assertThat(result.count()).isEqualTo(4);
    }

    @Test
    @DisplayName("Tables outside their min/max range, inactive or deleted are never offered")
    void capacityAndActiveFilters() {
        DiningTable tooSmall = table(1, 1, 2);
        DiningTable minTooHigh = table(2, 6, 8);
        DiningTable inactive = table(3, 2, 4);
        inactive.setActive(false);
        DiningTable deleted = table(4, 2, 4);
        deleted.setDeletedAt(LocalDateTime.now());
        DiningTable fits = table(5, 2, 4);

        AvailableTables result = resolver.findAvailableTables(
                floor(List.of(tooSmall, minTooHigh, inactive, deleted, fits), List.of()), SEVEN_PM, 4, 90);

        assertThat(result.candidates()).extracting(DiningTable::getId).containsExactly(5L);
    }

    @Test
    @DisplayName("Overlap is half-open: a booking ending at 19:00 does not block 19:00")
    void halfOpenIntervals() {
        DiningTable only = table(1, 1, 4);
        Booking early = booking(10, DATE, "17:30", 90, 2, 1L);
        Booking overlapping = booking(11, DATE, "20:00", 90, 2, 1L);

        FloorSnapshot floor = floor(List.of(only), List.of(early));
        assertThat(resolver.findBestTable(floor, SEVEN_PM, 4, 60)).isPresent();

        FloorSnapshot blocked = floor(List.of(only), List.of(early, overlapping));
        assertThat(resolver.findBestTable(blocked, SEVEN_PM, 4, 90)).isEmpty();
        assertThat(resolver.findBestTable(blocked, SEVEN_PM, 4, 60)).isPresent();
    }

    @Test
    @DisplayName("Cancelled and no-show bookings free their table")
    void releasedBookingsIgnored() {
        DiningTable only = table(1, 1, 4);
        Booking cancelled = booking(10, DATE, "19:00", 90, 2, 1L);
        cancelled.setStatus(Booking.BookingStatus.CANCELLED);
        Booking noShow = booking(11, DATE, "19:30", 90, 2, 1L);
        noShow.setStatus(Booking.BookingStatus.NO_SHOW);

        assertThat(resolver.findBestTable(floor(List.of(only), List.of(cancelled, noShow)), SEVEN_PM, 4, 90))
                .isPresent();
    }

    @Test
    @DisplayName("A late booking from the previous evening still holds its table after midnight")
    void previousDayOverlap() {
        DiningTable only = table(1, 1, 4);
        Booking lateNight = booking(10, DATE.minusDays(1), "23:30", 120, 2, 1L);

        FloorSnapshot floor = floor(List.of(only), List.of(lateNight));

        assertThat(resolver.findBestTable(floor, LocalTime.of(0, 30), 2, 60)).isEmpty();
        assertThat(resolver.findBestTable(floor, LocalTime.of(1, 30), 2, 60)).isPresent();
    }

    @Test
    @DisplayName("Joined tables of a combination are held as well as the primary")
    void joinedTablesHeld() {
        DiningTable a = combinableTable(1, 1, 4, "terrace");
        DiningTable b = combinableTable(2, 1, 4, "terrace");
        Booking combined = booking(10, DATE, "19:00", 90, 8, 1L, 2L);

        AvailableTables result = resolver.findAvailableTables(floor(List.of(a, b), List.of(combined)), SEVEN_PM, 2, 90);

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.count()).isZero();
    }

    @Test
    @DisplayName("Without a single fit, combinable tables of one group are joined; the largest hosts")
    void combinationWithinGroup() {
        DiningTable terraceSmall = combinableTable(1, 1, 2, "terrace");
        DiningTable terraceLarge = combinableTable(2, 1, 6, "terrace");
        DiningTable insideLarge = combinableTable(3, 1, 6, "inside");
        DiningTable notCombinable = table(4, 1, 6);

        AvailableTables result = resolver.findAvailableTables(
                floor(List.of(terraceSmall, terraceLarge, insideLarge, notCombinable), List.of()),
                SEVEN_PM, 7, 90);

        assertThat(result.candidates()).isEmpty();
        assertThat(result.count()).isEqualTo(1);
        TableAssignment assignment = result.best().orElseThrow();
        assertThat(assignment.tableIds()).containsExactly(2L, 1L);
        assertThat(assignment.primaryTable().getId()).isEqualTo(2L);
        assertThat(assignment.joinedTableIds()).containsExactly(1L);
    }

    @Test
    @DisplayName("Two tables are preferred over three, then the smaller surplus")
    void combinationOrdering() {
        DiningTable a = combinableTable(1, 1, 2, "main");
        DiningTable b = combinableTable(2, 1, 2, "main");
        DiningTable c = combinableTable(3, 1, 2, "main");
        DiningTable d = combinableTable(4, 1, 4, "main");

        TableAssignment forFive = resolver.findBestTable(floor(List.of(a, b, c, d), List.of()), SEVEN_PM, 5, 90)
                .orElseThrow();
        assertThat(forFive.tables()).hasSize(2);
        assertThat(forFive.tableIds()).containsExactlyInAnyOrder(4L, 1L);

        TableAssignment forSix = resolver.findBestTable(floor(List.of(a, b, c), List.of()), SEVEN_PM, 6, 90)
                .orElseThrow();
        assertThat(forSix.tableIds()).containsExactlyInAnyOrder(1L, 2L, 3L);
    }

    @Test
    @DisplayName("Staff table pick is honoured only when that table is free and fits")
    void canSeat() {
        DiningTable two = table(1, 1, 2);
        DiningTable four = table(2, 1, 4);
        Booking holding = booking(10, DATE, "19:00", 90, 2, 2L);
        FloorSnapshot floor = floor(List.of(two, four), List.of(holding));

        assertThat(resolver.canSeat(floor, 2L, SEVEN_PM, 2, 90)).isFalse();
        assertThat(resolver.canSeat(floor, 1L, SEVEN_PM, 2, 90)).isTrue();
        assertThat(resolver.canSeat(floor, 1L, SEVEN_PM, 3, 90)).isFalse();
        assertThat(resolver.canSeat(floor, 99L, SEVEN_PM, 2, 90)).isFalse();
    }

    @Test
    @DisplayName("Snapshot loads neighbouring days so midnight-crossing bookings are seen")
    void loadSnapshot() {
        DiningTable only = table(1, 1, 4);
        given(diningTableRepository.findAssignable(RESTAURANT_ID)).willReturn(List.of(only));
        given(bookingStore.findOccupying(eq(RESTAURANT_ID),
                eq(List.of(DATE.minusDays(1), DATE, DATE.plusDays(1))))).willReturn(List.of());

        FloorSnapshot floor = resolver.loadSnapshot(RESTAURANT_ID, DATE);

        assertThat(floor.tables()).containsExactly(only);
        assertThat(floor.bookings()).isEmpty();
    }

    @Test
    @DisplayName("No two bookings returned by repeated best-table picks overlap on a table")
    void nonOverlapSafety() {
        List<DiningTable> tables = List.of(table(1, 1, 4), table(2, 1, 4), combinableTable(3, 1, 2, "g"),
                combinableTable(4, 1, 2, "g"));
        List<Booking> placed = new ArrayList<>();
        long id = 100;
        for (String time : List.of("18:00", "18:30", "19:00", "19:30", "20:00", "18:00", "19:00", "18:30")) {
            FloorSnapshot floor = floor(tables, placed);
            Optional<TableAssignment> best = resolver.findBestTable(floor, LocalTime.parse(time), 3, 90);
            if (best.isPresent()) {
                TableAssignment a = best.get();
                placed.add(booking(id++, DATE, time, 90, 3, a.primaryTable().getId(),
                        a.joinedTableIds().toArray(new Long[0])));
            }
        }

        FloorSnapshot result = floor(tables, placed);
        for (Booking x : placed) {
            for (Booking y : placed) {
                if (x == y) {
                    continue;
                }
                boolean shareTable = x.getJoinedTableIds().stream().anyMatch(y::holdsTable) || y.holdsTable(x.getTableId());
                if (shareTable) {
                    assertThat(FloorSnapshot.overlaps(result.startOf(x), result.endOf(x), result.startOf(y), result.endOf(y)))
                            .as("bookings %d and %d share a table", x.getId(), y.getId())
                            .isFalse();
                }
            }
        }
    }

    private static FloorSnapshot floor(List<DiningTable> tables, List<Booking> bookings) {
        return new FloorSnapshot(RESTAURANT_ID, DATE, tables, bookings);
    }
}
