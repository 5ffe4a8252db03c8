package com.opendining.reservation.domain.assignment;

import com.opendining.reservation.domain.model.DiningTable;
import com.opendining.reservation.domain.repository.DiningTableRepository;
import com.opendining.reservation.domain.storage.BookingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Finds free tables for a party at a given time.
 *
 * Called twice on the booking path: without a lock while reporting availability, and again
 * inside the slot lock right before the booking is written.
 *
 * Single tables are preferred and ranked by tightest fit (maxCapacity - partySize), then higher
 * priority, then lowest id. Only when no single table is free are combinable tables of the same
 * group joined (two, then three), ranked by fewer tables, smaller surplus, higher summed
 * priority and lower ids.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableAssignmentResolver {

    static final int MAX_COMBINED_TABLES = 3;

    private final DiningTableRepository diningTableRepository;
    private final BookingStore bookingStore;

    /**
     * Reads the assignable tables and the bookings that may overlap the date. The neighbouring
     * days are included for bookings that cross midnight.
     */
    public FloorSnapshot loadSnapshot(Long restaurantId, LocalDate date) {
        List<DiningTable> tables = diningTableRepository.findAssignable(restaurantId);
        return new FloorSnapshot(restaurantId, date, tables,
                bookingStore.findOccupying(restaurantId, List.of(date.minusDays(1), date, date.plusDays(1))));
    }

    public Optional<TableAssignment> findBestTable(Long restaurantId, LocalDate date, LocalTime time,
                                                   int partySize, int durationMinutes) {
        return findBestTable(loadSnapshot(restaurantId, date), time, partySize, durationMinutes);
    }

    public AvailableTables findAvailableTables(Long restaurantId, LocalDate date, LocalTime time,
                                               int partySize, int durationMinutes) {
        return findAvailableTables(loadSnapshot(restaurantId, date), time, partySize, durationMinutes);
    }

    public Optional<TableAssignment> findBestTable(FloorSnapshot floor, LocalTime time,
                                                   int partySize, int durationMinutes) {
        return findAvailableTables(floor, time, partySize, durationMinutes).best();
    }

    public AvailableTables findAvailableTables(FloorSnapshot floor, LocalTime time,
                                               int partySize, int durationMinutes) {
        int start = FloorSnapshot.minuteOf(time);
        int end = start + durationMinutes;

        List<DiningTable> candidates = floor.tables().stream()
                .filter(DiningTable::isAssignable)
                .filter(t -> t.seats(partySize))
                .filter(t -> floor.isFree(t, start, end))
                .sorted(singleTableOrder(partySize))
                .toList();

        if (!candidates.isEmpty()) {
            return new AvailableTables(candidates, TableAssignment.single(candidates.get(0)));
        }

        Optional<TableAssignment> combination = findCombination(floor, start, end, partySize);
        combination.ifPresent(c -> log.debug("No single table for party {} at {} on {}, combining tables {}",
                partySize, time, floor.date(), c.tableIds()));
        return combination.map(c -> new AvailableTables(List.of(), c)).orElseGet(AvailableTables::none);
    }

    /**
     * Whether a specific table can take the party for the interval; used to honour a staff
     * member's table pick.
     */
    public boolean canSeat(FloorSnapshot floor, Long tableId, LocalTime time, int partySize, int durationMinutes) {
        int start = FloorSnapshot.minuteOf(time);
        return floor.tables().stream()
                .filter(t -> Objects.equals(t.getId(), tableId))
                .anyMatch(t -> t.isAssignable() && t.seats(partySize) && floor.isFree(t, start, start + durationMinutes));
    }

    static Comparator<DiningTable> singleTableOrder(int partySize) {
        return Comparator.<DiningTable>comparingInt(t -> t.getMaxCapacity() - partySize)
                .thenComparing(Comparator.comparingInt(DiningTable::getPriority).reversed())
                .thenComparing(DiningTable::getId);
    }

    static Comparator<TableAssignment> combinationOrder(int partySize) {
        return Comparator.<TableAssignment>comparingInt(a -> a.tables().size())
                .thenComparingInt(a -> a.totalMaxCapacity() - partySize)
                .thenComparing(Comparator.comparingInt(TableAssignment::totalPriority).reversed())
                .thenComparing(TableAssignmentResolver::compareIds);
    }

    private Optional<TableAssignment> findCombination(FloorSnapshot floor, int start, int end, int partySize) {
        Map<String, List<DiningTable>> freeByGroup = floor.tables().stream()
                .filter(DiningTable::isAssignable)
                .filter(DiningTable::isCombinable)
                .filter(t -> t.getMinCapacity() <= partySize)
                .filter(t -> floor.isFree(t, start, end))
                .sorted(Comparator.comparing(DiningTable::getId))
                .collect(Collectors.groupingBy(t -> Objects.toString(t.getCombinationGroup(), ""),
                        LinkedHashMap::new, Collectors.toList()));

        for (int size = 2; size <= MAX_COMBINED_TABLES; size++) {
            List<TableAssignment> options = new ArrayList<>();
            for (List<DiningTable> group : freeByGroup.values()) {
                collectCombinations(group, size, 0, new ArrayList<>(), partySize, options);
            }
            if (!options.isEmpty()) {
                return options.stream().min(combinationOrder(partySize));
            }
        }
        return Optional.empty();
    }

    private void collectCombinations(List<DiningTable> group, int size, int from, List<DiningTable> current,
                                     int partySize, List<TableAssignment> out) {
        if (current.size() == size) {
            int capacity = current.stream().mapToInt(DiningTable::getMaxCapacity).sum();
            if (capacity >= partySize) {
                out.add(new TableAssignment(orderForPrimary(current)));
            }
            return;
        }
        for (int i = from; i < group.size(); i++) {
            current.add(group.get(i));
            collectCombinations(group, size, i + 1, current, partySize, out);
            current.remove(current.size() - 1);
        }
    }

    /**
     * The largest table hosts the party; the rest are joined to it.
     */
    private List<DiningTable> orderForPrimary(List<DiningTable> tables) {
        return tables.stream()
                .sorted(Comparator.comparingInt(DiningTable::getMaxCapacity).reversed()
                        .thenComparing(DiningTable::getId))
                .toList();
    }

    private static int compareIds(TableAssignment a, TableAssignment b) {
        List<Long> left = a.tableIds().stream().sorted().toList();
        List<Long> right = b.tableIds().stream().sorted().toList();
        for (int i = 0; i < Math.min(left.size(), right.size()); i++) {
            int cmp = left.get(i).compareTo(right.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(left.size(), right.size());
    }
}
