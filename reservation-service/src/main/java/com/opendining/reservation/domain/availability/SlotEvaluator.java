package com.opendining.reservation.domain.availability;

import com.opendining.reservation.domain.assignment.AvailableTables;
import com.opendining.reservation.domain.assignment.FloorSnapshot;
import com.opendining.reservation.domain.assignment.TableAssignmentResolver;
import com.opendining.reservation.domain.model.Booking;
import com.opendining.reservation.domain.model.DiningTable;
import com.opendining.reservation.domain.model.PacingLimits;
import com.opendining.reservation.domain.pacing.PacingClassification;
import com.opendining.reservation.domain.pacing.PacingClassifier;
import com.opendining.reservation.domain.pacing.SlotDemand;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.List;

/**
 * Combines table assignment and pacing for one slot. Shared by the availability report and the
 * booking path so both see the same answer for the same floor.
 */
@Component
@RequiredArgsConstructor
public class SlotEvaluator {

    private final TableAssignmentResolver tableAssignmentResolver;
    private final PacingClassifier pacingClassifier;

    public SlotEvaluation evaluate(FloorSnapshot floor, PacingLimits limits, LocalTime time,
                                   int partySize, int durationMinutes) {
        AvailableTables tables = tableAssignmentResolver.findAvailableTables(floor, time, partySize, durationMinutes);
        SlotDemand demand = demandAt(floor, time, partySize, tables.count());
        PacingClassification classification = pacingClassifier.classify(demand, limits);
        return new SlotEvaluation(time, tables, demand, classification);
    }

    static SlotDemand demandAt(FloorSnapshot floor, LocalTime time, int partySize, int tablesAvailable) {
        List<Booking> starting = floor.bookingsStartingAt(time);
        int covers = starting.stream().mapToInt(Booking::getPartySize).sum();
        int start = FloorSnapshot.minuteOf(time);
        int totalTables = (int) floor.tables().stream().filter(DiningTable::isAssignable).count();
        return new SlotDemand(tablesAvailable, covers, starting.size(),
                floor.occupiedTableCount(start, start + 1), totalTables, partySize);
    }
}
