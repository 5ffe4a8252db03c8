package com.opendining.reservation.domain.availability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.opendining.reservation.domain.assignment.TableAssignment;
import com.opendining.reservation.domain.model.PacingStatus;

import java.time.LocalTime;
import java.util.List;

/**
 * One row of an availability report.
 *
 * @param failure set only when the slot could not be evaluated; the other fields are then empty
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SlotAvailability(
        LocalTime time,
        int tablesAvailable,
        PacingStatus status,
        double utilizationPercent,
        int committedCovers,
        int committedBookings,
        boolean canOverride,
        List<LocalTime> alternativeTimes,
        List<Long> suggestedTableIds,
        String failure
) {

    public SlotAvailability {
        alternativeTimes = alternativeTimes == null ? List.of() : List.copyOf(alternativeTimes);
        suggestedTableIds = suggestedTableIds == null ? List.of() : List.copyOf(suggestedTableIds);
    }

    static SlotAvailability of(SlotEvaluation evaluation) {
        return new SlotAvailability(
                evaluation.time(),
                evaluation.tables().count(),
                evaluation.classification().status(),
                evaluation.classification().utilizationPercent(),
                evaluation.demand().committedCovers(),
                evaluation.demand().committedBookings(),
                evaluation.classification().canOverride(),
                List.of(),
                evaluation.tables().best().map(TableAssignment::tableIds).orElse(List.of()),
                null);
    }

    static SlotAvailability failed(LocalTime time, String failure) {
        return new SlotAvailability(time, 0, null, 0, 0, 0, false, List.of(), List.of(), failure);
    }

    SlotAvailability withAlternatives(List<LocalTime> alternatives) {
        return new SlotAvailability(time, tablesAvailable, status, utilizationPercent, committedCovers,
                committedBookings, canOverride, alternatives, suggestedTableIds, failure);
    }

    public boolean isBookable() {
        return failure == null && status != null && status.isBookable();
    }

    public boolean isFailed() {
        return failure != null;
    }
}
