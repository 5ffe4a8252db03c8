package com.opendining.reservation.domain.assignment;

import com.opendining.reservation.domain.model.DiningTable;

import java.util.List;
import java.util.Optional;

/**
 * Free tables for a request, in preference order, and the assignment that would be used.
 *
 * @param candidates single tables that seat the party, best first
 * @param bestAssignment best single table, else best combination, else null
 */
public record AvailableTables(List<DiningTable> candidates, TableAssignment bestAssignment) {

    public AvailableTables {
        candidates = List.copyOf(candidates);
    }

    public static AvailableTables none() {
        return new AvailableTables(List.of(), null);
    }

    public Optional<TableAssignment> best() {
        return Optional.ofNullable(bestAssignment);
    }

    /**
     * Number of assignable options: free single tables, or 1 when only a combination fits.
     */
    public int count() {
        if (!candidates.isEmpty()) {
            return candidates.size();
        }
        return bestAssignment != null ? 1 : 0;
    }

    public boolean isEmpty() {
        return bestAssignment == null;
    }
}
