package com.opendining.reservation.domain.availability;

import com.opendining.reservation.domain.assignment.AvailableTables;
import com.opendining.reservation.domain.pacing.PacingClassification;
import com.opendining.reservation.domain.pacing.SlotDemand;

import java.time.LocalTime;

/**
 * Tables and pacing for one party at one slot, computed from a single floor snapshot.
 */
public record SlotEvaluation(LocalTime time, AvailableTables tables, SlotDemand demand,
                             PacingClassification classification) {
}
