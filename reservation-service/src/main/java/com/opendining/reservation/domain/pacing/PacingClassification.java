package com.opendining.reservation.domain.pacing;

import com.opendining.reservation.domain.model.PacingStatus;

/**
 * @param utilizationPercent may exceed 100 once overridden bookings pass the ceiling
 * @param canOverride        true whenever a physical table exists for the party
 */
public record PacingClassification(PacingStatus status, double utilizationPercent, boolean canOverride) {

    public boolean requiresOverride() {
        return status == PacingStatus.PACING_FULL;
    }
}
