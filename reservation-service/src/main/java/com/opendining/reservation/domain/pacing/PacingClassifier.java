package com.opendining.reservation.domain.pacing;

import com.opendining.reservation.domain.model.PacingLimits;
import com.opendining.reservation.domain.model.PacingStatus;
import org.springframework.stereotype.Component;

/**
 * Turns slot demand and a restaurant's pacing limits into a {@link PacingStatus}.
 *
 * Ladder, first match wins:
 * <ol>
 *   <li>PHYSICALLY_FULL: no table can take the party. Not overridable.</li>
 *   <li>PACING_FULL: admitting the party would push covers past maxCoversPerSlot, or the slot
 *       already holds maxBookingsPerSlot bookings. Overridable by staff with a reason.</li>
 *   <li>BUSY: utilization at or above the busy threshold.</li>
 *   <li>MODERATE: utilization at or above the moderate threshold.</li>
 *   <li>AVAILABLE otherwise.</li>
 * </ol>
 *
 * Utilization is committed covers against the covers ceiling. Restaurants without a covers
 * ceiling are measured by the share of tables occupied at the slot instead.
 */
@Component
public class PacingClassifier {

    public PacingClassification classify(SlotDemand demand, PacingLimits limits) {
        PacingLimits effective = limits != null ? limits : PacingLimits.defaults();
        double utilization = utilizationPercent(demand, effective);

        if (demand.tablesAvailable() <= 0) {
            return new PacingClassification(PacingStatus.PHYSICALLY_FULL, utilization, false);
        }
        if (effective.hasCoversCeiling()
                && demand.committedCovers() + demand.partySize() > effective.getMaxCoversPerSlot()) {
            return new PacingClassification(PacingStatus.PACING_FULL, utilization, true);
        }
        if (effective.hasBookingsCeiling() && demand.committedBookings() >= effective.getMaxBookingsPerSlot()) {
            return new PacingClassification(PacingStatus.PACING_FULL, utilization, true);
        }
        if (utilization >= effective.getBusyThresholdPercent()) {
            return new PacingClassification(PacingStatus.BUSY, utilization, true);
        }
        if (utilization >= effective.getModerateThresholdPercent()) {
            return new PacingClassification(PacingStatus.MODERATE, utilization, true);
        }
        return new PacingClassification(PacingStatus.AVAILABLE, utilization, true);
    }

    /**
     * Not clamped: oversold slots report more than 100.
     */
    public double utilizationPercent(SlotDemand demand, PacingLimits limits) {
        double ratio;
        if (limits.hasCoversCeiling()) {
            ratio = (double) demand.committedCovers() / limits.getMaxCoversPerSlot();
        } else if (demand.totalTables() > 0) {
            ratio = (double) demand.occupiedTables() / demand.totalTables();
        } else {
            ratio = 0;
        }
        return Math.round(Math.max(0, ratio) * 1000) / 10.0;
    }
}
