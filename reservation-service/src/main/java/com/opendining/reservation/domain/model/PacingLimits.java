package com.opendining.reservation.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Soft demand ceilings per slot. Distinct from physical table capacity: a slot may hit its
 * pacing ceiling while tables are still free, in which case staff can override.
 */
@Embeddable
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PacingLimits {
    public static final int DEFAULT_MODERATE_THRESHOLD = 40;
    public static final int DEFAULT_BUSY_THRESHOLD = 70;

    @Builder.Default
    @Column(name = "pacing_moderate_threshold", nullable = false)
    private Integer moderateThresholdPercent = DEFAULT_MODERATE_THRESHOLD;

    @Builder.Default
    @Column(name = "pacing_busy_threshold", nullable = false)
    private Integer busyThresholdPercent = DEFAULT_BUSY_THRESHOLD;

    /** Maximum covers starting at one slot; null means no covers ceiling. */
    @Column(name = "pacing_max_covers_per_slot")
    private Integer maxCoversPerSlot;

    /** Maximum bookings starting at one slot; null means no bookings ceiling. */
    @Column(name = "pacing_max_bookings_per_slot")
    private Integer maxBookingsPerSlot;

    public static PacingLimits defaults() {
        return PacingLimits.builder().build();
    }

    public boolean hasCoversCeiling() {
        return maxCoversPerSlot != null && maxCoversPerSlot > 0;
    }

    public boolean hasBookingsCeiling() {
        return maxBookingsPerSlot != null && maxBookingsPerSlot > 0;
    }
}
