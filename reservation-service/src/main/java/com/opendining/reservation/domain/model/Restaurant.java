package com.opendining.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Restaurant booking configuration consumed read-only by the reservation engine.
 */
@Entity
@Table(name = "restaurants")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Restaurant {
    public static final int DEFAULT_SLOT_INTERVAL_MINUTES = 30;
    public static final int DEFAULT_MAX_ADVANCE_BOOKING_DAYS = 270;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Builder.Default
    @Column(name = "slot_interval_minutes", nullable = false)
    private Integer slotIntervalMinutes = DEFAULT_SLOT_INTERVAL_MINUTES;

    /**
     * Last bookable slot of a period is period end minus this offset.
     */
    @Builder.Default
    @Column(name = "last_seating_offset_minutes", nullable = false)
    private Integer lastSeatingOffsetMinutes = 0;

    @Column(name = "default_turn_time_minutes")
    private Integer defaultTurnTimeMinutes;

    @Builder.Default
    @Column(name = "max_advance_booking_days", nullable = false)
    private Integer maxAdvanceBookingDays = DEFAULT_MAX_ADVANCE_BOOKING_DAYS;

    /**
     * Lets guests queue for a physically full slot instead of being turned away.
     */
    @Builder.Default
    @Column(name = "waitlist_enabled", nullable = false)
    private boolean waitlistEnabled = false;

    @Builder.Default
    @Embedded
    private PacingLimits pacingLimits = PacingLimits.defaults();

    public PacingLimits pacingLimitsOrDefault() {
        return pacingLimits != null ? pacingLimits : PacingLimits.defaults();
    }
}
