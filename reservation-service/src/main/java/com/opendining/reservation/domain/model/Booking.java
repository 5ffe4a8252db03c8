package com.opendining.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Booking entity representing a reserved table for a party.
 *
 * An occupying booking holds its tables for [bookingTime, bookingTime + durationMinutes).
 * occupancyKey is non-null only while the booking occupies its primary table; the unique
 * constraint on it is the storage-level guard against two writers claiming the same table start.
 */
@Entity
@Table(name = "bookings",
        indexes = {
                @Index(name = "idx_bookings_restaurant_date", columnList = "restaurant_id,booking_date"),
                @Index(name = "idx_bookings_status", columnList = "status")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_bookings_occupancy_key", columnNames = "occupancy_key")
        })
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Booking {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "restaurant_id", nullable = false)
    private Long restaurantId;

    @Column(name = "table_id")
    private Long tableId;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "booking_joined_tables", joinColumns = @JoinColumn(name = "booking_id"))
    @Column(name = "table_id", nullable = false)
    private List<Long> joinedTableIds = new ArrayList<>();

    @Column(name = "booking_date", nullable = false)
    private LocalDate bookingDate;

    @Column(name = "booking_time", nullable = false)
    private LocalTime bookingTime;

    @Column(name = "duration_minutes", nullable = false)
    private Integer durationMinutes;

    @Column(name = "party_size", nullable = false)
    private Integer partySize;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 20)
    private BookingSource source;

    @Column(name = "customer_name", nullable = false)
    private String customerName;

    @Column(name = "customer_email")
    private String customerEmail;

    @Column(name = "customer_phone", length = 40)
    private String customerPhone;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "override_pacing", nullable = false)
    private boolean overridePacing;

    @Column(name = "override_reason", length = 500)
    private String overrideReason;

    @Column(name = "occupancy_key", length = 80)
    private String occupancyKey;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
        if (status == null) {
            status = BookingStatus.PENDING;
        }
        refreshOccupancyKey();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
        refreshOccupancyKey();
    }

    public LocalTime endTime() {
        return bookingTime.plusMinutes(durationMinutes);
    }

    /**
     * Start of the occupied interval in minutes since midnight.
     */
    public int startMinute() {
        return bookingTime.toSecondOfDay() / 60;
    }

    /**
     * Exclusive end of the occupied interval in minutes since midnight; may pass 24:00.
     */
    public int endMinute() {
        return startMinute() + durationMinutes;
    }

    public boolean isOccupying() {
        return status == null || status.occupiesTable();
    }

    public boolean holdsTable(Long candidateTableId) {
        return candidateTableId.equals(tableId)
                || (joinedTableIds != null && joinedTableIds.contains(candidateTableId));
    }

    public void refreshOccupancyKey() {
        occupancyKey = (tableId != null && status != null && status.occupiesTable())
                ? tableId + ":" + bookingDate + ":" + bookingTime
                : null;
    }

    public enum BookingStatus {
        PENDING,
        CONFIRMED,
        CANCELLED,
        COMPLETED,
        NO_SHOW,
        /** Queued for a physically full slot; holds no table until promoted. */
        WAITLISTED;

        private static final Set<BookingStatus> NOT_HOLDING_TABLE = EnumSet.of(CANCELLED, NO_SHOW, WAITLISTED);

        public static Set<BookingStatus> notHoldingTable() {
            return EnumSet.copyOf(NOT_HOLDING_TABLE);
        }

        public boolean occupiesTable() {
            return !NOT_HOLDING_TABLE.contains(this);
        }
    }

    public enum BookingSource {
        STAFF,
        WIDGET
    }
}
