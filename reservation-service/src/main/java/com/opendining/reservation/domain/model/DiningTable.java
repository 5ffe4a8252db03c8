package com.opendining.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A physical table in a restaurant's floor plan.
 * Tables are soft-deleted (deletedAt) so bookings that reference them stay valid.
 */
@Entity
@Table(name = "dining_tables", indexes = {
        @Index(name = "idx_dining_tables_restaurant", columnList = "restaurant_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiningTable {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "restaurant_id", nullable = false)
    private Long restaurantId;

    @Column(name = "label", nullable = false, length = 20)
    private String label;

    @Column(name = "min_capacity", nullable = false)
    private Integer minCapacity;

    @Column(name = "max_capacity", nullable = false)
    private Integer maxCapacity;

    @Builder.Default
    @Column(name = "combinable", nullable = false)
    private boolean combinable = false;

    /**
     * Tables may only be joined with tables of the same group (same room or section).
     */
    @Column(name = "combination_group", length = 50)
    private String combinationGroup;

    @Builder.Default
    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Builder.Default
    @Column(name = "priority", nullable = false)
    private int priority = 0;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    public boolean isAssignable() {
        return active && deletedAt == null;
    }

    public boolean seats(int partySize) {
        return minCapacity <= partySize && partySize <= maxCapacity;
    }

    public boolean canJoinWith(DiningTable other) {
        return combinable && other.combinable && Objects.equals(combinationGroup, other.combinationGroup);
    }
}
