package com.opendining.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * How long a party of a given size occupies a table.
 */
@Entity
@Table(name = "turn_time_rules", indexes = {
        @Index(name = "idx_turn_time_rules_restaurant", columnList = "restaurant_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnTimeRule {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "restaurant_id", nullable = false)
    private Long restaurantId;

    @Column(name = "name", length = 100)
    private String name;

    @Column(name = "min_party_size", nullable = false)
    private Integer minPartySize;

    @Column(name = "max_party_size", nullable = false)
    private Integer maxPartySize;

    @Column(name = "turn_time_minutes", nullable = false)
    private Integer turnTimeMinutes;

    @Builder.Default
    @Column(name = "priority", nullable = false)
    private int priority = 0;

    @Builder.Default
    @Column(name = "active", nullable = false)
    private boolean active = true;

    public boolean matches(int partySize) {
        return minPartySize <= partySize && partySize <= maxPartySize;
    }

    public int rangeWidth() {
        return maxPartySize - minPartySize;
    }
}
