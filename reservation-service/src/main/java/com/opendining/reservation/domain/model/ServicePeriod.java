package com.opendining.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.DayOfWeek;
import java.time.LocalTime;

/**
 * A named service window (e.g. lunch, dinner) on one day of the week.
 * A day without any period is a closed day.
 */
@Entity
@Table(name = "service_periods", indexes = {
        @Index(name = "idx_service_periods_restaurant_day", columnList = "restaurant_id,day_of_week")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServicePeriod {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "restaurant_id", nullable = false)
    private Long restaurantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", nullable = false, length = 10)
    private DayOfWeek dayOfWeek;

    @Column(name = "name", nullable = false, length = 50)
    private String name;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    /** Overrides the restaurant slot interval for this period when set. */
    @Column(name = "slot_interval_minutes")
    private Integer slotIntervalMinutes;
}
