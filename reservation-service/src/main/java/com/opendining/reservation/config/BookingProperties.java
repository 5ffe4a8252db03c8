package com.opendining.reservation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Booking request limits and report sizes, bound from {@code reservation.booking.*}.
 */
@ConfigurationProperties(prefix = "reservation.booking")
public record BookingProperties(
        @DefaultValue("1") int minPartySize,
        @DefaultValue("50") int maxPartySize,
        @DefaultValue("10") int minOverrideReasonLength,
        @DefaultValue("4") int maxAlternatives,
        @DefaultValue("5") int maxSuggestions
) {

    public static BookingProperties defaults() {
        return new BookingProperties(1, 50, 10, 4, 5);
    }
}
