package com.opendining.reservation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Slot lock tuning, bound from {@code reservation.lock.*}.
 *
 * The operation timeout must stay below the lease time so a transaction is abandoned before
 * its lock can expire under it.
 */
@ConfigurationProperties(prefix = "reservation.lock")
public record BookingLockProperties(
        @DefaultValue("redis") String backend,
        @DefaultValue("10s") Duration leaseTime,
        @DefaultValue("3s") Duration maxWait,
        @DefaultValue("50ms") Duration initialBackoff,
        @DefaultValue("2.0") double backoffMultiplier,
        @DefaultValue("500ms") Duration maxBackoff,
        @DefaultValue("8") int maxAttempts,
        @DefaultValue("5s") Duration operationTimeout
) {

    public BookingLockProperties {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("reservation.lock.max-attempts must be at least 1");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("reservation.lock.backoff-multiplier must be at least 1.0");
        }
        if (operationTimeout.compareTo(leaseTime) >= 0) {
            throw new IllegalArgumentException("reservation.lock.operation-timeout (" + operationTimeout
                    + ") must be shorter than reservation.lock.lease-time (" + leaseTime + ")");
        }
    }

    public static BookingLockProperties defaults() {
        return new BookingLockProperties("redis", Duration.ofSeconds(10), Duration.ofSeconds(3),
                Duration.ofMillis(50), 2.0, Duration.ofMillis(500), 8, Duration.ofSeconds(5));
    }
}
