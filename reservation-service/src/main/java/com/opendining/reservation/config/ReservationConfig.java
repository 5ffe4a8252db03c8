package com.opendining.reservation.config;

import com.opendining.reservation.domain.lock.BookingLockCoordinator;
import com.opendining.reservation.domain.lock.SlotLockPort;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({BookingLockProperties.class, BookingProperties.class})
public class ReservationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public BookingLockCoordinator bookingLockCoordinator(SlotLockPort slotLockPort, BookingLockProperties properties) {
        return new BookingLockCoordinator(slotLockPort, properties);
    }
}
