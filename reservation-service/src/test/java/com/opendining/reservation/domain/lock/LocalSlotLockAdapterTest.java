package com.opendining.reservation.domain.lock;

import com.opendining.reservation.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class LocalSlotLockAdapterTest {

    private static final SlotLockKey KEY = new SlotLockKey(7L, LocalDate.of(2030, 3, 15), LocalTime.of(19, 0));
    private static final Duration LEASE = Duration.ofSeconds(10);

    private final MutableClock clock = new MutableClock(Instant.parse("2030-03-15T12:00:00Z"));
    private final LocalSlotLockAdapter adapter = new LocalSlotLockAdapter(clock);

    @Test
    @DisplayName("Second acquire of a held key fails until the holder releases")
    void exclusive() {
        SlotLockLease first = adapter.tryAcquire(KEY, LEASE).orElseThrow();

        assertThat(adapter.tryAcquire(KEY, LEASE)).isEmpty();
        assertThat(adapter.release(first)).isTrue();
        assertThat(adapter.tryAcquire(KEY, LEASE)).isPresent();
    }

    @Test
    @DisplayName("Different slots lock independently")
    void independentKeys() {
        SlotLockKey otherTime = new SlotLockKey(7L, KEY.date(), LocalTime.of(19, 30));

        assertThat(adapter.tryAcquire(KEY, LEASE)).isPresent();
        assertThat(adapter.tryAcquire(otherTime, LEASE)).isPresent();
    }

    @Test
    @DisplayName("An abandoned lock becomes acquirable after its lease expires")
    void expiry() {
        adapter.tryAcquire(KEY, LEASE).orElseThrow();

        clock.advance(Duration.ofSeconds(9));
        assertThat(adapter.tryAcquire(KEY, LEASE)).isEmpty();

        clock.advance(Duration.ofSeconds(1));
        assertThat(adapter.tryAcquire(KEY, LEASE)).isPresent();
    }

    @Test
    @DisplayName("A stale holder cannot release a lock taken over after expiry")
    void staleReleaseIgnored() {
        SlotLockLease stale = adapter.tryAcquire(KEY, LEASE).orElseThrow();
        clock.advance(LEASE);
        Optional<SlotLockLease> current = adapter.tryAcquire(KEY, LEASE);

        assertThat(current).isPresent();
        assertThat(adapter.release(stale)).isFalse();
        assertThat(adapter.tryAcquire(KEY, LEASE)).isEmpty();
        assertThat(adapter.release(current.get())).isTrue();
    }

    @Test
    @DisplayName("Purge drops only expired leases")
    void purge() {
        adapter.tryAcquire(KEY, Duration.ofSeconds(1)).orElseThrow();
        adapter.tryAcquire(new SlotLockKey(7L, KEY.date(), LocalTime.of(20, 0)), LEASE).orElseThrow();

        clock.advance(Duration.ofSeconds(2));
        adapter.purgeExpired();

        assertThat(adapter.size()).isEqualTo(1);
    }
}
