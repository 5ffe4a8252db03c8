package com.opendining.reservation.domain.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-process slot locks for a single node. Same contract as the Redis adapter: set-if-absent
 * with expiry, release only with the acquiring token.
 *
 * Expired entries are replaced on the next acquire; the scheduled purge only keeps the map
 * from growing with slots nobody asks for again.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "reservation.lock.backend", havingValue = "local")
public class LocalSlotLockAdapter implements SlotLockPort {

    private final ConcurrentMap<String, SlotLockLease> leases = new ConcurrentHashMap<>();
    private final Clock clock;

    public LocalSlotLockAdapter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<SlotLockLease> tryAcquire(SlotLockKey key, Duration leaseTime) {
        Instant now = clock.instant();
        SlotLockLease candidate = new SlotLockLease(key, UUID.randomUUID().toString(), now.plus(leaseTime));
        SlotLockLease holder = leases.compute(key.asString(),
                (k, existing) -> existing == null || existing.isExpired(now) ? candidate : existing);
        return holder == candidate ? Optional.of(candidate) : Optional.empty();
    }

    @Override
    public boolean release(SlotLockLease lease) {
        return leases.remove(lease.key().asString(), lease);
    }

    @Scheduled(fixedDelayString = "${reservation.lock.purge-interval-ms:300000}")
    public void purgeExpired() {
        Instant now = clock.instant();
        int before = leases.size();
        leases.values().removeIf(lease -> lease.isExpired(now));
        int purged = before - leases.size();
        if (purged > 0) {
            log.debug("Purged {} expired slot locks", purged);
        }
    }

    int size() {
        return leases.size();
    }
}
