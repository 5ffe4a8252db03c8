package com.opendining.reservation.domain.lock;

import java.time.Duration;
import java.util.Optional;

/**
 * Registry of short-lived exclusive slot claims.
 *
 * Implementations:
 * - RedissonSlotLockAdapter: Redis set-if-absent with TTL, shared by all service instances
 * - LocalSlotLockAdapter: in-process map, for single-node deployments and tests
 */
public interface SlotLockPort {

    /**
     * Single non-blocking attempt; set-if-absent semantics with an expiry.
     *
     * @return the lease, or empty if another holder owns the key
     */
    Optional<SlotLockLease> tryAcquire(SlotLockKey key, Duration leaseTime);

    /**
     * Releases the lock only if it is still held with the lease's token.
     *
     * @return false if the lease had already expired or been taken over
     */
    boolean release(SlotLockLease lease);
}
