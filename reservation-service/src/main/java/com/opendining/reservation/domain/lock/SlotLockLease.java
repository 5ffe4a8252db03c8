package com.opendining.reservation.domain.lock;

import java.time.Instant;

/**
 * Proof of holding a slot lock. Only the holder of the token may release it; the lock expires
 * on its own at {@code expiresAt} if the holder never does.
 */
public record SlotLockLease(SlotLockKey key, String token, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
