package com.opendining.reservation.domain.lock;

/**
 * Unit of work run while holding a slot lock. It may run more than once when a transient
 * failure is retried, so it must re-read everything it validates.
 */
@FunctionalInterface
public interface LockedOperation<T> {
    T execute();
}
