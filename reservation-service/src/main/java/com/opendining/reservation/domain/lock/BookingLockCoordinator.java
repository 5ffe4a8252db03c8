package com.opendining.reservation.domain.lock;

import com.opendining.common.exception.BusinessException;
import com.opendining.common.exception.ServiceUnavailableException;
import com.opendining.reservation.config.BookingLockProperties;
import com.opendining.reservation.domain.storage.StorageErrorKind;
import com.opendining.reservation.domain.storage.StorageException;
import com.opendining.reservation.exception.BookingLockBusyException;
import com.opendining.reservation.exception.BookingLockInterruptedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.CompositeRetryPolicy;
import org.springframework.retry.policy.ExceptionClassifierRetryPolicy;
import org.springframework.retry.policy.NeverRetryPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.policy.TimeoutRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Serializes booking writes per (restaurant, date, time) slot.
 *
 * Each attempt makes one non-blocking claim on the slot lock, runs the operation and releases
 * the lock with its own token. Contention and transient storage failures are retried with
 * exponential backoff until either the attempt budget or the wait budget runs out; business
 * outcomes and permanent storage failures propagate immediately. The lease outlives the
 * operation timeout, so a crashed holder blocks the slot for at most one lease.
 *
 * Built explicitly from {@link BookingLockProperties} so tests can run it with tight timings.
 */
@Slf4j
public class BookingLockCoordinator {

    private final SlotLockPort slotLockPort;
    private final BookingLockProperties properties;
    private final RetryTemplate retryTemplate;

    public BookingLockCoordinator(SlotLockPort slotLockPort, BookingLockProperties properties) {
        this.slotLockPort = slotLockPort;
        this.properties = properties;
        this.retryTemplate = buildRetryTemplate(properties);
    }

    public BookingLockProperties getProperties() {
        return properties;
    }

    /**
     * Runs the operation while holding the slot lock.
     *
     * @throws BookingLockBusyException        lock still contended when the retry budget ran out
     * @throws BookingLockInterruptedException the calling thread was interrupted while waiting
     */
    public <T> T withLock(Long restaurantId, LocalDate date, LocalTime time, LockedOperation<T> operation) {
        SlotLockKey key = new SlotLockKey(restaurantId, date, time);
        try {
            return retryTemplate.execute((RetryCallback<T, RuntimeException>) context -> runOnce(key, operation, context));
        } catch (BackOffInterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BookingLockInterruptedException(key.asString(), e);
        }
    }

    /**
     * Whether retrying could not change the outcome of the error.
     *
     * Lock contention and transient storage failures (connection, timeout, serialization
     * conflicts) are retryable. Business outcomes, permanent storage failures and anything
     * unrecognized are not.
     */
    public static boolean isNonRetryableError(Throwable error) {
        if (error instanceof BookingLockBusyException || error instanceof ServiceUnavailableException) {
            return false;
        }
        if (error instanceof BusinessException) {
            return true;
        }
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof StorageException storage) {
                return !storage.isRetryable();
            }
            if (current instanceof DataAccessException dataAccess) {
                return !StorageErrorKind.classify(dataAccess).isRetryable();
            }
        }
        return true;
    }

    private <T> T runOnce(SlotLockKey key, LockedOperation<T> operation, RetryContext context) {
        if (Thread.currentThread().isInterrupted()) {
            throw new BookingLockInterruptedException(key.asString(), new InterruptedException());
        }

        SlotLockLease lease = slotLockPort.tryAcquire(key, properties.leaseTime())
                .orElseThrow(() -> new BookingLockBusyException(key.asString()));
        log.debug("Acquired slot lock {} (attempt {})", key, context.getRetryCount() + 1);

        Instant started = Instant.now();
        try {
            return operation.execute();
        } finally {
            Duration elapsed = Duration.between(started, Instant.now());
            if (elapsed.compareTo(properties.leaseTime()) >= 0) {
                log.warn("Operation under slot lock {} took {} ms, longer than the {} ms lease",
                        key, elapsed.toMillis(), properties.leaseTime().toMillis());
            }
            if (slotLockPort.release(lease)) {
                log.debug("Released slot lock {}", key);
            } else {
                log.warn("Slot lock {} was no longer held by this request at release", key);
            }
        }
    }

    private static RetryTemplate buildRetryTemplate(BookingLockProperties properties) {
        SimpleRetryPolicy attempts = new SimpleRetryPolicy(properties.maxAttempts());
        NeverRetryPolicy never = new NeverRetryPolicy();
        ExceptionClassifierRetryPolicy classified = new ExceptionClassifierRetryPolicy();
        classified.setExceptionClassifier(error -> isNonRetryableError(error) ? never : attempts);

        TimeoutRetryPolicy deadline = new TimeoutRetryPolicy();
        deadline.setTimeout(properties.maxWait().toMillis());

        CompositeRetryPolicy policy = new CompositeRetryPolicy();
        policy.setPolicies(new RetryPolicy[]{classified, deadline});

        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(Math.max(1, properties.initialBackoff().toMillis()));
        backOff.setMultiplier(properties.backoffMultiplier());
        backOff.setMaxInterval(Math.max(1, properties.maxBackoff().toMillis()));

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(policy);
        template.setBackOffPolicy(backOff);
        template.registerListener(new RetryListener() {
            @Override
            public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                         Throwable throwable) {
                if (isNonRetryableError(throwable)) {
                    return;
                }
                log.debug("Retrying slot operation after attempt {}: {}",
                        context.getRetryCount(), throwable.getMessage());
            }
        });
        return template;
    }
}
