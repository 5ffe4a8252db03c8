package com.opendining.reservation.domain.lock;

import com.opendining.common.exception.ServiceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBucket;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Optional;
import java.util.UUID;

/**
 * Slot locks in Redis, shared by every instance of the service.
 *
 * Acquire: SET key token NX PX lease. Release: a Lua compare-and-delete, so a request whose
 * lease already expired cannot delete a lock that a later request now holds.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "reservation.lock.backend", havingValue = "redis", matchIfMissing = true)
public class RedissonSlotLockAdapter implements SlotLockPort {

    static final String RELEASE_SCRIPT =
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('del', KEYS[1]) "
                    + "else return 0 end";

    private final RedissonClient redissonClient;

    @Override
    public Optional<SlotLockLease> tryAcquire(SlotLockKey key, Duration leaseTime) {
        String token = UUID.randomUUID().toString();
        try {
            RBucket<String> bucket = redissonClient.getBucket(key.asString(), StringCodec.INSTANCE);
            if (!bucket.setIfAbsent(token, leaseTime)) {
                log.debug("Slot lock {} is held by another request", key);
                return Optional.empty();
            }
            return Optional.of(new SlotLockLease(key, token, Instant.now().plus(leaseTime)));
        } catch (RedisException e) {
            log.warn("Lock registry unavailable while acquiring {}: {}", key, e.getMessage());
            throw new ServiceUnavailableException("Booking lock registry is unavailable", e);
        }
    }

    @Override
    public boolean release(SlotLockLease lease) {
        try {
            Long deleted = redissonClient.getScript(StringCodec.INSTANCE).eval(
                    RScript.Mode.READ_WRITE,
                    RELEASE_SCRIPT,
                    RScript.ReturnType.INTEGER,
                    Collections.singletonList(lease.key().asString()),
                    lease.token());
            return deleted != null && deleted > 0;
        } catch (RedisException e) {
            // the lease expires on its own
            log.error("Failed to release slot lock {}", lease.key(), e);
            return false;
        }
    }
}
