package com.cred.freestyle.registration.infrastructure.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Redis-based distributed lock implementation using SET NX EX pattern.
 * Serializes conflicting registration and cancellation requests across application instances.
 *
 * Lock Pattern:
 * - Acquire with a single SET key token NX EX ttl (no check-then-set)
 * - Each acquisition gets a unique token (UUID); only that token can release the key
 * - Release is an atomic compare-and-delete Lua script
 * - TTL expiry frees the key if the holder dies; the database unique constraint covers that gap
 *
 * Failure policy: any Redis error during acquisition is reported as "not acquired",
 * so an unreachable store never lets requests through unserialized.
 *
 * Usage:
 * String token = redisLock.acquireLockWithRetry(key, ttl, waitTimeout, backoff);
 * if (token == null) {
 *     throw new ConcurrentRequestException(key);
 * }
 * try {
 *     // Critical section
 * } finally {
 *     redisLock.releaseLock(key, token);
 * }
 *
 * @author Registration Team
 */
@Service
public class RedisDistributedLock {

    private static final Logger logger = LoggerFactory.getLogger(RedisDistributedLock.class);

    static final String LOCK_PREFIX = "lock:";

    private static final long MAX_BACKOFF_MILLIS = 200;
    private static final long MAX_JITTER_MILLIS = 20;

    static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
            "return redis.call('del', KEYS[1]) " +
            "else return 0 end",
            Long.class
    );

    private final StringRedisTemplate stringRedisTemplate;

    public RedisDistributedLock(StringRedisTemplate stringRedisTemplate) {
        this.stringRedisTemplate = stringRedisTemplate;
    }

    /**
     * Lock key for an apply/enroll on one user's one offering.
     *
     * @param userId User ID
     * @param offeringKey Offering key fragment, e.g. "course:42"
     * @return Lock key, e.g. "lock:registration:user-1:course:42"
     */
    public static String registrationKey(String userId, String offeringKey) {
        return LOCK_PREFIX + "registration:" + userId + ":" + offeringKey;
    }

    /**
     * Lock key for cancelling one payment.
     *
     * @param paymentId Payment ID
     * @return Lock key, e.g. "lock:payment:cancel:7"
     */
    public static String paymentCancelKey(Long paymentId) {
        return LOCK_PREFIX + "payment:cancel:" + paymentId;
    }

    /**
     * Attempt to acquire a distributed lock once.
     *
     * @param lockKey Lock key
     * @param expiry Lock expiry duration (auto-release if holder crashes)
     * @return Lock token (UUID) if acquired, null if held by someone else or Redis failed
     */
    public String acquireLock(String lockKey, Duration expiry) {
        try {
            String lockToken = UUID.randomUUID().toString();

            Boolean acquired = stringRedisTemplate.opsForValue()
                    .setIfAbsent(lockKey, lockToken, expiry);

            if (Boolean.TRUE.equals(acquired)) {
                logger.debug("Acquired lock: {} with token: {}", lockKey, lockToken);
                return lockToken;
            }
            logger.debug("Failed to acquire lock (already held): {}", lockKey);
            return null;
        } catch (Exception e) {
            logger.error("Error acquiring lock for key: {}", lockKey, e);
            return null;
        }
    }

    /**
     * Try to acquire a lock, polling until the wait timeout elapses.
     * Backoff doubles from the initial value up to a small cap, plus jitter.
     *
     * @param lockKey Lock key
     * @param lockExpiry Lock expiry duration
     * @param waitTimeout Maximum time to keep trying
     * @param initialBackoff Initial backoff between attempts
     * @return Lock token if acquired, null if the timeout elapsed or the thread was interrupted
     */
    public String acquireLockWithRetry(
            String lockKey,
            Duration lockExpiry,
            Duration waitTimeout,
            Duration initialBackoff
    ) {
        long deadline = System.nanoTime() + waitTimeout.toNanos();
        long backoffMillis = Math.max(1, initialBackoff.toMillis());
        int attempt = 0;

        while (true) {
            attempt++;
            String lockToken = acquireLock(lockKey, lockExpiry);
            if (lockToken != null) {
                if (attempt > 1) {
                    logger.debug("Acquired lock after {} attempts: {}", attempt, lockKey);
                }
                return lockToken;
            }

            long remainingMillis = Duration.ofNanos(deadline - System.nanoTime()).toMillis();
            if (remainingMillis <= 0) {
                break;
            }

            long sleepMillis = Math.min(backoffMillis * (1L << Math.min(attempt - 1, 10)), MAX_BACKOFF_MILLIS);
            sleepMillis += ThreadLocalRandom.current().nextLong(MAX_JITTER_MILLIS + 1);
            sleepMillis = Math.min(sleepMillis, remainingMillis);

            try {
                Thread.sleep(sleepMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Lock acquisition interrupted for key: {}", lockKey);
                return null;
            }
        }

        logger.warn("Failed to acquire lock after {}ms and {} attempts: {}",
                waitTimeout.toMillis(), attempt, lockKey);
        return null;
    }

    /**
     * Release a distributed lock.
     * Deletes the key only if it still holds the given token. Safe to call after the TTL expired.
     *
     * @param lockKey Lock key
     * @param lockToken Token returned from acquireLock
     * @return true if this call deleted the key, false otherwise
     */
    public boolean releaseLock(String lockKey, String lockToken) {
        if (lockToken == null) {
            return false;
        }
        try {
            Long deleted = stringRedisTemplate.execute(
                    RELEASE_SCRIPT,
                    Collections.singletonList(lockKey),
                    lockToken
            );
            if (deleted != null && deleted > 0) {
                logger.debug("Released lock: {} with token: {}", lockKey, lockToken);
                return true;
            }
            logger.warn("Lock {} was not held by token {} (expired or taken over)", lockKey, lockToken);
            return false;
        } catch (Exception e) {
            logger.error("Error releasing lock for key: {}", lockKey, e);
            return false;
        }
    }
}
