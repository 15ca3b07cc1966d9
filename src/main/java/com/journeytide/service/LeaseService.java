package com.journeytide.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Short-lived mutual exclusion across engine instances, backed by Redis.
 *
 * HOW IT WORKS:
 *   1. acquire(key, ttl) does SET key token NX EX ttl
 *   2. If the SET succeeds the caller owns the lease and gets the token back
 *   3. release(key, token) deletes the key only if it still holds our token,
 *      so a lease that expired and was re-taken is left alone
 *
 * Redis being unreachable counts as "not acquired": callers skip the work
 * instead of running it unguarded.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LeaseService {

    private final StringRedisTemplate redisTemplate;

    public static final String SWEEP_LOCK_KEY = "journeys:sweep:lock";
    private static final String ENROLLMENT_PREFIX = "journeys:enroll:";
    private static final String WALK_PREFIX = "journeys:walk:";

    public Optional<String> acquire(String key, Duration ttl) {
        String token = UUID.randomUUID().toString();
        try {
            Boolean wasSet = redisTemplate.opsForValue().setIfAbsent(key, token, ttl);
            if (Boolean.TRUE.equals(wasSet)) {
                return Optional.of(token);
            }
            log.debug("Lease already held: key={}", key);
            return Optional.empty();
        } catch (DataAccessException e) {
            log.error("Lease acquisition failed: key={}, error={}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public void release(String key, String token) {
        if (token == null) {
            return;
        }
        try {
            String holder = redisTemplate.opsForValue().get(key);
            if (token.equals(holder)) {
                redisTemplate.delete(key);
            }
        } catch (DataAccessException e) {
            // the TTL frees it eventually
            log.warn("Lease release failed: key={}, error={}", key, e.getMessage());
        }
    }

    public static String enrollmentKey(Object journeyId, String customerId) {
        return ENROLLMENT_PREFIX + journeyId + ":" + customerId;
    }

    /** Held by whichever worker is walking the enrollment. */
    public static String walkKey(Object enrollmentId) {
        return WALK_PREFIX + enrollmentId;
    }
}
