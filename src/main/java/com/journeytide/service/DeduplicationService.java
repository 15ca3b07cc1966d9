package com.journeytide.service;

import com.journeytide.config.JourneyEngineProperties;
import com.journeytide.model.graph.CallbackKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Prevents applying the same messaging callback twice using Redis.
 *
 * HOW IT WORKS:
 *   1. Each callback is keyed by (messageId, kind[, buttonId]), e.g.
 *      "journeys:dedup:wamid.HBg...:read" or "...:button_clicked:yes_btn"
 *   2. SET NX on that key: success → first delivery, failure → duplicate
 *   3. Keys expire after journeys.dedup.ttl-hours
 *
 * The gateway re-delivers webhooks freely, so this runs before any state is
 * read. The router additionally checks that the enrollment is still parked on
 * the sending node, which covers keys that already expired.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeduplicationService {

    private final StringRedisTemplate redisTemplate;
    private final JourneyEngineProperties properties;

    private static final String DEDUP_PREFIX = "journeys:dedup:";

    /**
     * Returns true if this callback was already seen, false if it is new.
     */
    public boolean isDuplicate(String messageId, CallbackKind kind, String buttonId) {
        if (messageId == null || messageId.isBlank()) {
            return false; // nothing to key on, let the state checks decide
        }

        String key = key(messageId, kind, buttonId);
        Duration ttl = Duration.ofHours(properties.getDedup().getTtlHours());

        Boolean wasSet = redisTemplate.opsForValue().setIfAbsent(key, "1", ttl);
        if (Boolean.TRUE.equals(wasSet)) {
            return false;
        }
        log.info("Duplicate callback detected: messageId={}, kind={}, buttonId={}", messageId, kind, buttonId);
        return true;
    }

    /**
     * Clears the key of a callback whose processing failed, so a redelivery
     * is applied instead of being dropped as a duplicate.
     */
    public void clear(String messageId, CallbackKind kind, String buttonId) {
        if (messageId == null || messageId.isBlank()) {
            return;
        }
        redisTemplate.delete(key(messageId, kind, buttonId));
        log.info("Cleared dedup key for redelivery: messageId={}, kind={}", messageId, kind);
    }

    private String key(String messageId, CallbackKind kind, String buttonId) {
        String base = DEDUP_PREFIX + messageId + ":" + kind.name().toLowerCase();
        return buttonId != null && !buttonId.isBlank() ? base + ":" + buttonId : base;
    }
}
