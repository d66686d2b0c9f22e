package com.deepansh.collab.resilience;

import com.deepansh.collab.config.CollabProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Replays the result of {@code POST /api/v1/sessions} for a retried
 * Idempotency-Key, so a flaky network never creates two rooms.
 *
 * Keys are scoped by caller: collab:idempotency:{userId}:{key}. While the
 * first attempt runs the entry holds a sentinel; afterwards it holds the
 * created session as JSON.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String KEY_PREFIX = "collab:idempotency:";
    private static final String IN_FLIGHT = "__IN_FLIGHT__";

    private final StringRedisTemplate redisTemplate;
    private final Duration ttl;

    public IdempotencyService(StringRedisTemplate redisTemplate, CollabProperties properties) {
        this.redisTemplate = redisTemplate;
        this.ttl = properties.getIdempotency().getTtl();
    }

    /**
     * @return the session JSON stored by an earlier, completed attempt
     */
    public Optional<String> findCreated(String userId, String idempotencyKey) {
        String stored = redisTemplate.opsForValue().get(redisKey(userId, idempotencyKey));
        if (stored == null || IN_FLIGHT.equals(stored)) {
            return Optional.empty();
        }
        log.info("Replaying created session [userId={}, idempotencyKey={}]", userId, idempotencyKey);
        return Optional.of(stored);
    }

    /**
     * Mark an attempt as running (SET NX).
     *
     * @return false when another attempt with the same key is still running
     */
    public boolean begin(String userId, String idempotencyKey) {
        Boolean claimed = redisTemplate.opsForValue().setIfAbsent(redisKey(userId, idempotencyKey), IN_FLIGHT, ttl);
        if (!Boolean.TRUE.equals(claimed)) {
            log.warn("Idempotency key already in flight [userId={}, idempotencyKey={}]", userId, idempotencyKey);
            return false;
        }
        return true;
    }

    public void complete(String userId, String idempotencyKey, String sessionJson) {
        redisTemplate.opsForValue().set(redisKey(userId, idempotencyKey), sessionJson, ttl);
    }

    /** Forget a failed attempt so the client may retry with the same key. */
    public void abandon(String userId, String idempotencyKey) {
        redisTemplate.delete(redisKey(userId, idempotencyKey));
    }

    private static String redisKey(String userId, String idempotencyKey) {
        return KEY_PREFIX + userId + ":" + idempotencyKey;
    }
}
