package com.deepansh.orchestrator.resilience;

import com.deepansh.orchestrator.model.AgentResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-based idempotency for run requests.
 *
 * A client that retries a run (e.g. after a network timeout) sends the same
 * idempotency key; the cached response is returned instead of running the
 * whole workflow, with all its model and tool calls, a second time.
 *
 * Key pattern: orchestrator:idempotency:{idempotencyKey}
 * TTL: 24 hours
 *
 * Opt-in: requests without a key are always executed fresh. Redis being
 * unavailable disables the cache, never the run.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String KEY_PREFIX = "orchestrator:idempotency:";
    private static final Duration TTL = Duration.ofHours(24);
    // Sentinel stored while the request is in-flight
    static final String IN_FLIGHT_SENTINEL = "__IN_FLIGHT__";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public IdempotencyService(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Returns the cached response for a key seen before, or empty when the
     * caller should execute the run.
     */
    public Optional<AgentResponse> getCachedResponse(String idempotencyKey) {
        String existing;
        try {
            existing = redisTemplate.opsForValue().get(buildKey(idempotencyKey));
        } catch (DataAccessException e) {
            log.warn("Redis unavailable, idempotency check skipped for key={}: {}", idempotencyKey, e.getMessage());
            return Optional.empty();
        }

        if (existing == null) {
            return Optional.empty();
        }
        if (IN_FLIGHT_SENTINEL.equals(existing)) {
            log.warn("Idempotency key {} is in-flight, proceeding anyway", idempotencyKey);
            return Optional.empty();
        }

        try {
            AgentResponse cached = objectMapper.readValue(existing, AgentResponse.class);
            log.info("Idempotency hit for key={}", idempotencyKey);
            return Optional.of(cached);
        } catch (JsonProcessingException e) {
            log.warn("Cached response for key={} is unreadable, proceeding fresh", idempotencyKey);
            return Optional.empty();
        }
    }

    /**
     * Mark key as in-flight atomically (SET NX).
     * Returns true if the claim succeeded.
     */
    public boolean claimKey(String idempotencyKey) {
        try {
            Boolean claimed = redisTemplate.opsForValue()
                    .setIfAbsent(buildKey(idempotencyKey), IN_FLIGHT_SENTINEL, TTL);
            return Boolean.TRUE.equals(claimed);
        } catch (DataAccessException e) {
            log.warn("Redis unavailable, could not claim idempotency key={}: {}", idempotencyKey, e.getMessage());
            return false;
        }
    }

    public void storeResponse(String idempotencyKey, AgentResponse response) {
        try {
            redisTemplate.opsForValue().set(buildKey(idempotencyKey), objectMapper.writeValueAsString(response), TTL);
            log.debug("Stored idempotency response for key={}", idempotencyKey);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize response for idempotency key={}", idempotencyKey, e);
        } catch (DataAccessException e) {
            log.warn("Redis unavailable, response for key={} not cached: {}", idempotencyKey, e.getMessage());
        }
    }

    /**
     * Clean up if the request failed so the client can retry.
     */
    public void releaseKey(String idempotencyKey) {
        try {
            redisTemplate.delete(buildKey(idempotencyKey));
            log.debug("Released idempotency key={}", idempotencyKey);
        } catch (DataAccessException e) {
            log.warn("Redis unavailable, idempotency key={} not released: {}", idempotencyKey, e.getMessage());
        }
    }

    private String buildKey(String idempotencyKey) {
        return KEY_PREFIX + idempotencyKey;
    }
}
