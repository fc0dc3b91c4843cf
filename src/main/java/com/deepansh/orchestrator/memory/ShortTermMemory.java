package com.deepansh.orchestrator.memory;

import com.deepansh.orchestrator.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Redis-backed conversation memory for a session.
 *
 * - Key pattern: orchestrator:session:{sessionId}:messages
 * - Stored as a single JSON array, TTL reset on every write
 * - Sliding window: only the last N user/assistant turns are kept
 *
 * Only the conversation itself is stored. Reasoning traces and tool
 * observations belong to one run and are not carried into the next.
 * Redis being down degrades to an empty memory; it never fails a run.
 */
@Component
@Slf4j
public class ShortTermMemory {

    private static final String KEY_PREFIX = "orchestrator:session:";
    private static final String KEY_SUFFIX = ":messages";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Value("${agent.memory.ttl-minutes:60}")
    private long ttlMinutes = 60;

    @Value("${agent.memory.max-messages:20}")
    private int maxMessages = 20;

    public ShortTermMemory(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    public List<Message> load(String sessionId) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(buildKey(sessionId));
        } catch (DataAccessException e) {
            log.warn("Redis unavailable, starting session {} with empty memory: {}", sessionId, e.getMessage());
            return new ArrayList<>();
        }

        if (json == null) {
            log.debug("No conversation memory found for session: {}", sessionId);
            return new ArrayList<>();
        }

        try {
            List<Message> messages = objectMapper.readValue(json, new TypeReference<>() {});
            log.debug("Loaded {} messages for session: {}", messages.size(), sessionId);
            return messages;
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize messages for session: {}. Returning empty.", sessionId, e);
            return new ArrayList<>();
        }
    }

    /**
     * Persist the conversation for a session. System messages are never stored;
     * the reasoning prompt is rebuilt on every run.
     */
    public void save(String sessionId, List<Message> messages) {
        List<Message> windowed = applyWindow(messages.stream()
                .filter(m -> m.getRole() == Message.Role.user || m.getRole() == Message.Role.assistant)
                .toList());
        try {
            String json = objectMapper.writeValueAsString(windowed);
            redisTemplate.opsForValue().set(buildKey(sessionId), json, Duration.ofMinutes(ttlMinutes));
            log.debug("Saved {} messages for session: {} (TTL: {}m)", windowed.size(), sessionId, ttlMinutes);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize messages for session: {}", sessionId, e);
        } catch (DataAccessException e) {
            log.warn("Redis unavailable, conversation for session {} not saved: {}", sessionId, e.getMessage());
        }
    }

    private List<Message> applyWindow(List<Message> messages) {
        if (messages.size() <= maxMessages) {
            return new ArrayList<>(messages);
        }
        List<Message> result = new ArrayList<>(messages.subList(messages.size() - maxMessages, messages.size()));
        log.debug("Applied sliding window: {} → {} messages", messages.size(), result.size());
        return result;
    }

    private String buildKey(String sessionId) {
        return KEY_PREFIX + sessionId + KEY_SUFFIX;
    }
}
