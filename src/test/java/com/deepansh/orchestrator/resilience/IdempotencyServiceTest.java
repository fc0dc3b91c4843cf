package com.deepansh.orchestrator.resilience;

import com.deepansh.orchestrator.model.AgentResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IdempotencyServiceTest {

    @Mock StringRedisTemplate redisTemplate;
    @Mock ValueOperations<String, String> valueOps;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private IdempotencyService service;

    @BeforeEach
    void setUp() {
        service = new IdempotencyService(redisTemplate, objectMapper);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
    }

    @Test
    void getCachedResponse_storedResponse_isReturned() throws Exception {
        AgentResponse stored = AgentResponse.builder().sessionId("s-1").response("cached answer").build();
        when(valueOps.get("orchestrator:idempotency:key-1")).thenReturn(objectMapper.writeValueAsString(stored));

        assertThat(service.getCachedResponse("key-1"))
                .hasValueSatisfying(r -> assertThat(r.getResponse()).isEqualTo("cached answer"));
    }

    @Test
    void getCachedResponse_inFlight_runsFresh() {
        when(valueOps.get("orchestrator:idempotency:key-1")).thenReturn(IdempotencyService.IN_FLIGHT_SENTINEL);

        assertThat(service.getCachedResponse("key-1")).isEmpty();
    }

    @Test
    void getCachedResponse_redisDown_runsFresh() {
        when(valueOps.get(anyString())).thenThrow(new RedisConnectionFailureException("refused"));

        assertThat(service.getCachedResponse("key-1")).isEmpty();
    }

    @Test
    void claimKey_setsSentinelOnlyIfAbsent() {
        when(valueOps.setIfAbsent(eq("orchestrator:idempotency:key-1"), eq(IdempotencyService.IN_FLIGHT_SENTINEL),
                eq(Duration.ofHours(24)))).thenReturn(true);

        assertThat(service.claimKey("key-1")).isTrue();
    }

    @Test
    void storeResponse_writesJsonWithTtl() {
        service.storeResponse("key-1", AgentResponse.builder().response("done").build());

        verify(valueOps).set(eq("orchestrator:idempotency:key-1"), anyString(), eq(Duration.ofHours(24)));
    }
}
