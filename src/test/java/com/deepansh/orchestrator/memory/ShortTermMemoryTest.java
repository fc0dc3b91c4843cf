package com.deepansh.orchestrator.memory;

import com.deepansh.orchestrator.model.Message;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ShortTermMemoryTest {

    @Mock StringRedisTemplate redisTemplate;
    @Mock ValueOperations<String, String> valueOps;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ShortTermMemory memory;

    @BeforeEach
    void setUp() {
        memory = new ShortTermMemory(redisTemplate, objectMapper);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
    }

    @Test
    void save_keepsOnlyConversationTurns() throws Exception {
        memory.save("s-1", List.of(
                Message.system("system prompt"),
                Message.user("why is Pump-7 vibrating"),
                Message.tool("Observation: bearing wear"),
                Message.assistant("Check the bearings.")));

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOps).set(eq("orchestrator:session:s-1:messages"), json.capture(), any(Duration.class));
        List<Message> saved = objectMapper.readValue(json.getValue(), new TypeReference<>() {});
        assertThat(saved).extracting(Message::getRole).containsExactly(Message.Role.user, Message.Role.assistant);
    }

    @Test
    void load_roundTripsStoredMessages() throws Exception {
        String stored = objectMapper.writeValueAsString(List.of(Message.user("hello"), Message.assistant("hi")));
        when(valueOps.get("orchestrator:session:s-1:messages")).thenReturn(stored);

        assertThat(memory.load("s-1")).extracting(Message::getContent).containsExactly("hello", "hi");
    }

    @Test
    void load_redisDown_startsEmpty() {
        when(valueOps.get(anyString())).thenThrow(new RedisConnectionFailureException("refused"));

        assertThat(memory.load("s-1")).isEmpty();
    }

    @Test
    void load_corruptJson_startsEmpty() {
        when(valueOps.get(anyString())).thenReturn("{not a list");

        assertThat(memory.load("s-1")).isEmpty();
    }
}
