package com.contacthub.backend.modules.session.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import com.contacthub.backend.modules.auth.domain.UserRole;
import com.contacthub.backend.modules.session.domain.CachedUserProjection;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class RedisSessionCacheTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private ObjectMapper objectMapper;
    private RedisSessionCache cache;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        cache = new RedisSessionCache(redisTemplate, objectMapper, "user:");
    }

    @Test
    void storesJsonUnderPrefixedKeyWithTtl() throws Exception {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        CachedUserProjection alice = alice();

        cache.set("alice", alice, Duration.ofHours(1));

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("user:alice"), json.capture(), eq(Duration.ofHours(1)));
        assertThat(objectMapper.readValue(json.getValue(), CachedUserProjection.class)).isEqualTo(alice);
        assertThat(cache.isAvailable()).isTrue();
    }

    @Test
    void readsStoredProjection() throws Exception {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        CachedUserProjection alice = alice();
        when(valueOperations.get("user:alice")).thenReturn(objectMapper.writeValueAsString(alice));

        assertThat(cache.get("alice")).contains(alice);
    }

    @Test
    void connectionFailureReadsAsMiss() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("refused"));

        assertThat(cache.get("alice")).isEmpty();
        assertThat(cache.isAvailable()).isFalse();
    }

    @Test
    void writeFailureIsSwallowed() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        doThrow(new RedisConnectionFailureException("refused"))
                .when(valueOperations).set(anyString(), anyString(), any(Duration.class));

        cache.set("alice", alice(), Duration.ofHours(1));

        assertThat(cache.isAvailable()).isFalse();
    }

    @Test
    void undecodableEntryIsDroppedAndMissed() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("user:alice")).thenReturn("{not json");

        assertThat(cache.get("alice")).isEmpty();
        verify(redisTemplate).delete("user:alice");
    }

    @Test
    void evictionFailureIsSwallowed() {
        when(redisTemplate.delete(anyString())).thenThrow(new RedisConnectionFailureException("refused"));

        cache.evict("alice");

        assertThat(cache.isAvailable()).isFalse();
    }

    private static CachedUserProjection alice() {
        return new CachedUserProjection(
                UUID.fromString("00000000-0000-0000-0000-000000000001"),
                "alice",
                "alice@example.com",
                true,
                UserRole.USER,
                Instant.parse("2025-01-01T00:00:00Z")
        );
    }
}
