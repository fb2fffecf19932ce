package com.contacthub.backend.modules.session.infrastructure;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

import com.contacthub.backend.modules.session.application.SessionCache;
import com.contacthub.backend.modules.session.domain.CachedUserProjection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis-backed cache storing projections as JSON strings with a per-key expiry.
 * Command timeouts come from {@code spring.data.redis.timeout}; a timeout reads as a miss.
 */
public class RedisSessionCache implements SessionCache {

    private static final Logger log = LoggerFactory.getLogger(RedisSessionCache.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private volatile boolean available;

    public RedisSessionCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public void connect() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            available = true;
            log.info("Session cache connected to Redis ({})", pong);
        } catch (DataAccessException ex) {
            available = false;
            log.warn("Session cache unreachable at startup, continuing without it: {}", ex.getMessage());
        }
    }

    @Override
    public void disconnect() {
        available = false;
        log.info("Session cache disconnected");
    }

    @Override
    public void set(String key, CachedUserProjection projection, Duration ttl) {
        Objects.requireNonNull(projection, "projection");
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(projection);
        } catch (JsonProcessingException ex) {
            log.error("Could not serialize cached projection for {}", key, ex);
            return;
        }
        try {
            redisTemplate.opsForValue().set(redisKey(key), json, ttl);
            available = true;
        } catch (DataAccessException ex) {
            available = false;
            log.warn("Session cache write skipped for {}: {}", key, ex.getMessage());
        }
    }

    @Override
    public Optional<CachedUserProjection> get(String key) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(redisKey(key));
            available = true;
        } catch (DataAccessException ex) {
            available = false;
            log.warn("Session cache read failed for {}, treating as miss: {}", key, ex.getMessage());
            return Optional.empty();
        }
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, CachedUserProjection.class));
        } catch (JsonProcessingException ex) {
            log.warn("Dropping undecodable session cache entry for {}", key);
            evict(key);
            return Optional.empty();
        }
    }

    @Override
    public void evict(String key) {
        try {
            redisTemplate.delete(redisKey(key));
            available = true;
        } catch (DataAccessException ex) {
            available = false;
            log.warn("Session cache eviction failed for {}, entry expires with its TTL: {}", key, ex.getMessage());
        }
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    private String redisKey(String key) {
        return keyPrefix + key;
    }
}
