package com.contacthub.backend.modules.session.infrastructure;

import java.time.Clock;

import com.contacthub.backend.modules.session.application.SessionCache;
import com.contacthub.backend.modules.session.application.SessionCacheProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Chooses the session cache store. connect/disconnect follow the application context.
 */
@Configuration(proxyBeanMethods = false)
public class SessionCacheConfig {

    @Bean(initMethod = "connect", destroyMethod = "disconnect")
    @ConditionalOnProperty(value = "app.session-cache.store", havingValue = "redis", matchIfMissing = true)
    public SessionCache redisSessionCache(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            SessionCacheProperties properties
    ) {
        return new RedisSessionCache(redisTemplate, objectMapper, properties.keyPrefix());
    }

    @Bean(initMethod = "connect", destroyMethod = "disconnect")
    @ConditionalOnProperty(value = "app.session-cache.store", havingValue = "memory")
    public SessionCache inMemorySessionCache(Clock clock) {
        return new InMemorySessionCache(clock);
    }
}
