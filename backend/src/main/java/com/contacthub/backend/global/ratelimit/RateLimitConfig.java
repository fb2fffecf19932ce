package com.contacthub.backend.global.ratelimit;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration(proxyBeanMethods = false)
public class RateLimitConfig {

    @Bean
    @ConditionalOnProperty(value = "app.rate-limit.store", havingValue = "redis", matchIfMissing = true)
    public RateLimiter redisRateLimiter(StringRedisTemplate redisTemplate, RateLimitProperties properties) {
        return new RedisRateLimiter(redisTemplate, properties);
    }

    @Bean
    @ConditionalOnProperty(value = "app.rate-limit.store", havingValue = "memory")
    public RateLimiter inMemoryRateLimiter(RateLimitProperties properties, Clock clock) {
        return new InMemoryRateLimiter(properties, clock);
    }
}
