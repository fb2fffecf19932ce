package com.contacthub.backend.global.ratelimit;

import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

/**
 * Fixed-window counters shared by every instance. The Lua script increments and arms the
 * window expiry in one server-side step, then answers with the remaining budget, or with the
 * negated milliseconds until the window closes once the budget is spent. When Redis cannot be
 * reached the request is admitted and the failure logged.
 */
public class RedisRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RedisRateLimiter.class);

    private static final String FIXED_WINDOW_SCRIPT = """
            local current = redis.call('INCR', KEYS[1])
            if current == 1 then
              redis.call('PEXPIRE', KEYS[1], ARGV[1])
            end
            local limit = tonumber(ARGV[2])
            if current <= limit then
              return limit - current
            end
            local ttl = redis.call('PTTL', KEYS[1])
            if ttl < 0 then
              redis.call('PEXPIRE', KEYS[1], ARGV[1])
              ttl = tonumber(ARGV[1])
            end
            return -math.max(ttl, 1)
            """;

    private static final DefaultRedisScript<Long> SCRIPT = new DefaultRedisScript<>(FIXED_WINDOW_SCRIPT, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final RateLimitProperties properties;

    public RedisRateLimiter(StringRedisTemplate redisTemplate, RateLimitProperties properties) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
    }

    @Override
    public RateLimitDecision admit(String identityKey, RouteClass routeClass) {
        RateLimitPolicy policy = properties.policyFor(routeClass);
        String key = properties.keyPrefix() + routeClass.name().toLowerCase() + ":" + identityKey;

        Long result;
        try {
            result = redisTemplate.execute(
                    SCRIPT,
                    List.of(key),
                    Long.toString(policy.window().toMillis()),
                    Integer.toString(policy.maxRequests())
            );
        } catch (DataAccessException ex) {
            log.warn("Rate limiter store unavailable, admitting {} on {}: {}", identityKey, routeClass, ex.getMessage());
            return RateLimitDecision.allow(policy.maxRequests());
        }
        if (result == null) {
            log.warn("Empty rate limiter reply for {}", key);
            return RateLimitDecision.allow(policy.maxRequests());
        }

        if (result >= 0) {
            return RateLimitDecision.allow(result);
        }
        return RateLimitDecision.deny(Duration.ofMillis(-result));
    }
}
