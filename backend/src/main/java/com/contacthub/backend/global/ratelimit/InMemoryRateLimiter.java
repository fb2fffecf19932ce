package com.contacthub.backend.global.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import io.github.bucket4j.TimeMeter;

/**
 * One Bucket4j bucket per route class and identity, held in this process. An interval refill
 * of the whole capacity gives fixed windows anchored at the first request. Idle buckets are
 * dropped by Caffeine once the longest window has passed without a request.
 */
public class InMemoryRateLimiter implements RateLimiter {

    private final Cache<String, Bucket> buckets;
    private final RateLimitProperties properties;
    private final TimeMeter timeMeter;

    public InMemoryRateLimiter(RateLimitProperties properties, Clock clock) {
        this.properties = properties;
        this.timeMeter = new ClockTimeMeter(clock);
        this.buckets = Caffeine.newBuilder()
                .expireAfterAccess(properties.longestWindow())
                .ticker(timeMeter::currentTimeNanos)
                .build();
    }

    @Override
    public RateLimitDecision admit(String identityKey, RouteClass routeClass) {
        RateLimitPolicy policy = properties.policyFor(routeClass);
        String key = routeClass.name() + ":" + identityKey;

        Bucket bucket = buckets.get(key, ignored -> newBucket(policy));
        ConsumptionProbe consumption = bucket.tryConsumeAndReturnRemaining(1);
        if (consumption.isConsumed()) {
            return RateLimitDecision.allow(consumption.getRemainingTokens());
        }
        return RateLimitDecision.deny(Duration.ofNanos(consumption.getNanosToWaitForRefill()));
    }

    long trackedBuckets() {
        buckets.cleanUp();
        return buckets.estimatedSize();
    }

    private Bucket newBucket(RateLimitPolicy policy) {
        Bandwidth limit = Bandwidth.classic(
                policy.maxRequests(),
                Refill.intervally(policy.maxRequests(), policy.window())
        );
        return Bucket.builder()
                .addLimit(limit)
                .withCustomTimePrecision(timeMeter)
                .build();
    }

    private static final class ClockTimeMeter implements TimeMeter {

        private final Clock clock;

        private ClockTimeMeter(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long currentTimeNanos() {
            Instant now = clock.instant();
            return TimeUnit.SECONDS.toNanos(now.getEpochSecond()) + now.getNano();
        }

        @Override
        public boolean isWallClockBased() {
            return true;
        }
    }
}
