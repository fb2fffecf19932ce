package com.contacthub.backend.global.ratelimit;

import java.time.Duration;

public record RateLimitDecision(boolean allowed, long remaining, Duration retryAfter) {

    public static RateLimitDecision allow(long remaining) {
        return new RateLimitDecision(true, Math.max(0L, remaining), Duration.ZERO);
    }

    public static RateLimitDecision deny(Duration retryAfter) {
        return new RateLimitDecision(false, 0L, retryAfter.isNegative() ? Duration.ZERO : retryAfter);
    }
}
