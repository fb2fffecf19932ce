package com.contacthub.backend.global.ratelimit;

import java.time.Duration;

/**
 * At most {@code maxRequests} admissions per identity within each fixed {@code window}.
 */
public record RateLimitPolicy(Duration window, int maxRequests) {

    public RateLimitPolicy {
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1");
        }
    }
}
