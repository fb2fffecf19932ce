package com.contacthub.backend.global.ratelimit;

/**
 * Admission control per caller identity and route class. Each call that returns an
 * allowing decision consumes one slot of the budget; check and consume happen atomically.
 */
public interface RateLimiter {

    RateLimitDecision admit(String identityKey, RouteClass routeClass);
}
