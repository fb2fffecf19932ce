package com.contacthub.backend.global.ratelimit;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Budgets per route class, e.g. {@code app.rate-limit.routes.login.max-requests=5}.
 * Route classes without an entry use the {@code default} entry, or 60 per minute.
 */
@ConfigurationProperties(prefix = "app.rate-limit")
public record RateLimitProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("redis") String store,
        @DefaultValue("rl:") String keyPrefix,
        @DefaultValue("false") boolean trustForwardedFor,
        Map<RouteClass, RateLimitPolicy> routes
) {

    static final RateLimitPolicy FALLBACK_POLICY = new RateLimitPolicy(Duration.ofMinutes(1), 60);

    public RateLimitProperties {
        routes = routes == null ? new EnumMap<>(RouteClass.class) : new EnumMap<>(routes);
    }

    public RateLimitPolicy policyFor(RouteClass routeClass) {
        RateLimitPolicy policy = routes.get(routeClass);
        if (policy != null) {
            return policy;
        }
        return routes.getOrDefault(RouteClass.DEFAULT, FALLBACK_POLICY);
    }

    public Duration longestWindow() {
        Duration longest = FALLBACK_POLICY.window();
        for (RateLimitPolicy policy : routes.values()) {
            if (policy.window().compareTo(longest) > 0) {
                longest = policy.window();
            }
        }
        return longest;
    }
}
