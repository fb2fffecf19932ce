package com.contacthub.backend.global.ratelimit;

import java.util.Optional;

import org.springframework.stereotype.Component;

/**
 * Maps a request path to the budget it draws from. Health and documentation routes are
 * not rate limited.
 */
@Component
public class RouteClassifier {

    public Optional<RouteClass> classify(String method, String path) {
        if (path == null || "OPTIONS".equalsIgnoreCase(method)) {
            return Optional.empty();
        }
        if (path.startsWith("/actuator") || path.startsWith("/health") || path.equals("/healthz")
                || path.equals("/readyz") || path.startsWith("/v3/api-docs") || path.startsWith("/swagger-ui")) {
            return Optional.empty();
        }
        if (path.equals("/auth/login")) {
            return Optional.of(RouteClass.LOGIN);
        }
        if (path.equals("/auth/register")) {
            return Optional.of(RouteClass.REGISTER);
        }
        if (path.equals("/auth/forgot-password") || path.startsWith("/auth/reset-password/")) {
            return Optional.of(RouteClass.PASSWORD_RESET);
        }
        if (path.equals("/auth/request_email") || path.startsWith("/auth/confirmed_email/")) {
            return Optional.of(RouteClass.EMAIL);
        }
        if (path.startsWith("/users/")) {
            return Optional.of(RouteClass.PROFILE);
        }
        return Optional.of(RouteClass.DEFAULT);
    }
}
