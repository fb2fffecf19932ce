package com.contacthub.backend.global.ratelimit;

import java.io.IOException;
import java.util.Optional;

import com.contacthub.backend.global.error.ProblemResponse;
import com.contacthub.backend.global.error.RetryableProblemException;
import com.contacthub.backend.global.web.ClientIdentityResolver;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

/**
 * Gates every routed request on the {@link RateLimiter}. Runs inside the security chain ahead
 * of JWT authentication, so a denied request costs no user lookup and never reaches the
 * controller.
 */
@Component
public class RateLimitFilter extends OncePerRequestFilter {

    static final String REMAINING_HEADER = "X-RateLimit-Remaining";

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    private final RateLimiter rateLimiter;
    private final RouteClassifier routeClassifier;
    private final ClientIdentityResolver identityResolver;
    private final RateLimitProperties properties;
    private final ObjectMapper objectMapper;

    public RateLimitFilter(
            RateLimiter rateLimiter,
            RouteClassifier routeClassifier,
            ClientIdentityResolver identityResolver,
            RateLimitProperties properties,
            ObjectMapper objectMapper
    ) {
        this.rateLimiter = rateLimiter;
        this.routeClassifier = routeClassifier;
        this.identityResolver = identityResolver;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String path = UrlPathHelper.defaultInstance.getPathWithinApplication(request);
        Optional<RouteClass> routeClass = routeClassifier.classify(request.getMethod(), path);
        if (!properties.enabled() || routeClass.isEmpty()) {
            filterChain.doFilter(request, response);
            return;
        }

        String identity = identityResolver.resolve(request);
        RateLimitDecision decision = rateLimiter.admit(identity, routeClass.get());
        if (decision.allowed()) {
            response.setHeader(REMAINING_HEADER, Long.toString(decision.remaining()));
            filterChain.doFilter(request, response);
            return;
        }

        log.warn("Rate limit exceeded for {} on {} ({})", identity, path, routeClass.get());
        RetryableProblemException problem = RetryableProblemException.rateLimited(decision.retryAfter());
        ProblemResponse body = ProblemResponse.of(problem, request.getRequestURI());

        response.setStatus(problem.getHttpStatus().value());
        response.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(problem.getRetryAfterSeconds()));
        response.setHeader(REMAINING_HEADER, "0");
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
