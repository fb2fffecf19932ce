package com.contacthub.backend.global.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

import com.contacthub.backend.global.error.ProblemResponse;
import com.contacthub.backend.global.web.ClientIdentityResolver;
import com.contacthub.backend.modules.auth.application.JwtTokenService;
import com.contacthub.backend.modules.auth.infrastructure.jwt.JwtProperties;
import com.contacthub.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@ExtendWith(MockitoExtension.class)
class RateLimitFilterTest {

    @Mock
    private RateLimiter rateLimiter;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JwtProperties jwtProperties = new JwtProperties(
            "limit-test-secret-limit-test-secret-limit-test-secret",
            Duration.ofMinutes(30),
            Duration.ofDays(7),
            Duration.ofMinutes(15)
    );
    private final JwtTokenService jwtTokenService =
            new JwtTokenService(new JwtTokenProvider(jwtProperties), jwtProperties, Clock.systemUTC());

    private RateLimitFilter filter;

    @BeforeEach
    void setUp() {
        filter = filterWith(true);
    }

    @Test
    void deniedRequestGets429WithoutReachingController() throws Exception {
        when(rateLimiter.admit("ip:203.0.113.9", RouteClass.LOGIN))
                .thenReturn(RateLimitDecision.deny(Duration.ofMillis(41_200)));
        MockHttpServletRequest request = request("POST", "/auth/login");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(429);
        assertThat(response.getHeader("Retry-After")).isEqualTo("42");
        assertThat(response.getContentType()).startsWith("application/problem+json");
        ProblemResponse body = objectMapper.readValue(response.getContentAsString(), ProblemResponse.class);
        assertThat(body.code()).isEqualTo("RATE_LIMITED");
        assertThat(body.instance()).isEqualTo("/auth/login");
    }

    @Test
    void admittedRequestPassesWithRemainingHeader() throws Exception {
        when(rateLimiter.admit("ip:203.0.113.9", RouteClass.PROFILE)).thenReturn(RateLimitDecision.allow(7));
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("GET", "/users/me"), response, chain);

        assertThat(chain.getRequest()).isNotNull();
        assertThat(response.getHeader(RateLimitFilter.REMAINING_HEADER)).isEqualTo("7");
    }

    @Test
    void unclassifiedRoutesAreNotCounted() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("GET", "/healthz"), new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
        verify(rateLimiter, never()).admit(any(), any());
    }

    @Test
    void disabledLimiterAdmitsEverything() throws Exception {
        RateLimitFilter disabled = filterWith(false);
        MockFilterChain chain = new MockFilterChain();

        disabled.doFilter(request("POST", "/auth/login"), new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
        verify(rateLimiter, never()).admit(any(), any());
    }

    @Test
    void signedBearerTokenIsLimitedPerUser() throws Exception {
        when(rateLimiter.admit("user:alice", RouteClass.PROFILE)).thenReturn(RateLimitDecision.allow(9));
        MockHttpServletRequest request = request("GET", "/users/me");
        request.addHeader("Authorization", "Bearer " + jwtTokenService.issueAccessToken("alice").token());
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    void forgedBearerTokenIsLimitedPerAddressBeforeAuthentication() throws Exception {
        when(rateLimiter.admit("ip:203.0.113.9", RouteClass.PROFILE))
                .thenReturn(RateLimitDecision.deny(Duration.ofSeconds(30)));
        MockHttpServletRequest request = request("GET", "/users/me");
        request.addHeader("Authorization", "Bearer forged.token.value");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(429);
    }

    private RateLimitFilter filterWith(boolean enabled) {
        RateLimitProperties properties = new RateLimitProperties(enabled, "memory", "rl:", false, Map.of());
        return new RateLimitFilter(
                rateLimiter,
                new RouteClassifier(),
                new ClientIdentityResolver(jwtTokenService, properties),
                properties,
                objectMapper
        );
    }

    private static MockHttpServletRequest request(String method, String path) {
        MockHttpServletRequest request = new MockHttpServletRequest(method, path);
        request.setRemoteAddr("203.0.113.9");
        return request;
    }
}
