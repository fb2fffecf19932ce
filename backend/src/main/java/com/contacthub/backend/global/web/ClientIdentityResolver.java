package com.contacthub.backend.global.web;

import com.contacthub.backend.global.ratelimit.RateLimitProperties;
import com.contacthub.backend.modules.auth.application.InvalidTokenException;
import com.contacthub.backend.modules.auth.application.JwtTokenService;
import com.contacthub.backend.modules.auth.domain.TokenPurpose;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Derives the rate-limit identity before any user lookup: the subject of a correctly signed
 * ACCESS token, otherwise the client address. A bad or foreign token is keyed by address.
 * {@code X-Forwarded-For} is only honoured behind a trusted proxy.
 */
@Component
public class ClientIdentityResolver {

    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenService jwtTokenService;
    private final boolean trustForwardedFor;

    public ClientIdentityResolver(JwtTokenService jwtTokenService, RateLimitProperties properties) {
        this.jwtTokenService = jwtTokenService;
        this.trustForwardedFor = properties.trustForwardedFor();
    }

    public String resolve(HttpServletRequest request) {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            try {
                String token = authorization.substring(BEARER_PREFIX.length()).trim();
                return "user:" + jwtTokenService.validate(token, TokenPurpose.ACCESS).subject();
            } catch (InvalidTokenException ignored) {
                // keyed by address below
            }
        }
        return "ip:" + clientAddress(request);
    }

    public String clientAddress(HttpServletRequest request) {
        if (trustForwardedFor) {
            String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
            if (StringUtils.hasText(forwarded)) {
                return forwarded.split(",")[0].trim();
            }
        }
        return request.getRemoteAddr();
    }
}
