package com.contacthub.backend.modules.auth.infrastructure.jwt;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Signing secret and per-purpose token lifetimes.
 *
 * @param secret           HMAC secret, Base64 or raw UTF-8, at least 256 bits
 * @param accessTokenTtl   lifetime of session access tokens
 * @param emailVerifyTtl   lifetime of email confirmation links
 * @param passwordResetTtl lifetime of password reset links
 */
@ConfigurationProperties(prefix = "app.jwt")
public record JwtProperties(
        String secret,
        @DefaultValue("30m") Duration accessTokenTtl,
        @DefaultValue("7d") Duration emailVerifyTtl,
        @DefaultValue("15m") Duration passwordResetTtl
) {
}
