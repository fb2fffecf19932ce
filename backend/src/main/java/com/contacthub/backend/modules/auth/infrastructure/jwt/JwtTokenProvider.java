package com.contacthub.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;

import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.WeakKeyException;

import org.springframework.stereotype.Component;

/**
 * Process-wide HMAC signing key. A missing or short secret fails startup.
 */
@Component
public class JwtTokenProvider {

    private final SecretKey secretKey;

    public JwtTokenProvider(JwtProperties properties) {
        this.secretKey = buildKey(properties.secret());
    }

    static SecretKey buildKey(String secretString) {
        if (secretString == null || secretString.isBlank()) {
            throw new IllegalStateException("app.jwt.secret must be configured");
        }
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secretString);
        } catch (IllegalArgumentException ex) {
            keyBytes = secretString.getBytes(StandardCharsets.UTF_8);
        }
        try {
            return Keys.hmacShaKeyFor(keyBytes);
        } catch (WeakKeyException ex) {
            throw new IllegalStateException("app.jwt.secret must be at least 256 bits long", ex);
        }
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }
}
