package com.contacthub.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Objects;

import com.contacthub.backend.modules.auth.domain.TokenPurpose;
import com.contacthub.backend.modules.auth.infrastructure.jwt.JwtProperties;
import com.contacthub.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.contacthub.backend.modules.auth.application.InvalidTokenException.Reason;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import io.jsonwebtoken.security.SignatureException;
import org.springframework.stereotype.Service;

/**
 * Issues and validates compact HS256 JWS tokens for all three purposes. The
 * {@code purpose} claim is checked on every validation, before expiry.
 */
@Service
public class JwtTokenService {

    static final String PURPOSE_CLAIM = "purpose";

    private final JwtTokenProvider tokenProvider;
    private final JwtProperties properties;
    private final Clock clock;
    private final JwtParser parser;

    public JwtTokenService(JwtTokenProvider tokenProvider, JwtProperties properties, Clock clock) {
        this.tokenProvider = tokenProvider;
        this.properties = properties;
        this.clock = clock;
        this.parser = Jwts.parser()
                .verifyWith(tokenProvider.getSecretKey())
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    public IssuedToken issueAccessToken(String username) {
        return issue(TokenPurpose.ACCESS, username, properties.accessTokenTtl());
    }

    public IssuedToken issueEmailVerificationToken(String email) {
        return issue(TokenPurpose.EMAIL_VERIFY, email, properties.emailVerifyTtl());
    }

    public IssuedToken issuePasswordResetToken(String email) {
        return issue(TokenPurpose.PASSWORD_RESET, email, properties.passwordResetTtl());
    }

    public IssuedToken issue(TokenPurpose purpose, String subject, Duration ttl) {
        Objects.requireNonNull(purpose, "purpose");
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be blank");
        }
        if (ttl == null || ttl.getSeconds() < 1) {
            throw new IllegalArgumentException("ttl must be at least one second");
        }

        // JWT timestamps are whole seconds; truncate so exp - iat equals the ttl exactly.
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plusSeconds(ttl.getSeconds());

        String token = Jwts.builder()
                .subject(subject)
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .claim(PURPOSE_CLAIM, purpose.name())
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new IssuedToken(token, purpose, subject, issuedAt, expiresAt);
    }

    public ValidatedToken validate(String token, TokenPurpose expectedPurpose) {
        Objects.requireNonNull(expectedPurpose, "expectedPurpose");
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException(Reason.MALFORMED, "Token is empty");
        }

        Claims claims;
        boolean expiredByParser = false;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException ex) {
            // Thrown only after the signature was verified, so the claims are trustworthy.
            claims = ex.getClaims();
            expiredByParser = true;
        } catch (SignatureException ex) {
            throw new InvalidTokenException(Reason.INVALID_SIGNATURE, "Token signature is invalid", ex);
        } catch (JwtException | IllegalArgumentException ex) {
            throw new InvalidTokenException(Reason.MALFORMED, "Token is malformed", ex);
        }

        TokenPurpose purpose = readPurpose(claims);
        if (purpose != expectedPurpose) {
            throw new InvalidTokenException(
                    Reason.PURPOSE_MISMATCH,
                    "Token purpose " + purpose + " cannot be used as " + expectedPurpose
            );
        }

        String subject = claims.getSubject();
        Date issuedAt = claims.getIssuedAt();
        Date expiresAt = claims.getExpiration();
        if (subject == null || subject.isBlank() || issuedAt == null || expiresAt == null) {
            throw new InvalidTokenException(Reason.MALFORMED, "Token is missing required claims");
        }

        if (expiredByParser || !clock.instant().isBefore(expiresAt.toInstant())) {
            throw new InvalidTokenException(Reason.EXPIRED, "Token has expired");
        }

        return new ValidatedToken(subject, purpose, issuedAt.toInstant(), expiresAt.toInstant());
    }

    private TokenPurpose readPurpose(Claims claims) {
        Object raw = claims.get(PURPOSE_CLAIM);
        if (raw == null) {
            throw new InvalidTokenException(Reason.MALFORMED, "Token carries no purpose");
        }
        try {
            return TokenPurpose.valueOf(raw.toString());
        } catch (IllegalArgumentException ex) {
            throw new InvalidTokenException(Reason.MALFORMED, "Token carries an unknown purpose", ex);
        }
    }

    public Duration getAccessTokenTtl() {
        return properties.accessTokenTtl();
    }

    public record IssuedToken(String token, TokenPurpose purpose, String subject, Instant issuedAt, Instant expiresAt) {
    }

    public record ValidatedToken(String subject, TokenPurpose purpose, Instant issuedAt, Instant expiresAt) {

        /**
         * True when the token predates the given revocation instant. Both sides are compared
         * at second precision because that is all the token carries.
         */
        public boolean issuedBefore(Instant revokedBefore) {
            return revokedBefore != null
                    && issuedAt.isBefore(revokedBefore.truncatedTo(ChronoUnit.SECONDS));
        }

        /**
         * True unless the token was issued in a later second than {@code spentAt}. A token
         * issued in the same second as a credential change counts as spent.
         */
        public boolean issuedNoLaterThan(Instant spentAt) {
            return spentAt != null
                    && !issuedAt.isAfter(spentAt.truncatedTo(ChronoUnit.SECONDS));
        }
    }
}
