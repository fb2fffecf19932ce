package com.contacthub.backend.modules.session.domain;

import java.time.Instant;
import java.util.UUID;

import com.contacthub.backend.modules.auth.domain.UserAccount;
import com.contacthub.backend.modules.auth.domain.UserRole;

/**
 * Compact, re-derivable view of an authenticated user. Never the source of truth.
 *
 * @param tokensValidAfter access tokens issued before this instant are rejected; null when
 *                         the credentials never changed
 */
public record CachedUserProjection(
        UUID id,
        String username,
        String email,
        boolean verified,
        UserRole role,
        Instant tokensValidAfter
) {

    public static CachedUserProjection of(UserAccount user) {
        return new CachedUserProjection(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.isVerified(),
                user.getRole(),
                user.getTokensValidAfter() != null ? user.getTokensValidAfter().toInstant() : null
        );
    }
}
