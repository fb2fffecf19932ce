package com.contacthub.backend.modules.auth.presentation.dto;

import java.util.UUID;

import com.contacthub.backend.modules.auth.domain.UserAccount;
import com.contacthub.backend.modules.auth.domain.UserRole;
import com.contacthub.backend.modules.session.domain.CachedUserProjection;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Public user view. Carries no credential material.
 */
@Schema(description = "Public view of a user account")
public record UserResponse(
        UUID id,
        String username,
        String email,
        boolean verified,
        UserRole role
) {

    public static UserResponse from(UserAccount user) {
        return new UserResponse(user.getId(), user.getUsername(), user.getEmail(), user.isVerified(), user.getRole());
    }

    public static UserResponse from(CachedUserProjection projection) {
        return new UserResponse(
                projection.id(),
                projection.username(),
                projection.email(),
                projection.verified(),
                projection.role()
        );
    }
}
