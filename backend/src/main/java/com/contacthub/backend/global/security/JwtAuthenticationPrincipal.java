package com.contacthub.backend.global.security;

import java.util.UUID;

import com.contacthub.backend.modules.auth.domain.UserRole;

public record JwtAuthenticationPrincipal(UUID userId, String username, String email, UserRole role) {
}
