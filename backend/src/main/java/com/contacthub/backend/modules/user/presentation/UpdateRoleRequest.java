package com.contacthub.backend.modules.user.presentation;

import com.contacthub.backend.modules.auth.domain.UserRole;

import jakarta.validation.constraints.NotNull;

public record UpdateRoleRequest(@NotNull(message = "role is required") UserRole role) {
}
