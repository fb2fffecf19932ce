package com.contacthub.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResetPasswordRequest(
        @NotBlank(message = "newPassword is required")
        @Size(min = 6, max = 72, message = "newPassword must be 6-72 characters") String newPassword
) {
}
