package com.contacthub.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record EmailRequest(
        @NotBlank(message = "email is required")
        @Email(message = "email must be a valid address") String email
) {
}
