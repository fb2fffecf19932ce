package com.contacthub.backend.modules.contact.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record ContactRequest(
        @NotBlank @Size(max = 50) String name,
        @NotBlank @Size(max = 50) String surname,
        @NotBlank @Email @Size(max = 320) String email,
        @NotBlank @Size(max = 32) @Pattern(regexp = "^\\+?[0-9 ()\\-]{3,31}$", message = "must be a phone number") String phone,
        @Past LocalDate birthday,
        @Size(max = 500) String notes
) {
}
