package com.contacthub.backend.modules.contact.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.contacthub.backend.modules.contact.domain.Contact;

public record ContactResponse(
        UUID id,
        String name,
        String surname,
        String email,
        String phone,
        LocalDate birthday,
        String notes,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static ContactResponse from(Contact contact) {
        return new ContactResponse(
                contact.getId(),
                contact.getName(),
                contact.getSurname(),
                contact.getEmail(),
                contact.getPhone(),
                contact.getBirthday(),
                contact.getNotes(),
                contact.getCreatedAt(),
                contact.getUpdatedAt()
        );
    }
}
