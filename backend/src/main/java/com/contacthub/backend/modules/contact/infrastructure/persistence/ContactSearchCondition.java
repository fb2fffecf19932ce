package com.contacthub.backend.modules.contact.infrastructure.persistence;

import java.util.UUID;

/**
 * Owner-scoped listing filter. Blank text filters are ignored; the others match
 * case-insensitively anywhere in the field.
 */
public record ContactSearchCondition(
        UUID ownerId,
        String name,
        String surname,
        String email,
        int skip,
        int limit
) {
}
