package com.contacthub.backend.modules.auth.domain;

/**
 * Intended use of a signed token, carried in the {@code purpose} claim.
 */
public enum TokenPurpose {
    ACCESS,
    EMAIL_VERIFY,
    PASSWORD_RESET
}
