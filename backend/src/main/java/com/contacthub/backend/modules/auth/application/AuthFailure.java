package com.contacthub.backend.modules.auth.application;

/**
 * Expected failure kinds of the account use cases. Each maps to a typed HTTP answer at the
 * boundary; none of them is an internal error. Rate limiting and store outages are answered
 * outside the use cases, by the rate-limit filter and {@code RestExceptionHandler}.
 */
public enum AuthFailure {
    CONFLICT,
    NOT_FOUND,
    UNVERIFIED,
    INVALID_CREDENTIALS,
    INVALID_TOKEN
}
