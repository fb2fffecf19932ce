package com.contacthub.backend.modules.auth.application;

import java.util.Optional;

import com.contacthub.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class AuthException extends ProblemException {

    private final AuthFailure failure;

    public AuthException(AuthFailure failure, HttpStatus status, String code, String detail) {
        this(failure, status, code, detail, null);
    }

    public AuthException(AuthFailure failure, HttpStatus status, String code, String detail, Throwable cause) {
        super(status, code, detail, cause);
        this.failure = failure;
    }

    public static AuthException conflict(String detail) {
        return new AuthException(AuthFailure.CONFLICT, HttpStatus.CONFLICT, "CONFLICT", detail);
    }

    public static AuthException userNotFound() {
        return new AuthException(AuthFailure.NOT_FOUND, HttpStatus.NOT_FOUND, "USER_NOT_FOUND", "User not found");
    }

    public static AuthException unverified(HttpStatus status) {
        return new AuthException(AuthFailure.UNVERIFIED, status, "EMAIL_NOT_VERIFIED", "Email is not verified.");
    }

    public static AuthException invalidCredentials() {
        return new AuthException(
                AuthFailure.INVALID_CREDENTIALS,
                HttpStatus.UNAUTHORIZED,
                "INVALID_CREDENTIALS",
                "Invalid email or password."
        );
    }

    public static AuthException invalidToken(String code, String detail, InvalidTokenException cause) {
        return new AuthException(AuthFailure.INVALID_TOKEN, HttpStatus.BAD_REQUEST, code, detail, cause);
    }

    public AuthFailure getFailure() {
        return failure;
    }

    /**
     * The precise token failure behind an {@link AuthFailure#INVALID_TOKEN}, if any.
     */
    public Optional<InvalidTokenException.Reason> getTokenReason() {
        return getCause() instanceof InvalidTokenException tokenException
                ? Optional.of(tokenException.getReason())
                : Optional.empty();
    }
}
