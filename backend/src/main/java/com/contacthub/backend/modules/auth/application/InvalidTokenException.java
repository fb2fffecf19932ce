package com.contacthub.backend.modules.auth.application;

/**
 * Raised by {@link JwtTokenService#validate} with the precise cause, so callers can decide
 * how much of it to reveal.
 */
public class InvalidTokenException extends RuntimeException {

    public enum Reason {
        /** Tampered token or signed with another key. */
        INVALID_SIGNATURE,
        /** Signature holds but the token lifetime has elapsed. */
        EXPIRED,
        /** Signature holds but the token was minted for another use. */
        PURPOSE_MISMATCH,
        /** Not a well-formed signed token. */
        MALFORMED,
        /** Issued before the subject's credentials last changed. */
        REVOKED
    }

    private final Reason reason;

    public InvalidTokenException(Reason reason, String message) {
        this(reason, message, null);
    }

    public InvalidTokenException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
