package com.contacthub.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * A failure that carries a stable machine-readable code next to its HTTP status.
 */
public class ProblemException extends ResponseStatusException {

    private final String code;
    private final String detail;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null, null);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        this(status, code, detail, null);
    }

    public ProblemException(HttpStatus status, String code, String detail, Throwable cause) {
        super(status, code, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public HttpStatus getHttpStatus() {
        return HttpStatus.valueOf(getStatusCode().value());
    }
}
