package com.contacthub.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * RFC 7807 style error body shared by every error path, including filters that answer
 * before the dispatcher servlet.
 */
public record ProblemResponse(String type, String title, int status, String detail, String instance, String code) {

    private static final String DEFAULT_TYPE_PREFIX = "https://contacthub.app/errors/";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String normalized = safeCode.toLowerCase().replaceAll("[^a-z0-9\\-_.]+", "-");
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(
                DEFAULT_TYPE_PREFIX + normalized,
                httpStatus.getReasonPhrase(),
                httpStatus.value(),
                safeDetail,
                instance,
                safeCode
        );
    }

    public static ProblemResponse dependencyUnavailable(String instance) {
        return of(
                HttpStatus.SERVICE_UNAVAILABLE,
                "DEPENDENCY_UNAVAILABLE",
                "A required backing service is unavailable. Try again later.",
                instance
        );
    }

    public static ProblemResponse of(ProblemException ex, String instance) {
        return of(ex.getHttpStatus(), ex.getCode(), ex.getDetailMessage(), instance);
    }
}
