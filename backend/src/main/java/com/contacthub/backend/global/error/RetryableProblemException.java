package com.contacthub.backend.global.error;

import java.time.Duration;

import org.springframework.http.HttpStatus;

public class RetryableProblemException extends ProblemException {

    private final long retryAfterSeconds;

    public RetryableProblemException(HttpStatus status, String code, String detail, long retryAfterSeconds) {
        super(status, code, detail);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static RetryableProblemException rateLimited(Duration retryAfter) {
        long seconds = Math.max(1L, (retryAfter.toMillis() + 999L) / 1000L);
        return new RetryableProblemException(
                HttpStatus.TOO_MANY_REQUESTS,
                "RATE_LIMITED",
                "Too many requests. Try again later.",
                seconds
        );
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
