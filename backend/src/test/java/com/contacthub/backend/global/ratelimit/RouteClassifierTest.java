package com.contacthub.backend.global.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RouteClassifierTest {

    private final RouteClassifier classifier = new RouteClassifier();

    @ParameterizedTest
    @CsvSource({
            "POST, /auth/login, LOGIN",
            "POST, /auth/register, REGISTER",
            "POST, /auth/forgot-password, PASSWORD_RESET",
            "POST, /auth/reset-password/abc, PASSWORD_RESET",
            "POST, /auth/request_email, EMAIL",
            "GET, /auth/confirmed_email/abc, EMAIL",
            "GET, /users/me, PROFILE",
            "PATCH, /users/bob/role, PROFILE",
            "POST, /auth/logout, DEFAULT",
            "GET, /contacts, DEFAULT",
            "GET, /contacts/birthdays, DEFAULT"
    })
    void classifiesRoutes(String method, String path, RouteClass expected) {
        assertThat(classifier.classify(method, path)).contains(expected);
    }

    @Test
    void skipsProbesDocsAndPreflight() {
        assertThat(classifier.classify("GET", "/healthz")).isEmpty();
        assertThat(classifier.classify("GET", "/readyz")).isEmpty();
        assertThat(classifier.classify("GET", "/actuator/health")).isEmpty();
        assertThat(classifier.classify("GET", "/v3/api-docs")).isEmpty();
        assertThat(classifier.classify("OPTIONS", "/auth/login")).isEmpty();
    }
}
