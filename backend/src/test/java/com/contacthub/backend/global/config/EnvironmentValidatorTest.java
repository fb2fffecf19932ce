package com.contacthub.backend.global.config;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    @Test
    void passesWithCompleteProductionSettings() {
        MockEnvironment environment = completeEnvironment()
                .withProperty("app.jwt.secret", "production-secret-production-secret-production");

        assertThatCode(() -> new EnvironmentValidator(environment).validateEnvironment()).doesNotThrowAnyException();
    }

    @Test
    void rejectsDevelopmentSecretOutsideDevProfiles() {
        MockEnvironment environment = completeEnvironment()
                .withProperty("app.jwt.secret", EnvironmentValidator.DEV_JWT_SECRET);

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("development default");
    }

    @Test
    void allowsDevelopmentSecretUnderTestProfile() {
        MockEnvironment environment = completeEnvironment()
                .withProperty("app.jwt.secret", EnvironmentValidator.DEV_JWT_SECRET);
        environment.setActiveProfiles("test");

        assertThatCode(() -> new EnvironmentValidator(environment).validateEnvironment()).doesNotThrowAnyException();
    }

    @Test
    void reportsMissingSettings() {
        MockEnvironment environment = new MockEnvironment();

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("spring.datasource.url is missing")
                .hasMessageContaining("app.public-base-url is missing");
    }

    private static MockEnvironment completeEnvironment() {
        return new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://db/contacthub")
                .withProperty("app.public-base-url", "https://contacthub.example");
    }
}
