package com.contacthub.backend.global.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Refuses to finish startup when required settings are missing or still hold the
 * development defaults outside the dev/test profiles.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEV_JWT_SECRET = "contacthub-dev-secret-change-me-contacthub-dev-secret";

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "app.jwt.secret",
            "app.public-base-url"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            String value = environment.getProperty(property);
            if (value == null || value.isBlank()) {
                problems.add(property + " is missing");
            }
        }

        boolean devProfile = Arrays.stream(environment.getActiveProfiles())
                .anyMatch(profile -> profile.equals("dev") || profile.equals("test"));
        Optional<String> jwtSecret = Optional.ofNullable(environment.getProperty("app.jwt.secret"));
        if (!devProfile && jwtSecret.filter(DEV_JWT_SECRET::equals).isPresent()) {
            problems.add("app.jwt.secret still holds the development default");
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration check failed: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join(", ", problems));
        }

        log.info("Configuration check passed");
    }
}
