package com.contacthub.backend.health;

import java.time.Clock;
import java.time.Instant;

import com.contacthub.backend.modules.session.application.SessionCache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and readiness probes: {@code /healthz} only says the process answers,
 * {@code /readyz} also checks the database and reports whether the session cache is reachable.
 */
@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final HealthEndpoint healthEndpoint;
    private final SessionCache sessionCache;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, SessionCache sessionCache, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.sessionCache = sessionCache;
        this.clock = clock;
    }

    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse("UP", null, timestamp());
    }

    /**
     * A cache outage degrades latency only, so it is reported but does not fail readiness.
     */
    @GetMapping("/readyz")
    public ResponseEntity<HealthResponse> readyz() {
        String status;
        try {
            HealthComponent health = healthEndpoint.health();
            status = health.getStatus().getCode();
            if (health instanceof CompositeHealth composite) {
                HealthComponent db = composite.getComponents().get("db");
                if (db != null) {
                    status = db.getStatus().getCode();
                }
            }
        } catch (RuntimeException ex) {
            log.warn("Readiness check failed", ex);
            status = "DOWN";
        }
        String cache = sessionCache.isAvailable() ? "UP" : "DOWN";
        HealthResponse body = new HealthResponse(status, cache, timestamp());
        return "UP".equals(status)
                ? ResponseEntity.ok(body)
                : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return healthz();
    }

    private String timestamp() {
        return Instant.now(clock).toString();
    }

    public record HealthResponse(
            String status,
            String sessionCache,
            String timestamp
    ) {
    }
}
