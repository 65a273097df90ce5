package com.civicdesk.backend.health;

import java.time.Clock;
import java.time.Instant;

import com.civicdesk.backend.modules.authorization.application.AuthorizationSnapshotHolder;

import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and readiness endpoints. Readiness reports DOWN while the database is unreachable.
 */
@RestController
public class HealthController {

    private final HealthEndpoint healthEndpoint;
    private final AuthorizationSnapshotHolder snapshotHolder;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, AuthorizationSnapshotHolder snapshotHolder, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.snapshotHolder = snapshotHolder;
        this.clock = clock;
    }

    @GetMapping({"/health", "/healthz"})
    public HealthResponse health() {
        return new HealthResponse("UP", snapshotHolder.current().version(), Instant.now(clock).toString());
    }

    @GetMapping("/readyz")
    public HealthResponse readyz() {
        String status;
        try {
            HealthComponent component = healthEndpoint.health();
            status = component.getStatus().getCode();
            if (component instanceof CompositeHealth composite
                    && composite.getComponents().get("db") instanceof Health dbHealth) {
                status = dbHealth.getStatus().getCode();
            }
        } catch (RuntimeException ex) {
            status = "DOWN";
        }
        return new HealthResponse(status, snapshotHolder.current().version(), Instant.now(clock).toString());
    }

    public record HealthResponse(String status, long snapshotVersion, String timestamp) {
    }
}
