package com.notekeeper.api.health;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

/**
 * Liveness for the notes API itself, outside the actuator namespace. Does not touch the database.
 */
@RestController
public class HealthController {

    static final String SERVICE = "notekeeper-api";

    private final Clock clock;

    public HealthController(Clock clock) {
        this.clock = clock;
    }

    @GetMapping("/api/v1/health")
    public Map<String, Object> health() {
        return Map.of(
                "status", "ok",
                "service", SERVICE,
                "ts", clock.instant().toString()
        );
    }
}
