package com.sqlstage.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Process liveness. Does not touch the database; use {@code /api/db/test-connection} for that.
 */
@RestController
public class HealthController {

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of(
                "status", "up",
                "timestamp", Instant.now().toString()
        );
    }
}
