package com.phillippitts.modelelector.presentation.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Static liveness endpoint used by container health checks.
 * Backend-level health is reported separately through {@code /actuator/health}.
 */
@RestController
class HealthController {

    private static final Map<String, String> LIVENESS = Map.of(
            "status", "healthy",
            "service", "elector"
    );

    @GetMapping("/health")
    ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(LIVENESS);
    }
}
