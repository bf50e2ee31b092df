package com.di.insightnova.health;

import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

    private final HealthService healthService;

    @GetMapping(value = "/pipeline", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PipelineHealth> pipeline() {
        return ResponseEntity.ok(healthService.pipelineHealth());
    }

    /** Always 200; the body's {@code status} carries healthy / degraded / unhealthy. */
    @GetMapping(value = "/system", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SystemHealth> system() {
        return ResponseEntity.ok(healthService.systemHealth());
    }
}
