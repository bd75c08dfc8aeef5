package io.rift.server.web;

import io.rift.server.api.HealthResponse;
import io.rift.server.config.RiftServerProperties;
import io.rift.server.service.HealthService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final HealthService healthService;
    private final String version;

    public HealthController(HealthService healthService, RiftServerProperties props) {
        this.healthService = healthService;
        this.version = props.getVersion();
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        if (healthService.databaseReachable()) {
            return ResponseEntity.ok(HealthResponse.healthy(version));
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(HealthResponse.degraded(version));
    }
}
