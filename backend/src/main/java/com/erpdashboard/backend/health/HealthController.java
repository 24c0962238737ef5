package com.erpdashboard.backend.health;

import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * liveness / readiness 헬스 체크.
 */
@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final HealthEndpoint healthEndpoint;

    public HealthController(HealthEndpoint healthEndpoint) {
        this.healthEndpoint = healthEndpoint;
    }

    @GetMapping("/")
    public String root() {
        return "ERP Dashboard API is running!";
    }

    /**
     * liveness: 프로세스가 떠 있고 요청을 처리한다.
     */
    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse("UP", Instant.now().toString());
    }

    /**
     * readiness는 카운터 저장소가 의존하는 DB 상태를 따른다. 준비되지 않으면 503을 응답한다.
     */
    @GetMapping("/readyz")
    public ResponseEntity<HealthResponse> readyz() {
        String status = databaseStatus();
        HttpStatus httpStatus = Status.UP.getCode().equals(status) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(httpStatus).body(new HealthResponse(status, Instant.now().toString()));
    }

    private String databaseStatus() {
        try {
            HealthComponent health = healthEndpoint.healthForPath("db");
            if (health == null) {
                health = healthEndpoint.health();
            }
            return health.getStatus().getCode();
        } catch (RuntimeException e) {
            log.warn("Readiness check failed: {}", e.getMessage());
            return Status.DOWN.getCode();
        }
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return healthz();
    }

    public record HealthResponse(String status, String timestamp) {
    }
}
