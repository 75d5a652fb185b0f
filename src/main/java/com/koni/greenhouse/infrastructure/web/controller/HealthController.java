package com.koni.greenhouse.infrastructure.web.controller;

import com.koni.greenhouse.application.query.CheckHealthQuery;
import com.koni.greenhouse.application.query.CheckHealthQueryHandler;
import com.koni.greenhouse.application.query.HealthReport;
import com.koni.greenhouse.infrastructure.web.dto.HealthStatusResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the composite health check.
 *
 * Endpoints:
 * - GET /api/health/status: 200 when database and broker are connected, 503 otherwise
 */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

    private final CheckHealthQueryHandler queryHandler;

    @GetMapping("/status")
    public ResponseEntity<HealthStatusResponse> getStatus() {
        HealthReport report = queryHandler.handle(new CheckHealthQuery());
        HttpStatus status = report.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(HealthStatusResponse.from(report));
    }
}
