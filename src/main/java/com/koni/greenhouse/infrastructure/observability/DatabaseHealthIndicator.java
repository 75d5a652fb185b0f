package com.koni.greenhouse.infrastructure.observability;

import com.koni.greenhouse.application.port.StorageHealthProbe;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Health indicator for database connectivity.
 *
 * Returns UP with the probe latency if "SELECT 1" succeeds, DOWN otherwise.
 * Used by the actuator readiness group.
 */
@Slf4j
@Component("database")
@RequiredArgsConstructor
public class DatabaseHealthIndicator implements HealthIndicator {

    private final StorageHealthProbe storageHealthProbe;

    @Override
    public Health health() {
        long start = System.nanoTime();
        try {
            storageHealthProbe.ping();
            long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            log.debug("Database health check passed: latencyMs={}", latencyMs);
            return Health.up()
                    .withDetail("latency_ms", latencyMs)
                    .build();
        } catch (Exception e) {
            log.error("Database health check failed: {}", e.getMessage());
            return Health.down()
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("message", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
