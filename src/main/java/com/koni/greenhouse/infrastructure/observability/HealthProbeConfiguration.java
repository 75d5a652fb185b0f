package com.koni.greenhouse.infrastructure.observability;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pool on which the health check runs its database and broker probes side by side.
 */
@Configuration
public class HealthProbeConfiguration {

    @Bean(name = "healthProbeExecutor", destroyMethod = "shutdown")
    public ExecutorService healthProbeExecutor() {
        return Executors.newFixedThreadPool(4, new CustomizableThreadFactory("health-probe-"));
    }
}
